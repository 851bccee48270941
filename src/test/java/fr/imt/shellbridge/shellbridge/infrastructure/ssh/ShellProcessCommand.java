package fr.imt.shellbridge.shellbridge.infrastructure.ssh;

import org.apache.sshd.server.Environment;
import org.apache.sshd.server.ExitCallback;
import org.apache.sshd.server.channel.ChannelSession;
import org.apache.sshd.server.command.Command;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Server-side exec command for the embedded test server: runs the request through
 * {@code /bin/sh -c} and reports its exit code.
 */
class ShellProcessCommand implements Command {

    private final String command;
    private OutputStream out;
    private OutputStream err;
    private ExitCallback exitCallback;
    private Process process;
    private Thread pump;

    ShellProcessCommand(String command) {
        this.command = command;
    }

    @Override
    public void setInputStream(InputStream in) {
        // commands under test never read stdin
    }

    @Override
    public void setOutputStream(OutputStream out) {
        this.out = out;
    }

    @Override
    public void setErrorStream(OutputStream err) {
        this.err = err;
    }

    @Override
    public void setExitCallback(ExitCallback callback) {
        this.exitCallback = callback;
    }

    @Override
    public void start(ChannelSession channel, Environment env) throws IOException {
        process = new ProcessBuilder("/bin/sh", "-c", command).start();
        pump = new Thread(this::pumpAndExit, "test-exec-" + process.pid());
        pump.setDaemon(true);
        pump.start();
    }

    private void pumpAndExit() {
        int exitCode;
        try {
            out.write(process.getInputStream().readAllBytes());
            out.flush();
            err.write(process.getErrorStream().readAllBytes());
            err.flush();
            exitCode = process.waitFor();
        } catch (IOException e) {
            exitCode = 255;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exitCode = 130;
        }
        exitCallback.onExit(exitCode);
    }

    @Override
    public void destroy(ChannelSession channel) {
        if (process != null) {
            process.destroyForcibly();
        }
        if (pump != null) {
            pump.interrupt();
        }
    }
}
