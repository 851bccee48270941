package fr.imt.shellbridge.shellbridge.business.service;

import fr.imt.shellbridge.shellbridge.business.model.ChannelOutput;
import fr.imt.shellbridge.shellbridge.business.port.TransportSession;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory stand-in for a remote shell that understands the command lines the executor builds.
 * Every exec starts in {@code home}, like a real SSH exec channel.
 */
class ScriptedTransportSession implements TransportSession {

    private static final Pattern CD_AND_PWD = Pattern.compile("^cd (.*) && pwd$");
    private static final Pattern IN_DIRECTORY = Pattern.compile("^cd '([^']*)' && (.*)$");

    private final String home;
    private final Set<String> directories;
    private final List<String> commandLines = new CopyOnWriteArrayList<>();
    private final List<Boolean> ptyRequests = new CopyOnWriteArrayList<>();

    private volatile boolean open = true;
    private volatile IOException failure;

    ScriptedTransportSession(String home, Set<String> directories) {
        this.home = home;
        this.directories = directories;
    }

    @Override
    public ChannelOutput exec(String commandLine, boolean pty, Duration timeout) throws IOException {
        commandLines.add(commandLine);
        ptyRequests.add(pty);
        if (failure != null) {
            throw failure;
        }

        Matcher inDirectory = IN_DIRECTORY.matcher(commandLine);
        if (inDirectory.matches()) {
            return run(inDirectory.group(2), inDirectory.group(1));
        }

        Matcher cd = CD_AND_PWD.matcher(commandLine);
        if (cd.matches()) {
            String target = cd.group(1).isBlank() ? home : cd.group(1);
            if (!directories.contains(target)) {
                return new ChannelOutput("", "cd: " + target + ": No such file or directory\r\n", 1);
            }
            return new ChannelOutput(target + "\r\n", "", 0);
        }
        return run(commandLine, home);
    }

    private ChannelOutput run(String command, String directory) {
        if (command.equals("pwd")) {
            return new ChannelOutput(directory + "\n", "", 0);
        }
        if (command.equals("false")) {
            return new ChannelOutput("", "", 1);
        }
        return new ChannelOutput("ran " + command + "\n", "", 0);
    }

    void failWith(IOException failure) {
        this.failure = failure;
    }

    List<String> commandLines() {
        return commandLines;
    }

    String lastCommandLine() {
        return commandLines.get(commandLines.size() - 1);
    }

    List<Boolean> ptyRequests() {
        return ptyRequests;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }
}
