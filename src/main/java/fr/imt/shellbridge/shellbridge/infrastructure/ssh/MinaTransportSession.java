package fr.imt.shellbridge.shellbridge.infrastructure.ssh;

import fr.imt.shellbridge.shellbridge.business.model.ChannelOutput;
import fr.imt.shellbridge.shellbridge.business.model.CommandResult;
import fr.imt.shellbridge.shellbridge.business.port.TransportSession;
import fr.imt.shellbridge.shellbridge.configuration.ShellbridgeProperties;
import fr.imt.shellbridge.shellbridge.exception.CommandTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.apache.sshd.client.channel.ChannelExec;
import org.apache.sshd.client.channel.ClientChannelEvent;
import org.apache.sshd.client.session.ClientSession;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Implements {@link TransportSession} over an authenticated MINA {@link ClientSession}.
 * One {@link ChannelExec} is opened per call.
 */
@Slf4j
public class MinaTransportSession implements TransportSession {

    private final ClientSession session;
    private final ShellbridgeProperties.Command settings;

    public MinaTransportSession(ClientSession session, ShellbridgeProperties.Command settings) {
        this.session = session;
        this.settings = settings;
    }

    @Override
    public ChannelOutput exec(String commandLine, boolean pty, Duration timeout) throws IOException {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();

        try (ChannelExec channel = session.createExecChannel(commandLine)) {
            channel.setUsePty(pty);
            if (pty) {
                channel.setPtyType(settings.getPtyType());
            }
            channel.setOut(stdout);
            channel.setErr(stderr);

            channel.open().verify(settings.getChannelOpenTimeout().toMillis());

            // MINA waits forever for a non-positive timeout
            long waitMillis = timeout == null || timeout.isNegative() ? 0L : timeout.toMillis();
            Set<ClientChannelEvent> events = channel.waitFor(EnumSet.of(ClientChannelEvent.CLOSED), waitMillis);
            if (events.contains(ClientChannelEvent.TIMEOUT)) {
                channel.close(true);
                throw new CommandTimeoutException(timeout);
            }

            Integer exitStatus = channel.getExitStatus();
            if (exitStatus == null) {
                log.debug("[SSH] Channel closed without an exit status");
            }
            return new ChannelOutput(
                    stdout.toString(StandardCharsets.UTF_8),
                    stderr.toString(StandardCharsets.UTF_8),
                    exitStatus == null ? CommandResult.DISPATCH_FAILURE : exitStatus);
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close();
            log.debug("[SSH] Session closed");
        } catch (IOException e) {
            log.debug("[SSH] Session close failed: {}", e.getMessage());
        }
    }
}
