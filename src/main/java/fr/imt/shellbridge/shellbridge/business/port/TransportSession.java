package fr.imt.shellbridge.shellbridge.business.port;

import fr.imt.shellbridge.shellbridge.business.model.ChannelOutput;
import fr.imt.shellbridge.shellbridge.exception.CommandTimeoutException;

import java.io.IOException;
import java.time.Duration;

/**
 * One authenticated SSH connection. Every {@link #exec} call runs on a fresh channel,
 * so no shell state survives from one call to the next.
 */
public interface TransportSession extends AutoCloseable {

    /**
     * Runs a command line on a new exec channel and waits for it to finish.
     *
     * @param commandLine the full command line handed to the remote shell
     * @param pty         whether to request a pseudo-terminal first
     * @param timeout     how long to wait for the channel to close; zero or negative waits forever
     * @return captured stdout, stderr and exit status
     * @throws IOException             if the channel cannot be opened or fails mid-flight
     * @throws CommandTimeoutException if the timeout elapses first
     */
    ChannelOutput exec(String commandLine, boolean pty, Duration timeout) throws IOException;

    boolean isOpen();

    /**
     * Closes the underlying SSH session. Never throws.
     */
    @Override
    void close();
}
