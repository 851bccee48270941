package fr.imt.shellbridge.shellbridge.business.service;

import fr.imt.shellbridge.shellbridge.business.model.ChannelOutput;
import fr.imt.shellbridge.shellbridge.business.model.CommandResult;
import fr.imt.shellbridge.shellbridge.business.model.ShellSession;
import fr.imt.shellbridge.shellbridge.business.utils.CommandLines;
import fr.imt.shellbridge.shellbridge.configuration.ShellbridgeProperties;
import fr.imt.shellbridge.shellbridge.exception.SshConnectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Runs commands against a {@link ShellSession} as if the remote shell remembered its
 * working directory between calls.
 * <p>
 * Callers must hold the session's registry lock: execution reads and writes the tracked directory.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommandExecutor {

    private final ShellbridgeProperties properties;

    public CommandResult execute(ShellSession session, String rawCommand) {
        boolean directoryChange = CommandLines.isDirectoryChange(rawCommand);
        String commandLine = directoryChange
                ? CommandLines.directoryChange(rawCommand)
                : CommandLines.inDirectory(session.getCurrentDirectory(), rawCommand, properties.getCommand().getQuoting());

        log.debug("[EXEC] {}", commandLine);

        ChannelOutput output;
        try {
            output = session.getTransport().exec(commandLine, true, properties.getCommand().getTimeout());
        } catch (IOException e) {
            log.warn("[EXEC] Command could not be dispatched: {}", e.getMessage());
            return CommandResult.dispatchFailure(e.getMessage(), session.getCurrentDirectory());
        }

        if (directoryChange && output.isSuccess()) {
            session.setCurrentDirectory(output.stdout().strip());
            // The pwd output only feeds the tracked directory
            return new CommandResult("", output.stderr(), output.exitStatus(), session.getCurrentDirectory());
        }

        return new CommandResult(output.stdout(), output.stderr(), output.exitStatus(), session.getCurrentDirectory());
    }

    /**
     * Runs {@code pwd} on a fresh channel and stores the result as the session's directory.
     * <p>
     * Behavior change: a non-zero {@code pwd} exit fails the connect instead of storing
     * whatever it printed, so a session never starts from an unverified directory.
     *
     * @throws SshConnectionException if the probe cannot run or exits non-zero
     */
    public void probeWorkingDirectory(ShellSession session) {
        ChannelOutput output;
        try {
            output = session.getTransport().exec(CommandLines.PWD, false, properties.getCommand().getTimeout());
        } catch (IOException e) {
            throw new SshConnectionException("Initial working directory probe failed", e);
        }
        if (!output.isSuccess()) {
            throw new SshConnectionException("Initial working directory probe exited with status " + output.exitStatus());
        }
        session.setCurrentDirectory(output.stdout().strip());
    }
}
