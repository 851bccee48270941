package fr.imt.shellbridge.shellbridge.exception;

import java.time.Duration;

/**
 * Exception thrown when a remote command outlives the configured command timeout.
 */
public class CommandTimeoutException extends ShellbridgeException {

    private static final String ERROR_CODE = "TIMEOUT_ERR";

    public CommandTimeoutException(Duration timeout) {
        super(ERROR_CODE, "Remote command did not complete within " + timeout);
    }
}
