package fr.imt.shellbridge.shellbridge.exception;

/**
 * Exception thrown when a connection request is rejected before any network attempt.
 */
public class ConnectionConfigException extends ShellbridgeException {

    private static final String ERROR_CODE = "CONFIG_ERR";

    public ConnectionConfigException(String message) {
        super(ERROR_CODE, message);
    }
}
