package fr.imt.shellbridge.shellbridge.exception;

/**
 * Exception thrown when the TCP connection or SSH session setup fails.
 */
public class SshConnectionException extends ShellbridgeException {

    private static final String ERROR_CODE = "SSH_ERR";

    public SshConnectionException(String message) {
        super(ERROR_CODE, message);
    }

    public SshConnectionException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    public SshConnectionException(String host, int port, Throwable cause) {
        super(ERROR_CODE, "Failed to establish TCP connection to " + host + ":" + port, cause);
    }
}
