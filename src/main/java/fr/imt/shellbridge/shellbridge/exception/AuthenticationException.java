package fr.imt.shellbridge.shellbridge.exception;

/**
 * Exception thrown when the server rejects the supplied credentials
 * or the private key cannot be loaded.
 */
public class AuthenticationException extends ShellbridgeException {

    private static final String ERROR_CODE = "AUTH_ERR";

    public AuthenticationException(String message) {
        super(ERROR_CODE, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
