package fr.imt.shellbridge.shellbridge.exception;

/**
 * Root of the connection and session failures. The error code travels to the connect
 * outcome and to the HTTP error body unchanged.
 */
public class ShellbridgeException extends RuntimeException {

    private final String errorCode;

    public ShellbridgeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ShellbridgeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
