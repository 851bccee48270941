package fr.imt.shellbridge.shellbridge.exception;

/**
 * Exception thrown when an operation references a connection id absent from the registry.
 */
public class ConnectionNotFoundException extends ShellbridgeException {

    private static final String ERROR_CODE = "NOT_FOUND";

    public ConnectionNotFoundException(String connectionId) {
        super(ERROR_CODE, "Connection not found: " + connectionId + ". Please connect first.");
    }
}
