package fr.imt.shellbridge.shellbridge.business.model;

import fr.imt.shellbridge.shellbridge.exception.ShellbridgeException;

/**
 * Result of a connect attempt. Failures are carried here instead of being thrown.
 */
public record ConnectionOutcome(boolean success, String message, ConnectionId connectionId, String errorCode) {

    public static final String CONNECTED_MESSAGE = "Successfully connected and authenticated";

    public static ConnectionOutcome connected(ConnectionId connectionId) {
        return new ConnectionOutcome(true, CONNECTED_MESSAGE, connectionId, null);
    }

    public static ConnectionOutcome failed(ShellbridgeException cause) {
        return new ConnectionOutcome(false, describe(cause), null, cause.getErrorCode());
    }

    private static String describe(Throwable error) {
        Throwable cause = error.getCause();
        if (cause == null || cause.getMessage() == null || cause.getMessage().isBlank()) {
            return error.getMessage();
        }
        return error.getMessage() + ": " + cause.getMessage();
    }
}
