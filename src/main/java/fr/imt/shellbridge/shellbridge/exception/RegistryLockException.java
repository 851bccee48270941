package fr.imt.shellbridge.shellbridge.exception;

import java.time.Duration;

/**
 * Exception thrown when a connection entry lock cannot be acquired.
 * This is an infrastructure condition, not a user error.
 */
public class RegistryLockException extends ShellbridgeException {

    private static final String ERROR_CODE = "LOCK_ERR";

    public RegistryLockException(String connectionId, Duration waited) {
        super(ERROR_CODE, "Connection " + connectionId + " is busy, lock not acquired within " + waited);
    }

    public RegistryLockException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
