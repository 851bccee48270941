package fr.imt.shellbridge.shellbridge.exception;

/**
 * Exception thrown when SSH key exchange or host key verification fails.
 */
public class HandshakeException extends ShellbridgeException {

    private static final String ERROR_CODE = "HANDSHAKE_ERR";

    public HandshakeException(String host, int port, Throwable cause) {
        super(ERROR_CODE, "SSH handshake failed with " + host + ":" + port, cause);
    }
}
