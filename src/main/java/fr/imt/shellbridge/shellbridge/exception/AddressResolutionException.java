package fr.imt.shellbridge.shellbridge.exception;

/**
 * Exception thrown when a host name does not resolve to an IPv4 address.
 */
public class AddressResolutionException extends ShellbridgeException {

    private static final String ERROR_CODE = "RESOLVE_ERR";

    public AddressResolutionException(String host) {
        super(ERROR_CODE, "Failed to resolve IPv4 address for " + host);
    }

    public AddressResolutionException(String host, Throwable cause) {
        super(ERROR_CODE, "Failed to resolve IPv4 address for " + host, cause);
    }
}
