package fr.imt.shellbridge.shellbridge.business.port;

import fr.imt.shellbridge.shellbridge.business.model.ConnectionConfig;
import fr.imt.shellbridge.shellbridge.exception.AddressResolutionException;
import fr.imt.shellbridge.shellbridge.exception.AuthenticationException;
import fr.imt.shellbridge.shellbridge.exception.HandshakeException;
import fr.imt.shellbridge.shellbridge.exception.SshConnectionException;

/**
 * Opens authenticated SSH transports.
 * Abstraction layer over the SSH library, enabling independent testing.
 */
public interface SecureShellTransportPort {

    /**
     * Resolves the host, connects, performs the handshake and authenticates.
     * Nothing is left open when this method throws.
     *
     * @throws AddressResolutionException if the host has no IPv4 address
     * @throws SshConnectionException     if the TCP connection cannot be established
     * @throws HandshakeException         if key exchange or host key verification fails
     * @throws AuthenticationException    if the credentials are rejected or the key cannot be loaded
     */
    TransportSession open(ConnectionConfig config);
}
