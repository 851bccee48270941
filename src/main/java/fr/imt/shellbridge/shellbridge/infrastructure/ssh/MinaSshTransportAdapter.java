package fr.imt.shellbridge.shellbridge.infrastructure.ssh;

import fr.imt.shellbridge.shellbridge.business.model.ConnectionConfig;
import fr.imt.shellbridge.shellbridge.business.port.SecureShellTransportPort;
import fr.imt.shellbridge.shellbridge.business.port.TransportSession;
import fr.imt.shellbridge.shellbridge.configuration.ShellbridgeProperties;
import fr.imt.shellbridge.shellbridge.exception.AddressResolutionException;
import fr.imt.shellbridge.shellbridge.exception.AuthenticationException;
import fr.imt.shellbridge.shellbridge.exception.HandshakeException;
import fr.imt.shellbridge.shellbridge.exception.ShellbridgeException;
import fr.imt.shellbridge.shellbridge.exception.SshConnectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.future.ConnectFuture;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.client.session.ClientSession.ClientSessionEvent;
import org.apache.sshd.common.NamedResource;
import org.apache.sshd.common.SshConstants;
import org.apache.sshd.common.SshException;
import org.apache.sshd.common.config.keys.FilePasswordProvider;
import org.apache.sshd.common.util.security.SecurityUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Implements {@link SecureShellTransportPort} using the Apache Mina SSHD library
 * https://github.com/apache/mina-sshd
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MinaSshTransportAdapter implements SecureShellTransportPort {

    private final SshClient sshClient;
    private final ShellbridgeProperties properties;

    @Override
    public TransportSession open(ConnectionConfig config) {
        InetSocketAddress address = resolveIpv4(config.getHost(), config.getPort());
        ClientSession session = connect(config, address);
        try {
            authenticate(session, config);
        } catch (ShellbridgeException e) {
            closeQuietly(session);
            throw e;
        }
        log.info("[SSH] Authenticated {}@{}:{}", config.getUsername(), config.getHost(), config.getPort());
        return new MinaTransportSession(session, properties.getCommand());
    }

    /**
     * Resolves the host and keeps the first IPv4 address.
     */
    InetSocketAddress resolveIpv4(String host, int port) {
        InetAddress[] candidates;
        try {
            candidates = InetAddress.getAllByName(host);
        } catch (UnknownHostException e) {
            throw new AddressResolutionException(host, e);
        }
        return Arrays.stream(candidates)
                .filter(Inet4Address.class::isInstance)
                .findFirst()
                .map(address -> new InetSocketAddress(address, port))
                .orElseThrow(() -> new AddressResolutionException(host));
    }

    private ClientSession connect(ConnectionConfig config, InetSocketAddress address) {
        try {
            ConnectFuture future = sshClient.connect(config.getUsername(), address);
            future.verify(properties.getSsh().getConnectTimeout().toMillis());
            return future.getSession();
        } catch (IOException | RuntimeException e) {
            throw new SshConnectionException(config.getHost(), config.getPort(), e);
        }
    }

    /**
     * Waits for key exchange, then adds the configured identity and runs user authentication.
     * A session that closes or stalls before reaching the authentication stage, or a failure
     * carrying a key exchange or host key disconnect code, is a handshake failure.
     */
    private void authenticate(ClientSession session, ConnectionConfig config) {
        long authTimeoutMillis = properties.getSsh().getAuthTimeout().toMillis();
        Set<ClientSessionEvent> state = session.waitFor(
                EnumSet.of(ClientSessionEvent.WAIT_AUTH, ClientSessionEvent.CLOSED), authTimeoutMillis);
        if (state.contains(ClientSessionEvent.CLOSED) || !state.contains(ClientSessionEvent.WAIT_AUTH)) {
            throw new HandshakeException(config.getHost(), config.getPort(),
                    new SshException("Key exchange did not complete, session state " + state));
        }

        String method;
        if (config.usesPassword()) {
            method = "Password";
            session.addPasswordIdentity(config.getPassword());
        } else {
            method = "Key";
            session.addPublicKeyIdentity(loadKeyPair(session, config.getPrivateKeyPath(), config.effectivePassphrase()));
        }

        try {
            session.auth().verify(authTimeoutMillis);
        } catch (IOException | RuntimeException e) {
            if (isHandshakeFailure(e)) {
                throw new HandshakeException(config.getHost(), config.getPort(), e);
            }
            throw new AuthenticationException(method + " authentication failed", e);
        }
    }

    static boolean isHandshakeFailure(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SshException) {
                int code = ((SshException) t).getDisconnectCode();
                if (code == SshConstants.SSH2_DISCONNECT_KEY_EXCHANGE_FAILED
                        || code == SshConstants.SSH2_DISCONNECT_HOST_KEY_NOT_VERIFIABLE) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Decodes the first key pair of an OpenSSH or PEM private key file. Decoding errors,
     * including a wrong or missing passphrase, are reported with their cause.
     */
    private KeyPair loadKeyPair(ClientSession session, String privateKeyPath, String passphrase) {
        Path keyFile = Path.of(privateKeyPath);
        if (!Files.isReadable(keyFile)) {
            throw new AuthenticationException("Key authentication failed: private key file " + privateKeyPath + " is not readable");
        }

        FilePasswordProvider passwordProvider = passphrase == null
                ? FilePasswordProvider.EMPTY
                : FilePasswordProvider.of(passphrase);

        Iterable<KeyPair> keys;
        try (InputStream in = Files.newInputStream(keyFile)) {
            keys = SecurityUtils.loadKeyPairIdentities(session, NamedResource.ofName(privateKeyPath), in, passwordProvider);
        } catch (IOException | GeneralSecurityException e) {
            throw new AuthenticationException("Key authentication failed: cannot load " + privateKeyPath, e);
        }

        Iterator<KeyPair> iterator = keys == null ? null : keys.iterator();
        if (iterator == null || !iterator.hasNext()) {
            throw new AuthenticationException("Key authentication failed: no key found in " + privateKeyPath);
        }
        return iterator.next();
    }

    private void closeQuietly(ClientSession session) {
        try {
            session.close();
        } catch (IOException e) {
            log.debug("[SSH] Failed to close half-open session: {}", e.getMessage());
        }
    }
}
