package fr.imt.shellbridge.shellbridge.business.service;

import fr.imt.shellbridge.shellbridge.business.model.CommandResult;
import fr.imt.shellbridge.shellbridge.business.model.ConnectionConfig;
import fr.imt.shellbridge.shellbridge.business.model.ConnectionId;
import fr.imt.shellbridge.shellbridge.business.model.ConnectionOutcome;
import fr.imt.shellbridge.shellbridge.business.model.ShellSession;
import fr.imt.shellbridge.shellbridge.business.port.SecureShellTransportPort;
import fr.imt.shellbridge.shellbridge.business.port.SessionEventPublisherPort;
import fr.imt.shellbridge.shellbridge.business.port.TransportSession;
import fr.imt.shellbridge.shellbridge.business.service.identity.ConnectionIdStrategy;
import fr.imt.shellbridge.shellbridge.exception.ConnectionConfigException;
import fr.imt.shellbridge.shellbridge.exception.ConnectionNotFoundException;
import fr.imt.shellbridge.shellbridge.exception.ShellbridgeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for connection lifecycle and command execution.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RemoteShellService {

    static final int MAX_PORT = 65535;

    private final SecureShellTransportPort transportPort;
    private final CommandExecutor commandExecutor;
    private final ConnectionRegistry registry;
    private final ConnectionIdStrategy connectionIdStrategy;
    private final SessionEventPublisherPort eventPublisher;

    /**
     * Opens, authenticates and registers a connection.
     * Connection failures are reported in the outcome, never thrown.
     */
    public ConnectionOutcome connect(ConnectionConfig config) {
        TransportSession transport;
        try {
            validate(config);
            log.info("[SSH] Connecting to {}@{}:{} with {} authentication", config.getUsername(), config.getHost(),
                    config.getPort(), config.usesPassword() ? "password" : "key");
            transport = transportPort.open(config);
        } catch (ShellbridgeException e) {
            log.warn("[SSH] Connection to {}:{} failed: {}", config.getHost(), config.getPort(), e.getMessage());
            return ConnectionOutcome.failed(e);
        }

        ShellSession session = new ShellSession(transport);
        try {
            commandExecutor.probeWorkingDirectory(session);
        } catch (ShellbridgeException e) {
            log.warn("[SSH] Connection to {}:{} failed: {}", config.getHost(), config.getPort(), e.getMessage());
            session.close();
            return ConnectionOutcome.failed(e);
        }

        ConnectionId id = connectionIdStrategy.derive(config);
        registry.insert(id, session);
        log.info("[SSH] Connection {} established, working directory {}", id, session.getCurrentDirectory());
        eventPublisher.publish(id.value(), "CONNECTED");
        return ConnectionOutcome.connected(id);
    }

    /**
     * Runs a command on a registered connection. A failing remote command is a normal result.
     *
     * @throws ConnectionNotFoundException if the connection is not registered
     */
    public CommandResult execute(String connectionId, String command) {
        ConnectionId id = new ConnectionId(connectionId);
        CommandResult result = registry.withSession(id, session -> commandExecutor.execute(session, command));
        eventPublisher.publish(id.value(), "EXECUTED|" + result.exitStatus());
        return result;
    }

    /**
     * @throws ConnectionNotFoundException if the connection is not registered
     */
    public String getDirectory(String connectionId) {
        return registry.directoryOf(new ConnectionId(connectionId));
    }

    public boolean disconnect(String connectionId) {
        boolean removed = registry.remove(new ConnectionId(connectionId));
        if (removed) {
            eventPublisher.publish(connectionId, "DISCONNECTED");
        }
        return removed;
    }

    public List<String> listConnections() {
        return registry.listIds().stream()
                .map(ConnectionId::value)
                .toList();
    }

    private void validate(ConnectionConfig config) {
        if (config.getHost() == null || config.getHost().isBlank()) {
            throw new ConnectionConfigException("Host is required");
        }
        if (config.getUsername() == null || config.getUsername().isBlank()) {
            throw new ConnectionConfigException("Username is required");
        }
        if (config.getPort() < 1 || config.getPort() > MAX_PORT) {
            throw new ConnectionConfigException("Port must be between 1 and " + MAX_PORT + ", got " + config.getPort());
        }
        if (!config.usesPassword() && !config.usesPrivateKey()) {
            throw new ConnectionConfigException(
                    "No authentication method provided (password or private_key_path required)");
        }
        if (config.usesPassword() && config.usesPrivateKey()) {
            throw new ConnectionConfigException(
                    "Ambiguous authentication method (provide either password or private_key_path, not both)");
        }
    }
}
