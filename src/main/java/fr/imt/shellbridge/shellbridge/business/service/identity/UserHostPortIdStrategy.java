package fr.imt.shellbridge.shellbridge.business.service.identity;

import fr.imt.shellbridge.shellbridge.business.model.ConnectionConfig;
import fr.imt.shellbridge.shellbridge.business.model.ConnectionId;

/**
 * {@code username@host:port}. Two connects with the same triple share one id,
 * so the second replaces the first in the registry.
 */
public class UserHostPortIdStrategy implements ConnectionIdStrategy {

    @Override
    public ConnectionId derive(ConnectionConfig config) {
        return new ConnectionId(String.format("%s@%s:%d", config.getUsername(), config.getHost(), config.getPort()));
    }
}
