package fr.imt.shellbridge.shellbridge.business.service.identity;

import fr.imt.shellbridge.shellbridge.business.model.ConnectionConfig;
import fr.imt.shellbridge.shellbridge.business.model.ConnectionId;

/**
 * Derives the registry key for a new connection.
 */
@FunctionalInterface
public interface ConnectionIdStrategy {

    ConnectionId derive(ConnectionConfig config);

}
