package fr.imt.shellbridge.shellbridge.business.service.identity;

import fr.imt.shellbridge.shellbridge.business.model.ConnectionConfig;
import fr.imt.shellbridge.shellbridge.business.model.ConnectionId;

import java.util.concurrent.atomic.AtomicLong;

/**
 * {@code username@host:port#n}, with {@code n} increasing per connect, so repeated
 * connects to the same endpoint each keep their own session.
 */
public class UniqueConnectionIdStrategy implements ConnectionIdStrategy {

    private final ConnectionIdStrategy base;
    private final AtomicLong sequence = new AtomicLong();

    public UniqueConnectionIdStrategy(ConnectionIdStrategy base) {
        this.base = base;
    }

    @Override
    public ConnectionId derive(ConnectionConfig config) {
        return new ConnectionId(base.derive(config).value() + "#" + sequence.incrementAndGet());
    }
}
