package fr.imt.shellbridge.shellbridge.business.service;

import fr.imt.shellbridge.shellbridge.business.model.ConnectionId;
import fr.imt.shellbridge.shellbridge.business.model.ShellSession;
import fr.imt.shellbridge.shellbridge.configuration.ShellbridgeProperties;
import fr.imt.shellbridge.shellbridge.exception.ConnectionNotFoundException;
import fr.imt.shellbridge.shellbridge.exception.RegistryLockException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owns every live {@link ShellSession}, keyed by {@link ConnectionId}.
 * <p>
 * Locking is per entry: commands on different connections run in parallel, commands on the
 * same connection run one at a time. The map itself is a {@link ConcurrentHashMap}, so
 * insert, remove and listing never wait on an in-flight command.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    private final Map<ConnectionId, Entry> entries = new ConcurrentHashMap<>();

    private final Duration lockTimeout;

    public ConnectionRegistry(ShellbridgeProperties properties) {
        this.lockTimeout = properties.getRegistry().getLockTimeout();
    }

    /**
     * Registers a session. A session already registered under the same id is closed.
     */
    public void insert(ConnectionId id, ShellSession session) {
        Entry previous = entries.put(id, new Entry(session));
        if (previous != null) {
            log.warn("[REGISTRY] Connection {} replaced, closing the previous session", id);
            previous.session().close();
        }
        log.info("[REGISTRY] Connection {} registered ({} active)", id, entries.size());
    }

    /**
     * Runs {@code action} against the session while holding its entry lock.
     *
     * @throws ConnectionNotFoundException if no session is registered under {@code id}, or it was
     *                                     removed while waiting for the lock
     * @throws RegistryLockException       if the lock cannot be acquired
     */
    public <T> T withSession(ConnectionId id, Function<ShellSession, T> action) {
        Entry entry = lookup(id);
        acquire(id, entry.lock());
        try {
            if (entries.get(id) != entry) {
                throw new ConnectionNotFoundException(id.value());
            }
            return action.apply(entry.session());
        } finally {
            entry.lock().unlock();
        }
    }

    /**
     * @throws ConnectionNotFoundException if no session is registered under {@code id}
     */
    public String directoryOf(ConnectionId id) {
        return withSession(id, ShellSession::getCurrentDirectory);
    }

    /**
     * Removes and closes a session.
     *
     * @return whether a session was registered under {@code id}
     */
    public boolean remove(ConnectionId id) {
        Entry entry = entries.remove(id);
        if (entry == null) {
            return false;
        }
        try {
            acquire(id, entry.lock());
            try {
                entry.session().close();
            } finally {
                entry.lock().unlock();
            }
        } catch (RegistryLockException e) {
            // Closing the transport aborts the command that still holds the lock
            log.warn("[REGISTRY] {}, closing connection {} anyway", e.getMessage(), id);
            entry.session().close();
        }
        log.info("[REGISTRY] Connection {} removed ({} active)", id, entries.size());
        return true;
    }

    public List<ConnectionId> listIds() {
        return List.copyOf(entries.keySet());
    }

    @PreDestroy
    public void closeAll() {
        if (entries.isEmpty()) {
            return;
        }
        log.info("[REGISTRY] Closing {} connection(s)", entries.size());
        entries.keySet().forEach(id -> {
            Entry entry = entries.remove(id);
            if (entry != null) {
                entry.session().close();
            }
        });
    }

    private Entry lookup(ConnectionId id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            throw new ConnectionNotFoundException(id.value());
        }
        return entry;
    }

    private void acquire(ConnectionId id, ReentrantLock lock) {
        try {
            if (lockTimeout.isZero() || lockTimeout.isNegative()) {
                lock.lockInterruptibly();
            } else if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new RegistryLockException(id.value(), lockTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryLockException("Interrupted while waiting for connection " + id, e);
        }
    }

    private record Entry(ShellSession session, ReentrantLock lock) {

        Entry(ShellSession session) {
            this(session, new ReentrantLock());
        }
    }
}
