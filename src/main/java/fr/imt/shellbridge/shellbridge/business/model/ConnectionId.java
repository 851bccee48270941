package fr.imt.shellbridge.shellbridge.business.model;

import java.util.Objects;

/**
 * Opaque handle for a registered connection. Callers keep it and hand it back; they never parse it.
 */
public record ConnectionId(String value) {

    public ConnectionId {
        Objects.requireNonNull(value, "Connection id must not be null");
    }

    @Override
    public String toString() {
        return value;
    }
}
