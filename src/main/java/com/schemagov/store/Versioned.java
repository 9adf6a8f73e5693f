package com.schemagov.store;

import java.util.Objects;

/**
 * A stored value together with its optimistic concurrency token. Versions start at 1 and grow by one per write.
 */
public record Versioned<T>(long version, T value) {
    public Versioned {
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
        Objects.requireNonNull(value, "value");
    }
}
