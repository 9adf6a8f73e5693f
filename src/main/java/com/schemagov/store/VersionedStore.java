package com.schemagov.store;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Key/value store with per-key compare-and-swap. All state-changing governance operations go through
 * {@link #compareAndSet(String, long, Object)} so concurrent writers on the same key cannot lose updates.
 */
public interface VersionedStore<T> {
    int MAX_UPDATE_ATTEMPTS = 32;

    Optional<Versioned<T>> get(String key) throws IOException;

    Versioned<T> getOrCreate(String key, Supplier<T> initialValue) throws IOException;

    /**
     * Writes {@code value} only if the key is still at {@code expectedVersion}. An expected version of 0 means
     * the key must be absent.
     */
    boolean compareAndSet(String key, long expectedVersion, T value) throws IOException;

    Map<String, Versioned<T>> snapshot() throws IOException;

    default Versioned<T> update(String key, Supplier<T> initialValue, UnaryOperator<T> mutation) throws IOException {
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            Versioned<T> current = getOrCreate(key, initialValue);
            T next = mutation.apply(current.value());
            if (compareAndSet(key, current.version(), next)) {
                return new Versioned<>(current.version() + 1, next);
            }
        }
        throw new IllegalStateException("Gave up updating key " + key + " after " + MAX_UPDATE_ATTEMPTS + " conflicting writes");
    }
}
