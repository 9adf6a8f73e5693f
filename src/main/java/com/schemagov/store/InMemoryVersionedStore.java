package com.schemagov.store;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

public class InMemoryVersionedStore<T> implements VersionedStore<T> {
    private final ConcurrentHashMap<String, Versioned<T>> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<Versioned<T>> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public Versioned<T> getOrCreate(String key, Supplier<T> initialValue) {
        return entries.computeIfAbsent(key, ignored -> new Versioned<>(1, initialValue.get()));
    }

    @Override
    public boolean compareAndSet(String key, long expectedVersion, T value) {
        Objects.requireNonNull(value, "value");
        if (expectedVersion == 0) {
            return entries.putIfAbsent(key, new Versioned<>(1, value)) == null;
        }
        boolean[] swapped = new boolean[1];
        entries.computeIfPresent(key, (ignored, current) -> {
            if (current.version() != expectedVersion) {
                return current;
            }
            swapped[0] = true;
            return new Versioned<>(expectedVersion + 1, value);
        });
        return swapped[0];
    }

    @Override
    public Map<String, Versioned<T>> snapshot() {
        return new LinkedHashMap<>(entries);
    }
}
