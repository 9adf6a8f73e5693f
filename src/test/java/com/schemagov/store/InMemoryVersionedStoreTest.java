package com.schemagov.store;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryVersionedStoreTest {

    private final InMemoryVersionedStore<String> store = new InMemoryVersionedStore<>();

    @Test
    void shouldTreatExpectedVersionZeroAsPutIfAbsent() {
        assertTrue(store.compareAndSet("k", 0, "first"));
        assertFalse(store.compareAndSet("k", 0, "second"));

        assertEquals(new Versioned<>(1, "first"), store.get("k").orElseThrow());
    }

    @Test
    void shouldRejectStaleVersion() {
        store.compareAndSet("k", 0, "v1");
        assertTrue(store.compareAndSet("k", 1, "v2"));
        assertFalse(store.compareAndSet("k", 1, "v3"));
        assertFalse(store.compareAndSet("missing", 4, "v"));

        assertEquals(new Versioned<>(2, "v2"), store.get("k").orElseThrow());
    }

    @Test
    void shouldNotLoseConcurrentUpdates() throws Exception {
        InMemoryVersionedStore<Integer> counters = new InMemoryVersionedStore<>();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> {
                    for (int j = 0; j < 3; j++) {
                        counters.update("count", () -> 0, value -> value + 1);
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(24, counters.get("count").orElseThrow().value());
    }
}
