package com.schemagov.dependency;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistDependenciesAndServicesAcrossInstances() throws Exception {
        Path path = tempDir.resolve("dependencies.json");
        DependencyRegistry registry = new DependencyRegistry(path);
        registry.registerServiceDependency("acme/a.proto", ServiceDependency.direct("billing", "acme/billing", DependencyStrength.STRONG, "finance"));
        registry.registerService(new ServiceInfo("billing", "payments-platform", "Invoices customers", "finance"));

        DependencyRegistry reopened = new DependencyRegistry(path);

        assertEquals(DependencyStrength.STRONG, reopened.requireDependency("acme/a.proto", "billing").strength());
        assertEquals(List.of("acme/a.proto"), reopened.targetsConsumedBy("billing"));
        assertEquals("payments-platform", reopened.serviceInfo("billing").orElseThrow().system());
        assertEquals(List.of("acme/a.proto"), reopened.registeredTargets());
    }

    @Test
    void shouldReplaceExistingRegistrationAndStampTime() throws Exception {
        Instant now = Instant.parse("2026-02-01T08:00:00Z");
        DependencyRegistry registry = new DependencyRegistry(null, Clock.fixed(now, ZoneOffset.UTC));
        registry.registerServiceDependency("acme/a.proto", ServiceDependency.direct("billing", "acme/billing", DependencyStrength.WEAK, "finance"));
        registry.registerServiceDependency("acme/a.proto", ServiceDependency.direct("billing", "acme/billing", DependencyStrength.CRITICAL, "finance"));

        List<ServiceDependency> dependents = registry.dependentsOf("acme/a.proto");

        assertEquals(1, dependents.size());
        assertEquals(DependencyStrength.CRITICAL, dependents.get(0).strength());
        assertEquals(now, dependents.get(0).registeredAt());
    }

    @Test
    void shouldRaiseForUnregisteredService() {
        DependencyRegistry registry = new DependencyRegistry();

        assertThrows(DependencyAnalysisException.class, () -> registry.requireDependency("acme/a.proto", "ghost"));
        assertTrue(registry.serviceInfo("ghost").isEmpty());
    }

    @Test
    void shouldDefaultUnknownSystem() {
        assertEquals(ServiceInfo.UNKNOWN_SYSTEM, new ServiceInfo("billing", null, null, null).system());
    }
}
