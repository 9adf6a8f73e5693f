package com.schemagov.dependency;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyGraphBuilderTest {

    private static final String TARGET = "acme/payments/v1/payment.proto";

    private final DependencyRegistry registry = new DependencyRegistry();
    private final DependencyGraphBuilder builder = new DependencyGraphBuilder(registry);

    @Test
    void shouldScoreThreeCriticalDependentsAcrossTwoTeamsAsTen() throws Exception {
        registry.registerServiceDependency(TARGET, ServiceDependency.direct("checkout", "acme/checkout", DependencyStrength.CRITICAL, "orders-team"));
        registry.registerServiceDependency(TARGET, ServiceDependency.direct("ledger", "acme/ledger", DependencyStrength.CRITICAL, "finance-team"));
        registry.registerServiceDependency(TARGET, ServiceDependency.direct("refunds", "acme/refunds", DependencyStrength.CRITICAL, "orders-team"));

        DependencyGraph graph = builder.build(TARGET);

        assertEquals(3, graph.directDependencies().size());
        assertTrue(graph.transitiveDependencies().isEmpty());
        assertEquals(3, graph.metadata().criticalDependencyCount());
        assertEquals(2, graph.metadata().teamCount());
        assertEquals(10, graph.metadata().complexityScore());
    }

    @Test
    void shouldNeverLowerComplexityAsDirectDependentsGrow() throws Exception {
        int previous = builder.build(TARGET).metadata().complexityScore();
        for (int i = 0; i < 12; i++) {
            DependencyStrength strength = DependencyStrength.values()[i % DependencyStrength.values().length];
            registry.registerServiceDependency(TARGET, ServiceDependency.direct("svc-" + i, "acme/svc-" + i, strength, "team-" + (i % 3)));

            int current = builder.build(TARGET).metadata().complexityScore();
            assertTrue(current >= previous, "complexity dropped from " + previous + " to " + current);
            previous = current;
        }
    }

    @Test
    void shouldCollectSecondHopDependentsAsWeakTransitive() throws Exception {
        registry.registerServiceDependency(TARGET, ServiceDependency.direct("checkout", "acme/checkout", DependencyStrength.STRONG, "orders-team"));
        registry.registerServiceDependency("acme/orders/v1/order.proto",
                ServiceDependency.direct("checkout", "acme/checkout", DependencyStrength.MEDIUM, "orders-team"));
        registry.registerServiceDependency("acme/orders/v1/order.proto",
                ServiceDependency.direct("fulfilment", "acme/fulfilment", DependencyStrength.CRITICAL, "logistics-team"));

        DependencyGraph graph = builder.build(TARGET);

        assertEquals(1, graph.transitiveDependencies().size());
        ServiceDependency transitive = graph.transitiveDependencies().get(0);
        assertEquals("fulfilment", transitive.serviceName());
        assertEquals(DependencyKind.TRANSITIVE, transitive.kind());
        assertEquals(DependencyStrength.WEAK, transitive.strength());
        assertEquals(2, graph.metadata().affectedServiceCount());
        assertEquals(1, graph.metadata().teamCount());
        assertEquals(List.of(TARGET, "acme/orders/v1/order.proto"), graph.dependencyMatrix().get("checkout"));
    }

    @Test
    void shouldCountOnlyDirectOwnersTowardsComplexity() throws Exception {
        registry.registerServiceDependency(TARGET, ServiceDependency.direct("checkout", "acme/checkout", DependencyStrength.MEDIUM, "team-a"));
        registry.registerServiceDependency("acme/orders/v1/order.proto",
                ServiceDependency.direct("checkout", "acme/checkout", DependencyStrength.MEDIUM, "team-a"));
        registry.registerServiceDependency("acme/orders/v1/order.proto",
                ServiceDependency.direct("fulfilment", "acme/fulfilment", DependencyStrength.STRONG, "team-b"));
        registry.registerServiceDependency("acme/orders/v1/order.proto",
                ServiceDependency.direct("invoicing", "acme/invoicing", DependencyStrength.WEAK, "team-c"));

        DependencyGraph graph = builder.build(TARGET);

        assertEquals(2, graph.transitiveDependencies().size());
        assertEquals(1, graph.metadata().teamCount());
        assertEquals(2, graph.metadata().complexityScore());
    }

    @Test
    void shouldFindReverseDependenciesThroughBackwardIndex() throws Exception {
        registry.registerServiceDependency("acme/common/v1/money.proto",
                new ServiceDependency(TARGET, "acme/payments", DependencyKind.DIRECT, UsagePattern.CONSUMER,
                        DependencyStrength.STRONG, "payments-team", null));
        registry.registerServiceDependency("acme/common/v1/money-extra.proto",
                ServiceDependency.direct("acme/payments/v1/payment.proto.bak", "acme/payments", DependencyStrength.WEAK, null));

        DependencyGraph graph = builder.build(TARGET);

        assertEquals(List.of(new ReverseDependency("acme/common/v1/money.proto", DependencyKind.DIRECT, DependencyStrength.STRONG)),
                graph.reverseDependencies());
    }

    @Test
    void shouldBuildEmptyGraphForUnknownTarget() {
        DependencyGraph graph = builder.build("acme/unknown.proto");

        assertTrue(graph.allDependencies().isEmpty());
        assertEquals(0, graph.metadata().complexityScore());
    }
}
