package com.schemagov.dependency;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A service that consumes a schema target. Registered explicitly, never inferred.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceDependency(
        String serviceName,
        String repository,
        DependencyKind kind,
        UsagePattern usagePattern,
        DependencyStrength strength,
        String owningTeam,
        Instant registeredAt) {

    public ServiceDependency {
        Objects.requireNonNull(serviceName, "serviceName");
        repository = repository == null ? "" : repository;
        kind = kind == null ? DependencyKind.DIRECT : kind;
        usagePattern = usagePattern == null ? UsagePattern.CONSUMER : usagePattern;
        strength = strength == null ? DependencyStrength.MEDIUM : strength;
    }

    public static ServiceDependency direct(String serviceName, String repository, DependencyStrength strength, String owningTeam) {
        return new ServiceDependency(serviceName, repository, DependencyKind.DIRECT, UsagePattern.CONSUMER, strength, owningTeam, null);
    }

    /**
     * Second-hop dependents are always rated weak, whatever their registered strength.
     */
    public ServiceDependency asTransitive() {
        return new ServiceDependency(serviceName, repository, DependencyKind.TRANSITIVE, usagePattern,
                DependencyStrength.WEAK, owningTeam, registeredAt);
    }

    public ServiceDependency withRegisteredAt(Instant timestamp) {
        return new ServiceDependency(serviceName, repository, kind, usagePattern, strength, owningTeam, timestamp);
    }
}
