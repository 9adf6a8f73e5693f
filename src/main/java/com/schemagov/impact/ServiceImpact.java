package com.schemagov.impact;

import com.schemagov.dependency.DependencyKind;
import com.schemagov.dependency.DependencyStrength;

public record ServiceImpact(
        String serviceName,
        String owningTeam,
        ImpactLevel impactLevel,
        DependencyKind kind,
        DependencyStrength strength,
        boolean migrationRequired,
        boolean testingRequired) {
}
