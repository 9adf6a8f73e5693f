package com.schemagov.impact;

import java.util.List;

public record CrossSystemImpact(
        List<String> affectedSystems,
        List<CrossTeamDependency> crossTeamDependencies,
        List<String> externalDependencies,
        List<CascadeEffect> cascadeEffects,
        List<String> coordinationRequirements) {

    public CrossSystemImpact {
        affectedSystems = affectedSystems == null ? List.of() : List.copyOf(affectedSystems);
        crossTeamDependencies = crossTeamDependencies == null ? List.of() : List.copyOf(crossTeamDependencies);
        externalDependencies = externalDependencies == null ? List.of() : List.copyOf(externalDependencies);
        cascadeEffects = cascadeEffects == null ? List.of() : List.copyOf(cascadeEffects);
        coordinationRequirements = coordinationRequirements == null ? List.of() : List.copyOf(coordinationRequirements);
    }

    public record CrossTeamDependency(String team, List<String> services, boolean coordinationNeeded) {
    }

    public record CascadeEffect(String service, String probability, String description) {
    }
}
