package com.schemagov.dependency;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Blast radius of a schema target, derived from the registry on demand.
 */
public record DependencyGraph(
        String target,
        List<ServiceDependency> directDependencies,
        List<ServiceDependency> transitiveDependencies,
        List<ReverseDependency> reverseDependencies,
        Map<String, List<String>> dependencyMatrix,
        Metadata metadata) {

    public DependencyGraph {
        directDependencies = directDependencies == null ? List.of() : List.copyOf(directDependencies);
        transitiveDependencies = transitiveDependencies == null ? List.of() : List.copyOf(transitiveDependencies);
        reverseDependencies = reverseDependencies == null ? List.of() : List.copyOf(reverseDependencies);
        dependencyMatrix = dependencyMatrix == null ? Map.of() : dependencyMatrix;
    }

    public List<ServiceDependency> allDependencies() {
        return Stream.concat(directDependencies.stream(), transitiveDependencies.stream()).toList();
    }

    public record Metadata(int affectedServiceCount, int criticalDependencyCount, int teamCount, int complexityScore) {
    }

    /**
     * {@code direct + 0.5 * transitive + 2 * criticalDirect + 0.5 * teams}, truncated toward zero.
     */
    public static int complexityScore(int directCount, int transitiveCount, int criticalDirectCount, int teamCount) {
        return (int) (directCount + 0.5 * transitiveCount + 2.0 * criticalDirectCount + 0.5 * teamCount);
    }
}
