package com.schemagov.dependency;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DependencyGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final DependencyRegistry registry;

    public DependencyGraphBuilder(DependencyRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public DependencyGraph build(String target) {
        Objects.requireNonNull(target, "target");
        List<ServiceDependency> direct = registry.dependentsOf(target);
        List<ServiceDependency> transitive = transitiveDependencies(target, direct);
        List<ReverseDependency> reverse = reverseDependencies(target);

        Map<String, List<String>> matrix = new LinkedHashMap<>();
        matrix.put(target, direct.stream().map(ServiceDependency::serviceName).toList());
        for (ServiceDependency dependency : direct) {
            matrix.put(dependency.serviceName(), registry.targetsConsumedBy(dependency.serviceName()));
        }

        int criticalDirect = (int) direct.stream()
                .filter(dependency -> dependency.strength() == DependencyStrength.CRITICAL)
                .count();
        Set<String> teams = new LinkedHashSet<>();
        for (ServiceDependency dependency : direct) {
            addTeam(teams, dependency);
        }

        DependencyGraph.Metadata metadata = new DependencyGraph.Metadata(
                direct.size() + transitive.size(),
                criticalDirect,
                teams.size(),
                DependencyGraph.complexityScore(direct.size(), transitive.size(), criticalDirect, teams.size()));
        log.debug("graph.built target={} direct={} transitive={} reverse={} complexity={}",
                target, direct.size(), transitive.size(), reverse.size(), metadata.complexityScore());
        return new DependencyGraph(target, direct, transitive, reverse, matrix, metadata);
    }

    /**
     * One hop only: dependents of the other targets each direct dependent consumes.
     */
    private List<ServiceDependency> transitiveDependencies(String target, List<ServiceDependency> direct) {
        Set<String> directNames = new LinkedHashSet<>();
        for (ServiceDependency dependency : direct) {
            directNames.add(dependency.serviceName());
        }
        Map<String, ServiceDependency> collected = new LinkedHashMap<>();
        for (ServiceDependency dependency : direct) {
            for (String consumedTarget : registry.targetsConsumedBy(dependency.serviceName())) {
                if (consumedTarget.equals(target)) {
                    continue;
                }
                for (ServiceDependency secondHop : registry.dependentsOf(consumedTarget)) {
                    String name = secondHop.serviceName();
                    if (directNames.contains(name) || collected.containsKey(name)) {
                        continue;
                    }
                    collected.put(name, secondHop.asTransitive());
                }
            }
        }
        return new ArrayList<>(collected.values());
    }

    private List<ReverseDependency> reverseDependencies(String target) {
        List<ReverseDependency> reverse = new ArrayList<>();
        for (String consumedTarget : registry.targetsConsumedBy(target)) {
            registry.findDependency(consumedTarget, target).ifPresent(registration ->
                    reverse.add(new ReverseDependency(consumedTarget, registration.kind(), registration.strength())));
        }
        return reverse;
    }

    private static void addTeam(Set<String> teams, ServiceDependency dependency) {
        if (dependency.owningTeam() != null && !dependency.owningTeam().isBlank()) {
            teams.add(dependency.owningTeam());
        }
    }
}
