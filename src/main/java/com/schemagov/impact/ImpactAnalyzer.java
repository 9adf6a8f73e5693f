package com.schemagov.impact;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagov.dependency.DependencyGraph;
import com.schemagov.dependency.DependencyGraphBuilder;
import com.schemagov.dependency.DependencyKind;
import com.schemagov.dependency.DependencyRegistry;
import com.schemagov.dependency.DependencyStrength;
import com.schemagov.dependency.ServiceDependency;
import com.schemagov.dependency.ServiceInfo;
import com.schemagov.detect.BreakingChange;

/**
 * Rates how a set of breaking changes lands on the services and teams that depend on a schema target.
 */
public class ImpactAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ImpactAnalyzer.class);

    static final Comparator<ServiceImpact> BY_SEVERITY_DESCENDING =
            Comparator.comparingInt((ServiceImpact impact) -> impact.impactLevel().score()).reversed();

    private final DependencyRegistry registry;
    private final DependencyGraphBuilder graphBuilder;

    public ImpactAnalyzer(DependencyRegistry registry) {
        this(registry, new DependencyGraphBuilder(registry));
    }

    ImpactAnalyzer(DependencyRegistry registry, DependencyGraphBuilder graphBuilder) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder");
    }

    public DependencyGraph dependencyGraph(String target) {
        return graphBuilder.build(target);
    }

    public List<ServiceImpact> identifyAffectedServices(String target, List<BreakingChange> breakingChanges) {
        return identifyAffectedServices(graphBuilder.build(target), breakingChanges);
    }

    public List<ServiceImpact> identifyAffectedServices(DependencyGraph graph, List<BreakingChange> breakingChanges) {
        boolean breaking = breakingChanges != null && !breakingChanges.isEmpty();
        List<ServiceImpact> impacts = new ArrayList<>();
        for (ServiceDependency dependency : graph.allDependencies()) {
            impacts.add(serviceImpact(dependency, breaking));
        }
        impacts.sort(BY_SEVERITY_DESCENDING);
        return impacts;
    }

    public ServiceImpact analyzeServiceImpact(String target, String serviceName, List<BreakingChange> breakingChanges) {
        ServiceDependency dependency = registry.requireDependency(target, serviceName);
        return serviceImpact(dependency, breakingChanges != null && !breakingChanges.isEmpty());
    }

    public List<TeamImpact> analyzeTeamImpacts(String target, List<BreakingChange> breakingChanges) {
        return analyzeTeamImpacts(identifyAffectedServices(target, breakingChanges));
    }

    /**
     * Groups service impacts by owning team, keeping the most severe level seen for each team.
     */
    public List<TeamImpact> analyzeTeamImpacts(List<ServiceImpact> serviceImpacts) {
        Map<String, List<ServiceImpact>> byTeam = new LinkedHashMap<>();
        for (ServiceImpact impact : serviceImpacts) {
            if (impact.owningTeam() == null || impact.owningTeam().isBlank()) {
                log.debug("impact.unowned_service service={}", impact.serviceName());
                continue;
            }
            byTeam.computeIfAbsent(impact.owningTeam(), ignored -> new ArrayList<>()).add(impact);
        }

        List<TeamImpact> teamImpacts = new ArrayList<>();
        byTeam.forEach((team, impacts) -> {
            ImpactLevel level = ImpactLevel.NONE;
            List<String> services = new ArrayList<>();
            List<String> actions = new ArrayList<>();
            for (ServiceImpact impact : impacts) {
                level = ImpactLevel.max(level, impact.impactLevel());
                services.add(impact.serviceName());
                if (impact.migrationRequired()) {
                    actions.add("Migrate " + impact.serviceName());
                }
                if (impact.testingRequired()) {
                    actions.add("Test " + impact.serviceName());
                }
            }
            teamImpacts.add(new TeamImpact(
                    team,
                    level,
                    services,
                    actions,
                    riskFactors(impacts, level),
                    mitigationStrategies(level),
                    level.atLeast(ImpactLevel.HIGH) ? ContactPriority.URGENT : ContactPriority.NORMAL));
        });
        return teamImpacts;
    }

    public CrossSystemImpact analyzeCrossSystemImpact(String target, List<BreakingChange> breakingChanges) {
        return analyzeCrossSystemImpact(graphBuilder.build(target), breakingChanges);
    }

    public CrossSystemImpact analyzeCrossSystemImpact(DependencyGraph graph, List<BreakingChange> breakingChanges) {
        Set<String> systems = new LinkedHashSet<>();
        Set<String> external = new LinkedHashSet<>();
        Map<String, List<String>> servicesByTeam = new LinkedHashMap<>();
        for (ServiceDependency dependency : graph.allDependencies()) {
            ServiceInfo info = registry.serviceInfo(dependency.serviceName()).orElse(null);
            if (info == null) {
                external.add(dependency.serviceName());
                systems.add(ServiceInfo.UNKNOWN_SYSTEM);
            } else {
                systems.add(info.system());
            }
            if (dependency.owningTeam() != null && !dependency.owningTeam().isBlank()) {
                servicesByTeam.computeIfAbsent(dependency.owningTeam(), ignored -> new ArrayList<>())
                        .add(dependency.serviceName());
            }
        }

        boolean breaking = breakingChanges != null && !breakingChanges.isEmpty();
        List<CrossSystemImpact.CrossTeamDependency> crossTeam = new ArrayList<>();
        if (servicesByTeam.size() > 1) {
            servicesByTeam.forEach((team, services) ->
                    crossTeam.add(new CrossSystemImpact.CrossTeamDependency(team, services, breaking)));
        }

        List<CrossSystemImpact.CascadeEffect> cascades = new ArrayList<>();
        if (breaking) {
            for (ServiceDependency dependency : graph.directDependencies()) {
                if (dependency.strength() == DependencyStrength.CRITICAL || dependency.strength() == DependencyStrength.STRONG) {
                    cascades.add(new CrossSystemImpact.CascadeEffect(
                            dependency.serviceName(),
                            dependency.strength() == DependencyStrength.CRITICAL ? "high" : "medium",
                            "Failure in " + dependency.serviceName() + " can propagate to its own consumers"));
                }
            }
        }

        List<String> coordination = new ArrayList<>();
        if (systems.size() > 1) {
            coordination.add("Align release windows across systems " + String.join(", ", systems));
        }
        if (crossTeam.size() > 1) {
            coordination.add("Hold a cross-team sync before rollout");
        }
        if (!external.isEmpty()) {
            coordination.add("Contact owners of uncatalogued services " + String.join(", ", external));
        }
        if (!cascades.isEmpty()) {
            coordination.add("Stage rollout behind consumers with critical or strong coupling");
        }
        return new CrossSystemImpact(new ArrayList<>(systems), crossTeam, new ArrayList<>(external), cascades, coordination);
    }

    public List<String> migrationRecommendations(String target) {
        DependencyGraph graph = graphBuilder.build(target);
        DependencyGraph.Metadata metadata = graph.metadata();
        List<String> recommendations = new ArrayList<>();
        if (metadata.affectedServiceCount() > 10) {
            recommendations.add("High number of affected services: consider a phased migration");
        }
        if (metadata.criticalDependencyCount() > 0) {
            recommendations.add("Critical dependencies present: schedule a coordinated migration with their owners");
        }
        if (metadata.complexityScore() > 7) {
            recommendations.add("High complexity: run a migration rehearsal in staging first");
        } else if (metadata.complexityScore() > 5) {
            recommendations.add("Moderate complexity: prepare rollback procedures before starting");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Low complexity: an immediate migration is appropriate");
        }
        return recommendations;
    }

    /**
     * Impact for a single dependency. The level depends on breaking changes being present and the coupling strength.
     */
    static ServiceImpact serviceImpact(ServiceDependency dependency, boolean breaking) {
        ImpactLevel level;
        if (!breaking) {
            level = ImpactLevel.LOW;
        } else {
            level = switch (dependency.strength()) {
                case CRITICAL, STRONG -> ImpactLevel.CRITICAL;
                case MEDIUM -> ImpactLevel.HIGH;
                case WEAK -> ImpactLevel.MEDIUM;
            };
        }
        return new ServiceImpact(
                dependency.serviceName(),
                dependency.owningTeam(),
                level,
                dependency.kind(),
                dependency.strength(),
                breaking && dependency.kind() == DependencyKind.DIRECT,
                breaking);
    }

    private static List<String> riskFactors(List<ServiceImpact> impacts, ImpactLevel level) {
        List<String> factors = new ArrayList<>();
        long critical = impacts.stream().filter(impact -> impact.impactLevel() == ImpactLevel.CRITICAL).count();
        if (critical > 0) {
            factors.add(critical + " service(s) with critical impact");
        }
        if (impacts.size() > 3) {
            factors.add("Large number of affected services (" + impacts.size() + ")");
        }
        if (impacts.stream().anyMatch(impact -> impact.kind() == DependencyKind.TRANSITIVE && impact.testingRequired())) {
            factors.add("Transitive consumers may break without direct code changes");
        }
        if (level.atLeast(ImpactLevel.HIGH) && factors.isEmpty()) {
            factors.add("Breaking change reaches tightly coupled consumers");
        }
        return factors;
    }

    private static List<String> mitigationStrategies(ImpactLevel level) {
        return switch (level) {
            case CRITICAL -> List.of(
                    "Provide a backward-compatible transition period",
                    "Run contract tests against the new schema before release",
                    "Prepare a rollback of the schema version");
            case HIGH -> List.of(
                    "Coordinate the release date with the team",
                    "Run contract tests against the new schema before release");
            case MEDIUM -> List.of("Share the migration guide ahead of release");
            case LOW, NONE -> List.of("Announce the change in release notes");
        };
    }
}
