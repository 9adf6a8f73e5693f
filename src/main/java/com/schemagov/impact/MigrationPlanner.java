package com.schemagov.impact;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagov.dependency.DependencyGraph;
import com.schemagov.dependency.DependencyStrength;
import com.schemagov.dependency.ServiceDependency;
import com.schemagov.detect.BreakingChange;

/**
 * Turns an impact analysis into a migration plan: strategy, phases, ordering, rollback and risk.
 */
public class MigrationPlanner {
    private static final Logger log = LoggerFactory.getLogger(MigrationPlanner.class);

    private static final int PHASED_DIRECT_THRESHOLD = 5;
    private static final int PHASED_SYSTEM_THRESHOLD = 2;

    private final ImpactAnalyzer impactAnalyzer;
    private final MigrationPlanStore planStore;
    private final Clock clock;

    public MigrationPlanner(ImpactAnalyzer impactAnalyzer, MigrationPlanStore planStore) {
        this(impactAnalyzer, planStore, Clock.systemUTC());
    }

    MigrationPlanner(ImpactAnalyzer impactAnalyzer, MigrationPlanStore planStore, Clock clock) {
        this.impactAnalyzer = Objects.requireNonNull(impactAnalyzer, "impactAnalyzer");
        this.planStore = planStore;
        this.clock = clock;
    }

    public MigrationPlan generateMigrationPlan(String changeId, String target, List<BreakingChange> breakingChanges) throws IOException {
        Objects.requireNonNull(changeId, "changeId");
        List<BreakingChange> changes = breakingChanges == null ? List.of() : breakingChanges;

        DependencyGraph graph = impactAnalyzer.dependencyGraph(target);
        List<ServiceImpact> serviceImpacts = impactAnalyzer.identifyAffectedServices(graph, changes);
        List<TeamImpact> teamImpacts = impactAnalyzer.analyzeTeamImpacts(serviceImpacts);
        CrossSystemImpact crossSystem = impactAnalyzer.analyzeCrossSystemImpact(graph, changes);

        MigrationStrategy strategy = selectStrategy(graph, teamImpacts, crossSystem, !changes.isEmpty());
        List<MigrationPhase> phases = switch (strategy) {
            case IMMEDIATE -> immediatePhases(graph);
            case PHASED -> tieredPhases(graph);
            case COORDINATED -> teamPhases(graph);
        };
        List<String> order = migrationOrder(graph.directDependencies(), teamImpacts);

        MigrationPlan plan = new MigrationPlan(
                changeId,
                target,
                strategy,
                phases,
                order,
                rollbackPlan(order),
                testingPlan(graph, !changes.isEmpty()),
                communicationPlan(teamImpacts),
                timeline(phases, teamImpacts),
                assessRisk(graph, teamImpacts, changes),
                clock.instant());

        if (planStore != null) {
            planStore.save(plan);
        }
        log.info("migration.plan_generated change={} target={} strategy={} phases={} risk={}",
                changeId, target, strategy.value(), phases.size(), plan.riskAssessment().overallRisk().value());
        return plan;
    }

    static MigrationStrategy selectStrategy(
            DependencyGraph graph,
            List<TeamImpact> teamImpacts,
            CrossSystemImpact crossSystem,
            boolean breaking) {
        boolean criticalDependency = graph.directDependencies().stream()
                .anyMatch(dependency -> dependency.strength() == DependencyStrength.CRITICAL);
        boolean severeTeamImpact = teamImpacts.stream()
                .anyMatch(impact -> impact.impactLevel().atLeast(ImpactLevel.HIGH));
        if (criticalDependency || (breaking && severeTeamImpact)) {
            return MigrationStrategy.COORDINATED;
        }
        if (graph.directDependencies().size() > PHASED_DIRECT_THRESHOLD
                || crossSystem.affectedSystems().size() > PHASED_SYSTEM_THRESHOLD) {
            return MigrationStrategy.PHASED;
        }
        return MigrationStrategy.IMMEDIATE;
    }

    /**
     * Stable descending sort on strength score plus the owning team's impact score.
     */
    static List<String> migrationOrder(List<ServiceDependency> directDependencies, List<TeamImpact> teamImpacts) {
        Map<String, Integer> teamScores = new LinkedHashMap<>();
        for (TeamImpact impact : teamImpacts) {
            teamScores.put(impact.team(), impact.impactLevel().score());
        }
        List<ServiceDependency> ordered = new ArrayList<>(directDependencies);
        ordered.sort(Comparator.comparingInt((ServiceDependency dependency) ->
                dependency.strength().score() + teamScores.getOrDefault(dependency.owningTeam(), 0)).reversed());
        return ordered.stream().map(ServiceDependency::serviceName).toList();
    }

    private static List<MigrationPhase> immediatePhases(DependencyGraph graph) {
        return List.of(new MigrationPhase(
                1,
                "Immediate migration",
                "Migrate all consumers together",
                names(graph.directDependencies()),
                null,
                1,
                2,
                true));
    }

    private static List<MigrationPhase> tieredPhases(DependencyGraph graph) {
        List<String> critical = new ArrayList<>();
        List<String> high = new ArrayList<>();
        List<String> low = new ArrayList<>();
        for (ServiceDependency dependency : graph.directDependencies()) {
            switch (dependency.strength()) {
                case CRITICAL -> critical.add(dependency.serviceName());
                case STRONG, MEDIUM -> high.add(dependency.serviceName());
                case WEAK -> low.add(dependency.serviceName());
            }
        }
        List<MigrationPhase> phases = new ArrayList<>();
        if (!critical.isEmpty()) {
            phases.add(new MigrationPhase(phases.size() + 1, "Critical services", "Migrate critical consumers one at a time",
                    critical, null, 4, 8, false));
        }
        if (!high.isEmpty()) {
            phases.add(new MigrationPhase(phases.size() + 1, "High priority services", "Migrate strongly coupled consumers",
                    high, null, 2, 4, true));
        }
        if (!low.isEmpty()) {
            phases.add(new MigrationPhase(phases.size() + 1, "Remaining services", "Migrate loosely coupled consumers",
                    low, null, 1, 2, true));
        }
        return phases;
    }

    /**
     * One phase per owning team, in the order teams first appear among the direct dependents.
     */
    private static List<MigrationPhase> teamPhases(DependencyGraph graph) {
        Map<String, List<String>> servicesByTeam = new LinkedHashMap<>();
        List<String> unassigned = new ArrayList<>();
        for (ServiceDependency dependency : graph.directDependencies()) {
            String team = dependency.owningTeam();
            if (team == null || team.isBlank()) {
                unassigned.add(dependency.serviceName());
            } else {
                servicesByTeam.computeIfAbsent(team, key -> new ArrayList<>()).add(dependency.serviceName());
            }
        }

        List<MigrationPhase> phases = new ArrayList<>();
        servicesByTeam.forEach((team, services) -> {
            if (!services.isEmpty()) {
                phases.add(new MigrationPhase(phases.size() + 1, "Team " + team, "Coordinated migration owned by " + team,
                        services, team, 2, 6, false));
            }
        });
        if (!unassigned.isEmpty()) {
            phases.add(new MigrationPhase(phases.size() + 1, "Unassigned services", "Consumers without a registered owning team",
                    unassigned, null, 2, 6, false));
        }
        return phases;
    }

    private static MigrationPlan.RollbackPlan rollbackPlan(List<String> order) {
        List<String> reversed = new ArrayList<>(order);
        Collections.reverse(reversed);
        return new MigrationPlan.RollbackPlan(
                "reverse_order",
                reversed,
                List.of(
                        "Previous schema version is published and resolvable",
                        "Consumers can be redeployed at their prior release",
                        "Rollback owners are on call for the migration window"),
                List.of(
                        "Error rate above pre-migration baseline",
                        "Contract test failures in any consumer",
                        "Deserialization errors reported by consumers"),
                "30-60 minutes");
    }

    private static MigrationPlan.TestingPlan testingPlan(DependencyGraph graph, boolean breaking) {
        List<String> stages = new ArrayList<>(List.of("unit", "integration", "contract"));
        if (breaking) {
            stages.add("end-to-end");
        }
        List<String> criticalCases = new ArrayList<>();
        for (ServiceDependency dependency : graph.directDependencies()) {
            if (dependency.strength() == DependencyStrength.CRITICAL || dependency.strength() == DependencyStrength.STRONG) {
                criticalCases.add("Contract tests for " + dependency.serviceName() + " against " + graph.target());
            }
        }
        if (!graph.transitiveDependencies().isEmpty()) {
            criticalCases.add("Smoke tests for " + graph.transitiveDependencies().size() + " transitive consumer(s)");
        }
        return new MigrationPlan.TestingPlan(stages, List.of("development", "staging", "production-canary"), criticalCases);
    }

    private static MigrationPlan.CommunicationPlan communicationPlan(List<TeamImpact> teamImpacts) {
        List<String> channels = new ArrayList<>(List.of("slack", "email"));
        if (teamImpacts.stream().anyMatch(impact -> impact.impactLevel().atLeast(ImpactLevel.HIGH))) {
            channels.add("teams-meeting");
        }
        Map<String, String> milestones = new LinkedHashMap<>();
        milestones.put("announcement", "before migration starts");
        milestones.put("status_updates", "after each phase");
        milestones.put("completion", "after validation");
        return new MigrationPlan.CommunicationPlan(
                teamImpacts.stream().map(TeamImpact::team).toList(),
                channels,
                milestones);
    }

    private static Map<String, String> timeline(List<MigrationPhase> phases, List<TeamImpact> teamImpacts) {
        int migrationHours = phases.stream().mapToInt(MigrationPhase::minHours).sum();
        Map<String, String> timeline = new LinkedHashMap<>();
        timeline.put("preparation", "1-2 days");
        timeline.put("migration_window", migrationHours + " hours");
        if (teamImpacts.stream().anyMatch(impact -> impact.impactLevel().atLeast(ImpactLevel.HIGH))) {
            timeline.put("coordination_time", "1-2 days");
        }
        timeline.put("validation", "4-8 hours");
        return timeline;
    }

    static RiskAssessment assessRisk(DependencyGraph graph, List<TeamImpact> teamImpacts, List<BreakingChange> changes) {
        List<RiskAssessment.Risk> risks = new ArrayList<>();
        if (graph.metadata().criticalDependencyCount() > 0) {
            risks.add(new RiskAssessment.Risk("Critical consumer disruption",
                    RiskAssessment.RiskLevel.HIGH, RiskAssessment.RiskLevel.MEDIUM));
        }
        if (teamImpacts.size() > 3) {
            risks.add(new RiskAssessment.Risk("Cross-team coordination complexity",
                    RiskAssessment.RiskLevel.MEDIUM, RiskAssessment.RiskLevel.HIGH));
        }
        if (graph.directDependencies().size() > PHASED_DIRECT_THRESHOLD) {
            risks.add(new RiskAssessment.Risk("Migration window overrun",
                    RiskAssessment.RiskLevel.MEDIUM, RiskAssessment.RiskLevel.HIGH));
        }
        if (graph.transitiveDependencies().size() > 5) {
            risks.add(new RiskAssessment.Risk("Cascading failures through transitive consumers",
                    RiskAssessment.RiskLevel.MEDIUM, RiskAssessment.RiskLevel.MEDIUM));
        }
        if (!changes.isEmpty() && !graph.directDependencies().isEmpty()) {
            risks.add(new RiskAssessment.Risk("Consumers deserializing incompatible payloads",
                    RiskAssessment.RiskLevel.MEDIUM, RiskAssessment.RiskLevel.LOW));
        }

        RiskAssessment.RiskLevel overall;
        long mediumLikely = risks.stream()
                .filter(risk -> risk.impact() == RiskAssessment.RiskLevel.MEDIUM
                        && risk.probability() == RiskAssessment.RiskLevel.HIGH)
                .count();
        if (risks.stream().anyMatch(risk -> risk.impact() == RiskAssessment.RiskLevel.HIGH)) {
            overall = RiskAssessment.RiskLevel.HIGH;
        } else if (mediumLikely > 1) {
            overall = RiskAssessment.RiskLevel.MEDIUM;
        } else {
            overall = RiskAssessment.RiskLevel.LOW;
        }

        List<String> mitigations = new ArrayList<>();
        for (RiskAssessment.Risk risk : risks) {
            mitigations.add("Mitigate: " + risk.description());
        }
        return new RiskAssessment(overall, risks, mitigations);
    }

    private static List<String> names(List<ServiceDependency> dependencies) {
        return dependencies.stream().map(ServiceDependency::serviceName).toList();
    }
}
