package com.schemagov.impact;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MigrationPlan(
        String changeId,
        String target,
        MigrationStrategy strategy,
        List<MigrationPhase> phases,
        List<String> migrationOrder,
        RollbackPlan rollbackPlan,
        TestingPlan testingPlan,
        CommunicationPlan communicationPlan,
        Map<String, String> timeline,
        RiskAssessment riskAssessment,
        Instant createdAt) {

    public MigrationPlan {
        phases = phases == null ? List.of() : List.copyOf(phases);
        migrationOrder = migrationOrder == null ? List.of() : List.copyOf(migrationOrder);
        timeline = timeline == null ? Map.of() : timeline;
    }

    public record RollbackPlan(
            String strategy,
            List<String> rollbackOrder,
            List<String> prerequisites,
            List<String> triggers,
            String estimatedTime) {
    }

    public record TestingPlan(List<String> stages, List<String> environments, List<String> criticalTestCases) {
    }

    public record CommunicationPlan(List<String> stakeholders, List<String> channels, Map<String, String> milestones) {
    }
}
