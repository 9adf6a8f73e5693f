package com.schemagov.impact;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.schemagov.detect.BreakingChange;

/**
 * Renders a Markdown migration guide for consumers, one section per affected schema component.
 */
public class MigrationGuideRenderer {
    private final BreakingChangeAssessor assessor;

    public MigrationGuideRenderer() {
        this(new BreakingChangeAssessor());
    }

    MigrationGuideRenderer(BreakingChangeAssessor assessor) {
        this.assessor = assessor;
    }

    public String render(String target, List<BreakingChange> changes) {
        List<BreakingChange> safeChanges = changes == null ? List.of() : changes;
        StringBuilder guide = new StringBuilder();
        guide.append("# Migration guide for ").append(target).append("\n\n");
        if (safeChanges.isEmpty()) {
            guide.append("No breaking changes detected. No migration is required.\n");
            return guide.toString();
        }

        BreakingChangeAssessment assessment = assessor.assess(safeChanges);
        guide.append("- Breaking changes: ").append(assessment.totalChanges()).append('\n');
        guide.append("- Overall impact: ").append(assessment.overallImpact().value()).append('\n');
        guide.append("- Migration complexity: ").append(assessment.migrationComplexity().value()).append("\n\n");

        Map<String, List<BreakingChange>> byComponent = new LinkedHashMap<>();
        for (BreakingChange change : safeChanges) {
            byComponent.computeIfAbsent(BreakingChangeAssessor.componentOf(change.location()), ignored -> new ArrayList<>())
                    .add(change);
        }
        byComponent.forEach((component, componentChanges) -> {
            guide.append("## ").append(component).append("\n\n");
            for (BreakingChange change : componentChanges) {
                guide.append("### ").append(change.type()).append(" (").append(change.impact().value()).append(")\n\n");
                guide.append("- Location: `").append(change.location()).append("`\n");
                guide.append("- Description: ").append(change.description()).append('\n');
                if (change.migrationNote() != null && !change.migrationNote().isBlank()) {
                    guide.append("- Migration: ").append(change.migrationNote()).append('\n');
                }
                guide.append('\n');
            }
        });

        if (!assessment.recommendations().isEmpty()) {
            guide.append("## Recommendations\n\n");
            for (String recommendation : assessment.recommendations()) {
                guide.append("- ").append(recommendation).append('\n');
            }
        }
        return guide.toString();
    }
}
