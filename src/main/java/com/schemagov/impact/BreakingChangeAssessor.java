package com.schemagov.impact;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.schemagov.detect.BreakingChange;
import com.schemagov.detect.ImpactTier;

public class BreakingChangeAssessor {

    public BreakingChangeAssessment assess(List<BreakingChange> changes) {
        List<BreakingChange> safeChanges = changes == null ? List.of() : changes;
        Map<ImpactTier, Integer> counts = new EnumMap<>(ImpactTier.class);
        ImpactLevel overall = ImpactLevel.NONE;
        Set<String> components = new LinkedHashSet<>();
        for (BreakingChange change : safeChanges) {
            counts.merge(change.impact(), 1, Integer::sum);
            overall = ImpactLevel.max(overall, ImpactLevel.of(change.impact()));
            components.add(componentOf(change.location()));
        }

        int severe = counts.getOrDefault(ImpactTier.HIGH, 0) + counts.getOrDefault(ImpactTier.CRITICAL, 0);
        int medium = counts.getOrDefault(ImpactTier.MEDIUM, 0);
        ImpactLevel complexity;
        if (safeChanges.isEmpty()) {
            complexity = ImpactLevel.NONE;
        } else if (severe > 0) {
            complexity = ImpactLevel.HIGH;
        } else if (medium > 2 || safeChanges.size() > 5) {
            complexity = ImpactLevel.MEDIUM;
        } else {
            complexity = ImpactLevel.LOW;
        }

        List<String> recommendations = new ArrayList<>();
        if (severe > 0) {
            recommendations.add("Coordinate with consuming teams before release");
            recommendations.add("Consider a major version bump for the schema");
            recommendations.add("Keep the old definitions deprecated for a transition period");
        }
        if (medium > 0) {
            recommendations.add("Publish migration guidance alongside the change");
        }
        if (safeChanges.size() > 3) {
            recommendations.add("Split the change into smaller incremental releases");
        }
        return new BreakingChangeAssessment(overall, complexity, safeChanges.size(), counts,
                new ArrayList<>(components), recommendations);
    }

    /**
     * File stem of a {@code path/to/file.proto:line} location.
     */
    static String componentOf(String location) {
        if (location == null || location.isBlank()) {
            return "unknown";
        }
        String file = location;
        int colon = file.lastIndexOf(':');
        if (colon > 0) {
            file = file.substring(0, colon);
        }
        int slash = file.lastIndexOf('/');
        if (slash >= 0) {
            file = file.substring(slash + 1);
        }
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }
}
