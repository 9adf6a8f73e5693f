package com.schemagov.impact;

import java.util.List;
import java.util.Map;

import com.schemagov.detect.ImpactTier;

public record BreakingChangeAssessment(
        ImpactLevel overallImpact,
        ImpactLevel migrationComplexity,
        int totalChanges,
        Map<ImpactTier, Integer> changesByImpact,
        List<String> affectedComponents,
        List<String> recommendations) {

    public BreakingChangeAssessment {
        changesByImpact = changesByImpact == null ? Map.of() : Map.copyOf(changesByImpact);
        affectedComponents = affectedComponents == null ? List.of() : List.copyOf(affectedComponents);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
