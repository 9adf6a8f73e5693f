package com.schemagov.impact;

import java.util.List;

public record TeamImpact(
        String team,
        ImpactLevel impactLevel,
        List<String> affectedServices,
        List<String> requiredActions,
        List<String> riskFactors,
        List<String> mitigationStrategies,
        ContactPriority contactPriority) {

    public TeamImpact {
        affectedServices = affectedServices == null ? List.of() : List.copyOf(affectedServices);
        requiredActions = requiredActions == null ? List.of() : List.copyOf(requiredActions);
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        mitigationStrategies = mitigationStrategies == null ? List.of() : List.copyOf(mitigationStrategies);
    }
}
