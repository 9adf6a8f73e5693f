package com.schemagov.impact;

import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public record RiskAssessment(RiskLevel overallRisk, List<Risk> risks, List<String> mitigations) {
    public RiskAssessment {
        risks = risks == null ? List.of() : List.copyOf(risks);
        mitigations = mitigations == null ? List.of() : List.copyOf(mitigations);
    }

    public record Risk(String description, RiskLevel impact, RiskLevel probability) {
    }

    public enum RiskLevel {
        LOW,
        MEDIUM,
        HIGH;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static RiskLevel fromValue(String value) {
            return RiskLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
