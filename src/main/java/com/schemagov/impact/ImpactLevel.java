package com.schemagov.impact;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.schemagov.detect.ImpactTier;

public enum ImpactLevel {
    NONE(0),
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int score;

    ImpactLevel(int score) {
        this.score = score;
    }

    public int score() {
        return score;
    }

    public boolean atLeast(ImpactLevel other) {
        return score >= other.score;
    }

    public static ImpactLevel max(ImpactLevel left, ImpactLevel right) {
        return left.score >= right.score ? left : right;
    }

    public static ImpactLevel of(ImpactTier tier) {
        return tier == null ? NONE : ImpactLevel.valueOf(tier.name());
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ImpactLevel fromValue(String value) {
        return ImpactLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
