package com.schemagov.dependency;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DependencyStrength {
    WEAK(1),
    MEDIUM(2),
    STRONG(3),
    CRITICAL(4);

    private final int score;

    DependencyStrength(int score) {
        this.score = score;
    }

    public int score() {
        return score;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DependencyStrength fromValue(String value) {
        return DependencyStrength.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
