package com.schemagov.impact;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MigrationStrategy {
    IMMEDIATE,
    PHASED,
    COORDINATED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MigrationStrategy fromValue(String value) {
        return MigrationStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
