package com.schemagov.detect;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ImpactTier {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ImpactTier fromValue(String value) {
        return ImpactTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
