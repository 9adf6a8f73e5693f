package com.schemagov.dependency;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UsagePattern {
    CONSUMER,
    PRODUCER,
    BOTH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static UsagePattern fromValue(String value) {
        return UsagePattern.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
