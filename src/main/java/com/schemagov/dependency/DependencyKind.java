package com.schemagov.dependency;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DependencyKind {
    DIRECT,
    TRANSITIVE,
    OPTIONAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DependencyKind fromValue(String value) {
        return DependencyKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
