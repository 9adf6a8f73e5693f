package com.schemagov.governance;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PolicyAction {
    ALLOW,
    WARN,
    ERROR,
    REQUIRE_APPROVAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PolicyAction fromValue(String value) {
        return PolicyAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
