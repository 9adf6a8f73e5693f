package com.schemagov.store;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditResult {
    SUCCESS,
    FAILURE,
    WARNING;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditResult fromValue(String value) {
        return AuditResult.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
