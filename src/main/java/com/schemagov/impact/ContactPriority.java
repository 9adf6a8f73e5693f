package com.schemagov.impact;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ContactPriority {
    URGENT,
    NORMAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
