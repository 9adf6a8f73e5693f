package com.schemagov.team;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TeamRole {
    VIEWER,
    CONTRIBUTOR,
    MAINTAINER,
    ADMIN;

    public boolean canReview() {
        return this == MAINTAINER || this == ADMIN;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TeamRole fromValue(String value) {
        if (value == null || value.isBlank()) {
            return CONTRIBUTOR;
        }
        return TeamRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
