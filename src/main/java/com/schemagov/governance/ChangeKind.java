package com.schemagov.governance;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeKind {
    ADDITION,
    MODIFICATION,
    REMOVAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ChangeKind fromValue(String value) {
        return ChangeKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
