package com.schemagov.review;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CommentType {
    GENERAL,
    APPROVAL,
    REJECTION,
    QUESTION;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CommentType fromValue(String value) {
        return CommentType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
