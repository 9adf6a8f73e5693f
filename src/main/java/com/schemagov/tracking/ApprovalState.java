package com.schemagov.tracking;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.schemagov.review.ReviewStatus;

public enum ApprovalState {
    NOT_REQUIRED,
    PENDING,
    APPROVED,
    REJECTED,
    CANCELLED;

    public static ApprovalState of(ReviewStatus status) {
        return switch (status) {
            case PENDING -> PENDING;
            case APPROVED -> APPROVED;
            case REJECTED -> REJECTED;
            case CANCELLED -> CANCELLED;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ApprovalState fromValue(String value) {
        return ApprovalState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
