package com.schemagov.review;

import java.time.Instant;
import java.util.Objects;

public record Approval(String reviewer, Instant timestamp, String comment) {
    public Approval {
        Objects.requireNonNull(reviewer, "reviewer");
        Objects.requireNonNull(timestamp, "timestamp");
        comment = comment == null ? "" : comment;
    }
}
