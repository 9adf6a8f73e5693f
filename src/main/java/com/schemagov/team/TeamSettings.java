package com.schemagov.team;

public record TeamSettings(boolean requireReviewAllChanges) {
    public static TeamSettings defaults() {
        return new TeamSettings(false);
    }
}
