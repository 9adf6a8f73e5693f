package com.schemagov.impact;

import java.util.List;

public record MigrationPhase(
        int phase,
        String name,
        String description,
        List<String> services,
        String team,
        int minHours,
        int maxHours,
        boolean parallel) {

    public MigrationPhase {
        services = services == null ? List.of() : List.copyOf(services);
    }

    public String duration() {
        return minHours + "-" + maxHours + " hours";
    }
}
