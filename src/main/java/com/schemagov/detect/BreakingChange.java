package com.schemagov.detect;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One backward-incompatible schema edit as reported by the breaking change classifier.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BreakingChange(
        String type,
        String description,
        String location,
        ImpactTier impact,
        String repository,
        String before,
        String after,
        String migrationNote) {

    public BreakingChange {
        Objects.requireNonNull(type, "type");
        description = description == null ? "" : description;
        location = location == null ? "" : location;
        impact = impact == null ? ImpactTier.LOW : impact;
        repository = repository == null ? "" : repository;
    }

    public BreakingChange withRepository(String owningRepository) {
        return new BreakingChange(type, description, location, impact, owningRepository, before, after, migrationNote);
    }

    public String violationSummary() {
        return type + ": " + description;
    }
}
