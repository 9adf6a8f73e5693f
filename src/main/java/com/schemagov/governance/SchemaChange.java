package com.schemagov.governance;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A proposed schema change. Created once and never modified.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchemaChange(
        String id,
        String target,
        ChangeKind kind,
        String author,
        String repository,
        String owningTeam,
        List<String> affectedTeams,
        boolean breaking,
        String description,
        Instant createdAt) {

    public SchemaChange {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
        author = author == null ? "unknown" : author;
        repository = repository == null ? "" : repository;
        affectedTeams = affectedTeams == null ? List.of() : List.copyOf(affectedTeams);
        description = description == null ? "" : description;
    }

    public static SchemaChange propose(
            String target,
            ChangeKind kind,
            String author,
            String repository,
            String owningTeam,
            List<String> affectedTeams,
            boolean breaking,
            String description,
            Clock clock) {
        Instant now = clock.instant();
        return new SchemaChange(newId(now), target, kind, author, repository, owningTeam, affectedTeams, breaking,
                description, now);
    }

    static String newId(Instant now) {
        return "CHG_" + now.getEpochSecond() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
