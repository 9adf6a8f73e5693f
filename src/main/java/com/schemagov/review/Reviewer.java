package com.schemagov.review;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A reviewer reference: either a named person or a team whose maintainers and admins may review.
 * In configuration a team is written with a leading {@code @}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Reviewer.Individual.class, name = "individual"),
        @JsonSubTypes.Type(value = Reviewer.TeamRef.class, name = "team")
})
public sealed interface Reviewer permits Reviewer.Individual, Reviewer.TeamRef {
    String TEAM_PREFIX = "@";

    String name();

    String handle();

    static Reviewer parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        String trimmed = raw.trim();
        if (trimmed.startsWith(TEAM_PREFIX)) {
            return new TeamRef(trimmed.substring(TEAM_PREFIX.length()));
        }
        return new Individual(trimmed);
    }

    static Reviewer team(String name) {
        return new TeamRef(name);
    }

    record Individual(String name) implements Reviewer {
        public Individual {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("reviewer name must not be blank");
            }
        }

        @Override
        public String handle() {
            return name;
        }
    }

    record TeamRef(String name) implements Reviewer {
        public TeamRef {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("team name must not be blank");
            }
        }

        @Override
        public String handle() {
            return TEAM_PREFIX + name;
        }
    }
}
