package com.schemagov.team;

import java.util.Objects;

public record TeamMember(String username, TeamRole role) {
    public TeamMember {
        Objects.requireNonNull(username, "username");
        role = role == null ? TeamRole.CONTRIBUTOR : role;
    }
}
