package com.schemagov.team;

import java.util.List;
import java.util.Optional;

/**
 * Source of team membership. Reviewer expansion and approver validation both go through it.
 */
public interface TeamDirectory {
    /**
     * Current members of the team, or an empty list when the team is unknown.
     */
    List<TeamMember> resolveTeam(String name);

    Optional<String> owningTeamOf(String repository);

    TeamSettings settings(String team);

    default List<String> qualifiedReviewers(String team) {
        return resolveTeam(team).stream()
                .filter(member -> member.role().canReview())
                .map(TeamMember::username)
                .toList();
    }

    default boolean isQualifiedReviewer(String team, String username) {
        return qualifiedReviewers(team).contains(username);
    }
}
