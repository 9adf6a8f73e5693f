package com.schemagov.tracking;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.schemagov.detect.BreakingChange;
import com.schemagov.governance.PolicyResult;
import com.schemagov.governance.SchemaChange;
import com.schemagov.impact.ImpactLevel;

/**
 * Everything known about a tracked schema change. Only the change tracker creates or updates these.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChangeRecord(
        String changeId,
        SchemaChange change,
        String owningTeam,
        List<BreakingChange> breakingChanges,
        ImpactLevel impactLevel,
        List<String> affectedTeams,
        boolean migrationRequired,
        boolean reviewRequired,
        String reviewId,
        ApprovalState approvalState,
        PolicyResult breakingChangePolicy,
        List<String> migrationSteps,
        String estimatedMigrationTime,
        List<NotificationEntry> notifications,
        Instant createdAt,
        Instant updatedAt) {

    public ChangeRecord {
        Objects.requireNonNull(changeId, "changeId");
        Objects.requireNonNull(change, "change");
        breakingChanges = breakingChanges == null ? List.of() : List.copyOf(breakingChanges);
        impactLevel = impactLevel == null ? ImpactLevel.LOW : impactLevel;
        affectedTeams = affectedTeams == null ? List.of() : List.copyOf(affectedTeams);
        approvalState = approvalState == null ? ApprovalState.NOT_REQUIRED : approvalState;
        migrationSteps = migrationSteps == null ? List.of() : List.copyOf(migrationSteps);
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
    }

    ChangeRecord withNotifications(List<NotificationEntry> entries, Instant timestamp) {
        return new ChangeRecord(changeId, change, owningTeam, breakingChanges, impactLevel, affectedTeams,
                migrationRequired, reviewRequired, reviewId, approvalState, breakingChangePolicy, migrationSteps,
                estimatedMigrationTime, entries, createdAt, timestamp);
    }

    ChangeRecord withReviewId(String linkedReviewId, Instant timestamp) {
        return new ChangeRecord(changeId, change, owningTeam, breakingChanges, impactLevel, affectedTeams,
                migrationRequired, reviewRequired, linkedReviewId, approvalState, breakingChangePolicy, migrationSteps,
                estimatedMigrationTime, notifications, createdAt, timestamp);
    }

    ChangeRecord withApprovalState(ApprovalState state, Instant timestamp) {
        return new ChangeRecord(changeId, change, owningTeam, breakingChanges, impactLevel, affectedTeams,
                migrationRequired, reviewRequired, reviewId, state, breakingChangePolicy, migrationSteps,
                estimatedMigrationTime, notifications, createdAt, timestamp);
    }

    public boolean involvesTeam(String team) {
        return team.equals(owningTeam) || affectedTeams.contains(team);
    }
}
