package com.schemagov.governance;

import java.time.Instant;
import java.util.Map;

public record ComplianceReport(
        String timeframe,
        Instant since,
        Instant generatedAt,
        Summary summary,
        Map<String, Long> byAction,
        Map<String, Long> byTarget,
        Map<String, Long> byActor) {

    public record Summary(
            long totalEvents,
            long schemaChanges,
            long reviewsRequired,
            long reviewsApproved,
            long breakingChangesDetected,
            long breakingChangesApproved,
            long policyViolations) {
    }
}
