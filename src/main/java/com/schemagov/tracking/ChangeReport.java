package com.schemagov.tracking;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ChangeReport(
        String timeframe,
        Instant since,
        Instant generatedAt,
        long totalChanges,
        long breakingChanges,
        long reviewsRequired,
        long pendingReviews,
        Map<String, Long> impactBreakdown,
        Map<String, Long> changeTypes,
        List<RankedCount> topRepositories,
        List<RankedCount> topTeams,
        List<String> recommendations) {

    public record RankedCount(String name, long count) {
    }
}
