package com.schemagov.tracking;

import java.time.Instant;

/**
 * Filters for change history. Null fields do not filter.
 */
public record ChangeHistoryQuery(String target, String team, Instant since, int limit) {
    public static final int DEFAULT_LIMIT = 50;

    public ChangeHistoryQuery {
        limit = limit <= 0 ? DEFAULT_LIMIT : limit;
    }

    public static ChangeHistoryQuery all() {
        return new ChangeHistoryQuery(null, null, null, DEFAULT_LIMIT);
    }
}
