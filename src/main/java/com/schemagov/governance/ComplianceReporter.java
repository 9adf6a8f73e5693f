package com.schemagov.governance;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import com.schemagov.store.AuditRecord;
import com.schemagov.store.AuditResult;
import com.schemagov.store.AuditTrail;

/**
 * Summarises the audit trail over a trailing window for compliance review.
 */
public class ComplianceReporter {
    private static final Set<String> SCHEMA_CHANGE_ACTIONS = Set.of("schema_change", "change_tracked");
    private static final Set<String> BREAKING_DETECTED_ACTIONS = Set.of(
            "breaking_changes_allowed",
            "breaking_changes_warning",
            "breaking_changes_blocked",
            "breaking_approval_required");

    private final AuditTrail auditTrail;
    private final Clock clock;

    public ComplianceReporter(AuditTrail auditTrail) {
        this(auditTrail, Clock.systemUTC());
    }

    ComplianceReporter(AuditTrail auditTrail, Clock clock) {
        this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail");
        this.clock = clock;
    }

    public ComplianceReport generate(String timeframe) throws IOException {
        Instant now = clock.instant();
        Instant since = now.minus(Timeframes.parse(timeframe));
        List<AuditRecord> records = auditTrail.readAll().stream()
                .filter(record -> !record.timestamp().isBefore(since))
                .toList();

        ComplianceReport.Summary summary = new ComplianceReport.Summary(
                records.size(),
                count(records, record -> SCHEMA_CHANGE_ACTIONS.contains(record.action())),
                count(records, record -> "review_required".equals(record.action())),
                count(records, record -> "review_approved".equals(record.action())),
                count(records, record -> BREAKING_DETECTED_ACTIONS.contains(record.action())),
                count(records, record -> "breaking_changes_approved".equals(record.action())
                        && record.result() == AuditResult.SUCCESS),
                count(records, record -> record.result() == AuditResult.FAILURE));

        return new ComplianceReport(
                timeframe,
                since,
                now,
                summary,
                groupBy(records, AuditRecord::action),
                groupBy(records, AuditRecord::target),
                groupBy(records, AuditRecord::actor));
    }

    private static long count(List<AuditRecord> records, Predicate<AuditRecord> predicate) {
        return records.stream().filter(predicate).count();
    }

    private static Map<String, Long> groupBy(List<AuditRecord> records, Function<AuditRecord, String> key) {
        return records.stream().collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
    }
}
