package com.schemagov.governance;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.schemagov.store.AuditRecord;
import com.schemagov.store.AuditResult;
import com.schemagov.store.JsonLinesAuditTrail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ComplianceReporterTest {

    private static final Instant NOW = Instant.parse("2026-06-15T12:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void shouldSummariseEventsInsideWindow() throws Exception {
        JsonLinesAuditTrail trail = new JsonLinesAuditTrail(tempDir.resolve("audit.jsonl"));
        trail.append(record("change_tracked", "orders.proto", "alice", NOW.minus(Duration.ofDays(1)), AuditResult.SUCCESS));
        trail.append(record("review_required", "orders.proto", "alice", NOW.minus(Duration.ofDays(1)), AuditResult.WARNING));
        trail.append(record("breaking_changes_blocked", "acme/orders", "system", NOW.minus(Duration.ofHours(3)), AuditResult.FAILURE));
        trail.append(record("breaking_changes_approved", "orders.proto", "bob", NOW.minus(Duration.ofHours(2)), AuditResult.SUCCESS));
        trail.append(record("breaking_changes_approved", "orders.proto", "bob", NOW.minus(Duration.ofHours(1)), AuditResult.WARNING));
        trail.append(record("change_tracked", "legacy.proto", "carol", NOW.minus(Duration.ofDays(30)), AuditResult.SUCCESS));

        ComplianceReport report = new ComplianceReporter(trail, Clock.fixed(NOW, ZoneOffset.UTC)).generate("7d");

        ComplianceReport.Summary summary = report.summary();
        assertEquals(5, summary.totalEvents());
        assertEquals(1, summary.schemaChanges());
        assertEquals(1, summary.reviewsRequired());
        assertEquals(1, summary.breakingChangesDetected());
        assertEquals(1, summary.breakingChangesApproved());
        assertEquals(1, summary.policyViolations());
        assertEquals(NOW.minus(Duration.ofDays(7)), report.since());
        assertEquals(Map.of("acme/orders", 1L, "orders.proto", 4L), report.byTarget());
        assertEquals(2L, report.byActor().get("bob"));
    }

    @Test
    void shouldRejectMalformedTimeframe() {
        ComplianceReporter reporter = new ComplianceReporter(new JsonLinesAuditTrail(tempDir.resolve("audit.jsonl")));

        assertThrows(IllegalArgumentException.class, () -> reporter.generate("soon"));
    }

    @Test
    void shouldParseTimeframeUnits() {
        assertEquals(Duration.ofHours(24), Timeframes.parse("24h"));
        assertEquals(Duration.ofMinutes(30), Timeframes.parse("30m"));
        assertEquals(Duration.ofDays(3), Timeframes.parse("3"));
        assertThrows(IllegalArgumentException.class, () -> Timeframes.parse("5w"));
        assertThrows(IllegalArgumentException.class, () -> Timeframes.parse(" "));
    }

    private static AuditRecord record(String action, String target, String actor, Instant at, AuditResult result) {
        return new AuditRecord(action, target, actor, at, result, Map.of());
    }
}
