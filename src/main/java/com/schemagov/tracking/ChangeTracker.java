package com.schemagov.tracking;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.schemagov.detect.BreakingChange;
import com.schemagov.detect.BreakingChangeClassifier;
import com.schemagov.governance.ChangeKind;
import com.schemagov.governance.GovernanceService;
import com.schemagov.governance.PolicyEvaluation;
import com.schemagov.governance.PolicyResult;
import com.schemagov.governance.PolicyStore;
import com.schemagov.governance.SchemaChange;
import com.schemagov.governance.Timeframes;
import com.schemagov.impact.BreakingChangeAssessment;
import com.schemagov.impact.BreakingChangeAssessor;
import com.schemagov.impact.ImpactAnalyzer;
import com.schemagov.impact.ImpactLevel;
import com.schemagov.impact.ServiceImpact;
import com.schemagov.impact.TeamImpact;
import com.schemagov.notify.NotificationPayload;
import com.schemagov.notify.Notifier;
import com.schemagov.review.ReviewRequest;
import com.schemagov.review.ReviewWorkflowEngine;
import com.schemagov.review.Reviewer;
import com.schemagov.store.AuditRecord;
import com.schemagov.store.AuditResult;
import com.schemagov.store.AuditTrail;
import com.schemagov.store.Versioned;
import com.schemagov.store.VersionedStore;
import com.schemagov.team.TeamDirectory;

/**
 * Records proposed schema changes, runs breaking change detection and impact analysis on them, opens reviews
 * where needed and notifies the teams involved.
 */
public class ChangeTracker {
    private static final Logger log = LoggerFactory.getLogger(ChangeTracker.class);
    private static final int TOP_ENTRIES = 5;

    private final VersionedStore<ChangeRecord> store;
    private final AuditTrail auditTrail;
    private final BreakingChangeClassifier classifier;
    private final ImpactAnalyzer impactAnalyzer;
    private final BreakingChangeAssessor assessor;
    private final GovernanceService governance;
    private final ReviewWorkflowEngine reviews;
    private final TeamDirectory teamDirectory;
    private final PolicyStore policyStore;
    private final Notifier notifier;
    private final Clock clock;

    public ChangeTracker(
            VersionedStore<ChangeRecord> store,
            AuditTrail auditTrail,
            BreakingChangeClassifier classifier,
            ImpactAnalyzer impactAnalyzer,
            GovernanceService governance,
            ReviewWorkflowEngine reviews,
            TeamDirectory teamDirectory,
            PolicyStore policyStore,
            Notifier notifier) {
        this(store, auditTrail, classifier, impactAnalyzer, new BreakingChangeAssessor(), governance, reviews,
                teamDirectory, policyStore, notifier, Clock.systemUTC());
    }

    ChangeTracker(
            VersionedStore<ChangeRecord> store,
            AuditTrail auditTrail,
            BreakingChangeClassifier classifier,
            ImpactAnalyzer impactAnalyzer,
            BreakingChangeAssessor assessor,
            GovernanceService governance,
            ReviewWorkflowEngine reviews,
            TeamDirectory teamDirectory,
            PolicyStore policyStore,
            Notifier notifier,
            Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.impactAnalyzer = Objects.requireNonNull(impactAnalyzer, "impactAnalyzer");
        this.assessor = Objects.requireNonNull(assessor, "assessor");
        this.governance = Objects.requireNonNull(governance, "governance");
        this.reviews = Objects.requireNonNull(reviews, "reviews");
        this.teamDirectory = Objects.requireNonNull(teamDirectory, "teamDirectory");
        this.policyStore = Objects.requireNonNull(policyStore, "policyStore");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.clock = clock;
    }

    public ChangeRecord trackSchemaChange(SchemaChange change) {
        return trackSchemaChange(change, null);
    }

    /**
     * Tracks {@code change}. Modifications are compared against {@code baselineRef}, or the change's repository
     * when no baseline is given.
     */
    public ChangeRecord trackSchemaChange(SchemaChange change, String baselineRef) {
        Objects.requireNonNull(change, "change");
        MDC.put("changeId", change.id());
        try {
            String owningTeam = change.owningTeam() != null
                    ? change.owningTeam()
                    : teamDirectory.owningTeamOf(change.repository()).orElse(null);

            List<BreakingChange> breakingChanges = List.of();
            if (change.kind() == ChangeKind.MODIFICATION) {
                String baseline = baselineRef == null || baselineRef.isBlank() ? change.repository() : baselineRef;
                breakingChanges = classifier.detect(change.target(), baseline).stream()
                        .map(breaking -> breaking.withRepository(change.repository()))
                        .toList();
                log.info("change.detected target={} baseline={} breaking={}", change.target(), baseline, breakingChanges.size());
            }
            boolean migrationRequired = !breakingChanges.isEmpty();

            PolicyEvaluation breakingEvaluation = null;
            if (!breakingChanges.isEmpty()) {
                breakingEvaluation = governance.evaluateBreakingChangePolicy(breakingChanges);
            }
            PolicyResult breakingPolicy = breakingEvaluation == null ? null : breakingEvaluation.result();

            BreakingChangeAssessment assessment = assessor.assess(breakingChanges);
            List<ServiceImpact> serviceImpacts = impactAnalyzer.identifyAffectedServices(change.target(), breakingChanges);
            List<TeamImpact> teamImpacts = impactAnalyzer.analyzeTeamImpacts(serviceImpacts);
            ImpactLevel impactLevel = ImpactLevel.max(ImpactLevel.LOW, assessment.overallImpact());
            Set<String> affectedTeams = new LinkedHashSet<>(change.affectedTeams());
            for (TeamImpact teamImpact : teamImpacts) {
                impactLevel = ImpactLevel.max(impactLevel, teamImpact.impactLevel());
                affectedTeams.add(teamImpact.team());
            }
            boolean highImpact = impactLevel.atLeast(ImpactLevel.HIGH);
            boolean reviewRequired = migrationRequired || highImpact || requiresReviewForAllChanges(owningTeam);

            Instant now = clock.instant();
            ChangeRecord created = new ChangeRecord(
                    change.id(),
                    change,
                    owningTeam,
                    breakingChanges,
                    impactLevel,
                    new ArrayList<>(affectedTeams),
                    migrationRequired,
                    reviewRequired,
                    null,
                    reviewRequired ? ApprovalState.PENDING : ApprovalState.NOT_REQUIRED,
                    breakingPolicy,
                    migrationSteps(change.target(), breakingChanges),
                    estimatedMigrationTime(migrationRequired, impactLevel),
                    List.of(),
                    now,
                    now);

            // The record is stored before any review or audit entry exists for it.
            if (!store.compareAndSet(change.id(), 0, created)) {
                throw new ChangeTrackingException("Change " + change.id() + " is already tracked");
            }
            if (breakingEvaluation != null) {
                governance.recordEvaluation(breakingEvaluation);
                log.info("policy.breaking change={} action={} violations={}",
                        change.id(), breakingPolicy.action().value(), breakingPolicy.violations().size());
            }

            ChangeRecord record = created;
            if (reviewRequired) {
                String reviewId = openReview(change, owningTeam, affectedTeams, highImpact);
                if (reviewId != null) {
                    record = store.update(change.id(), () -> created,
                            current -> current.withReviewId(reviewId, clock.instant())).value();
                }
            }

            auditTrail.append(new AuditRecord("change_tracked", change.target(), change.author(), now,
                    breakingPolicy != null && breakingPolicy.blocking() ? AuditResult.WARNING : AuditResult.SUCCESS,
                    trackedDetails(record)));
            log.info("change.tracked id={} target={} impact={} breaking={} review={}",
                    change.id(), change.target(), impactLevel.value(), breakingChanges.size(), record.reviewId());

            List<NotificationEntry> notifications = notifyTeams(record);
            if (notifications.isEmpty()) {
                return record;
            }
            ChangeRecord linked = record;
            Versioned<ChangeRecord> saved = store.update(change.id(), () -> linked,
                    current -> current.withNotifications(notifications, clock.instant()));
            return saved.value();
        } catch (IOException e) {
            throw new ChangeTrackingException("Failed to persist change " + change.id(), e);
        } finally {
            MDC.remove("changeId");
        }
    }

    /**
     * Copies the status of the linked review into the change's approval state.
     */
    public ChangeRecord syncReviewStatus(String changeId) {
        MDC.put("changeId", changeId);
        try {
            ChangeRecord record = load(changeId);
            if (record.reviewId() == null) {
                return record;
            }
            ReviewRequest review = reviews.getReview(record.reviewId());
            ApprovalState state = ApprovalState.of(review.status());
            if (state == record.approvalState()) {
                return record;
            }
            Versioned<ChangeRecord> saved = store.update(changeId, () -> record,
                    current -> current.withApprovalState(state, clock.instant()));
            auditTrail.append(new AuditRecord("change_review_synced", record.change().target(), "system", clock.instant(),
                    AuditResult.SUCCESS, Map.of("change_id", changeId, "review_id", review.id(), "approval_state", state.value())));
            log.info("change.review_synced id={} review={} state={}", changeId, review.id(), state.value());
            return saved.value();
        } catch (IOException e) {
            throw new ChangeTrackingException("Failed to sync review status for change " + changeId, e);
        } finally {
            MDC.remove("changeId");
        }
    }

    public Optional<ChangeRecord> getChange(String changeId) {
        try {
            return store.get(changeId).map(Versioned::value);
        } catch (IOException e) {
            throw new ChangeTrackingException("Failed to read change " + changeId, e);
        }
    }

    public List<ChangeRecord> getChangeHistory(ChangeHistoryQuery query) {
        ChangeHistoryQuery filter = query == null ? ChangeHistoryQuery.all() : query;
        return allRecords().stream()
                .filter(record -> filter.target() == null || filter.target().equals(record.change().target()))
                .filter(record -> filter.team() == null || record.involvesTeam(filter.team()))
                .filter(record -> filter.since() == null || !record.createdAt().isBefore(filter.since()))
                .sorted(Comparator.comparing(ChangeRecord::createdAt).reversed())
                .limit(filter.limit())
                .toList();
    }

    public ChangeReport generateChangeReport(String timeframe) {
        Instant now = clock.instant();
        Instant since = now.minus(Timeframes.parse(timeframe));
        List<ChangeRecord> records = allRecords().stream()
                .filter(record -> !record.createdAt().isBefore(since))
                .toList();

        long breaking = records.stream().filter(record -> !record.breakingChanges().isEmpty()).count();
        long reviewsRequired = records.stream().filter(ChangeRecord::reviewRequired).count();
        long pendingReviews = records.stream().filter(record -> record.approvalState() == ApprovalState.PENDING).count();
        long highImpact = records.stream().filter(record -> record.impactLevel().atLeast(ImpactLevel.HIGH)).count();

        Map<String, Long> impactBreakdown = new LinkedHashMap<>();
        for (ImpactLevel level : ImpactLevel.values()) {
            long count = records.stream().filter(record -> record.impactLevel() == level).count();
            if (count > 0) {
                impactBreakdown.put(level.value(), count);
            }
        }
        Map<String, Long> changeTypes = new LinkedHashMap<>();
        for (ChangeKind kind : ChangeKind.values()) {
            long count = records.stream().filter(record -> record.change().kind() == kind).count();
            if (count > 0) {
                changeTypes.put(kind.value(), count);
            }
        }

        List<String> recommendations = new ArrayList<>();
        if (!records.isEmpty() && breaking * 5 > records.size()) {
            recommendations.add("High rate of breaking changes: run compatibility checks before proposing changes");
        }
        if (highImpact > 0) {
            recommendations.add("Review " + highImpact + " high impact change(s) with the affected teams");
        }
        if (pendingReviews > TOP_ENTRIES) {
            recommendations.add("Review backlog of " + pendingReviews + " pending change(s) needs attention");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Change activity is within normal parameters");
        }

        return new ChangeReport(
                timeframe,
                since,
                now,
                records.size(),
                breaking,
                reviewsRequired,
                pendingReviews,
                impactBreakdown,
                changeTypes,
                top(records.stream().map(record -> record.change().repository()).filter(repo -> !repo.isBlank()).toList()),
                top(records.stream().flatMap(record -> {
                    Set<String> teams = new LinkedHashSet<>(record.affectedTeams());
                    if (record.owningTeam() != null) {
                        teams.add(record.owningTeam());
                    }
                    return teams.stream();
                }).toList()),
                recommendations);
    }

    private String openReview(SchemaChange change, String owningTeam, Set<String> affectedTeams, boolean highImpact)
            throws IOException {
        List<Reviewer> reviewers = new ArrayList<>();
        if (owningTeam != null) {
            reviewers.add(Reviewer.team(owningTeam));
        }
        if (highImpact) {
            for (String team : affectedTeams) {
                if (!team.equals(owningTeam)) {
                    reviewers.add(Reviewer.team(team));
                }
            }
        }
        if (reviewers.isEmpty()) {
            reviewers.addAll(policyStore.reviewPolicyFor(change.repository(), owningTeam).requiredReviewers());
        }
        if (reviewers.isEmpty()) {
            log.warn("change.no_reviewers id={} target={}", change.id(), change.target());
            return null;
        }
        ReviewRequest review = reviews.createOrGetReviewRequest(
                change.target(),
                reviewers,
                highImpact ? 2 : 1,
                change.description(),
                change.author(),
                change.id());
        return review.id();
    }

    private boolean requiresReviewForAllChanges(String owningTeam) {
        if (owningTeam == null) {
            return false;
        }
        return teamDirectory.settings(owningTeam).requireReviewAllChanges()
                || policyStore.requiresReviewForAllChanges(owningTeam);
    }

    private List<NotificationEntry> notifyTeams(ChangeRecord record) {
        Set<String> teams = new LinkedHashSet<>();
        if (record.owningTeam() != null) {
            teams.add(record.owningTeam());
        }
        teams.addAll(record.affectedTeams());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("change_type", record.change().kind().value());
        details.put("author", record.change().author());
        details.put("repository", record.change().repository());
        details.put("impact_level", record.impactLevel().value());
        details.put("breaking_changes", record.breakingChanges().size());
        details.put("migration_required", record.migrationRequired());
        details.put("review_id", record.reviewId());
        NotificationPayload payload = new NotificationPayload(
                "schema_change", record.changeId(), record.change().target(), details, clock.instant());

        List<NotificationEntry> entries = new ArrayList<>();
        List<String> channels = policyStore.notificationChannels();
        for (String team : teams) {
            try {
                notifier.notifyTeam(team, payload);
                entries.add(new NotificationEntry(team, payload.type(), clock.instant(), channels, true, null));
            } catch (RuntimeException e) {
                log.warn("change.notify_failed id={} team={} error={}", record.changeId(), team, e.getMessage());
                entries.add(new NotificationEntry(team, payload.type(), clock.instant(), channels, false, e.getMessage()));
            }
        }
        return entries;
    }

    private static List<String> migrationSteps(String target, List<BreakingChange> breakingChanges) {
        if (breakingChanges.isEmpty()) {
            return List.of();
        }
        List<String> steps = new ArrayList<>();
        steps.add("Review the " + breakingChanges.size() + " breaking change(s) in " + target);
        breakingChanges.stream()
                .map(BreakingChange::migrationNote)
                .filter(note -> note != null && !note.isBlank())
                .distinct()
                .forEach(steps::add);
        steps.add("Regenerate client code for every consumer of " + target);
        steps.add("Deploy updated consumers before publishing the new schema version");
        return steps;
    }

    private static String estimatedMigrationTime(boolean migrationRequired, ImpactLevel level) {
        if (!migrationRequired) {
            return "none";
        }
        return switch (level) {
            case NONE, LOW -> "1-2 hours";
            case MEDIUM -> "4-8 hours";
            case HIGH -> "1-2 days";
            case CRITICAL -> "1-2 weeks";
        };
    }

    private static Map<String, Object> trackedDetails(ChangeRecord record) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("change_id", record.changeId());
        details.put("change_type", record.change().kind().value());
        details.put("repository", record.change().repository());
        details.put("owning_team", record.owningTeam());
        details.put("impact_level", record.impactLevel().value());
        details.put("breaking_changes", record.breakingChanges().size());
        details.put("review_required", record.reviewRequired());
        details.put("review_id", record.reviewId());
        if (record.breakingChangePolicy() != null) {
            details.put("breaking_policy_action", record.breakingChangePolicy().action().value());
        }
        return details;
    }

    private ChangeRecord load(String changeId) throws IOException {
        return store.get(changeId)
                .map(Versioned::value)
                .orElseThrow(() -> new ChangeTrackingException("Change " + changeId + " not found"));
    }

    private List<ChangeRecord> allRecords() {
        try {
            return store.snapshot().values().stream().map(Versioned::value).toList();
        } catch (IOException e) {
            throw new ChangeTrackingException("Failed to read tracked changes", e);
        }
    }

    private static List<ChangeReport.RankedCount> top(List<String> names) {
        Map<String, Long> counts = names.stream()
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(TOP_ENTRIES)
                .map(entry -> new ChangeReport.RankedCount(entry.getKey(), entry.getValue()))
                .toList();
    }
}
