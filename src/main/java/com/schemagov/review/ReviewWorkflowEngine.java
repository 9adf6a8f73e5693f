package com.schemagov.review;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.schemagov.notify.NotificationPayload;
import com.schemagov.notify.Notifier;
import com.schemagov.store.Versioned;
import com.schemagov.store.VersionedStore;
import com.schemagov.team.TeamDirectory;

/**
 * Review state machine. {@code pending} moves to one of the terminal states {@code approved}, {@code rejected}
 * or {@code cancelled}. Every transition is a compare-and-swap on the review's store entry, retried on conflict.
 */
public class ReviewWorkflowEngine {
    private static final Logger log = LoggerFactory.getLogger(ReviewWorkflowEngine.class);

    private final VersionedStore<ReviewRequest> store;
    private final TeamDirectory teamDirectory;
    private final Notifier notifier;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public ReviewWorkflowEngine(VersionedStore<ReviewRequest> store, TeamDirectory teamDirectory, Notifier notifier) {
        this(store, teamDirectory, notifier, Clock.systemUTC(), () -> UUID.randomUUID().toString().substring(0, 8));
    }

    ReviewWorkflowEngine(
            VersionedStore<ReviewRequest> store,
            TeamDirectory teamDirectory,
            Notifier notifier,
            Clock clock,
            Supplier<String> idGenerator) {
        this.store = Objects.requireNonNull(store, "store");
        this.teamDirectory = Objects.requireNonNull(teamDirectory, "teamDirectory");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    public ReviewRequest createReviewRequest(
            String target,
            List<Reviewer> reviewers,
            int approvalCount,
            String description,
            String createdBy,
            String changeId) throws IOException {
        Objects.requireNonNull(target, "target");
        if (reviewers == null || reviewers.isEmpty()) {
            throw new ReviewWorkflowException("At least one reviewer is required for " + target);
        }
        if (approvalCount < 1) {
            throw new ReviewWorkflowException("Approval count must be at least 1, got " + approvalCount);
        }
        List<Reviewer> distinctReviewers = List.copyOf(new LinkedHashSet<>(reviewers));
        List<String> snapshot = expand(distinctReviewers);
        if (snapshot.size() < approvalCount) {
            log.warn("review.understaffed target={} approvalCount={} currentReviewers={}", target, approvalCount, snapshot.size());
        }

        Instant now = clock.instant();
        for (int attempt = 1; attempt <= VersionedStore.MAX_UPDATE_ATTEMPTS; attempt++) {
            ReviewRequest review = new ReviewRequest(
                    idGenerator.get(),
                    target,
                    changeId,
                    description == null ? "" : description,
                    createdBy == null ? "system" : createdBy,
                    distinctReviewers,
                    snapshot,
                    approvalCount,
                    ReviewStatus.PENDING,
                    List.of(),
                    List.of(),
                    now,
                    now,
                    null);
            if (store.compareAndSet(review.id(), 0, review)) {
                log.info("review.created id={} target={} reviewers={} approvalCount={}",
                        review.id(), target, snapshot, approvalCount);
                notifyReviewers(review, "review_requested", Map.of("reviewers", snapshot, "approval_count", approvalCount));
                return review;
            }
            log.debug("review.id_collision id={}", review.id());
        }
        throw new IllegalStateException("Unable to allocate a unique review id for " + target);
    }

    /**
     * Returns the pending review for {@code target} if there is one, otherwise creates it.
     */
    public synchronized ReviewRequest createOrGetReviewRequest(
            String target,
            List<Reviewer> reviewers,
            int approvalCount,
            String description,
            String createdBy,
            String changeId) throws IOException {
        for (Versioned<ReviewRequest> entry : store.snapshot().values()) {
            ReviewRequest review = entry.value();
            if (review.target().equals(target) && review.status() == ReviewStatus.PENDING) {
                log.info("review.reused id={} target={}", review.id(), target);
                return review;
            }
        }
        return createReviewRequest(target, reviewers, approvalCount, description, createdBy, changeId);
    }

    /**
     * Records an approval. Returns {@code false} without changing anything when the reviewer has already approved.
     */
    public boolean approve(String reviewId, String reviewer, String comment) throws IOException {
        Objects.requireNonNull(reviewer, "reviewer");
        MDC.put("reviewId", reviewId);
        try {
            for (int attempt = 1; attempt <= VersionedStore.MAX_UPDATE_ATTEMPTS; attempt++) {
                Versioned<ReviewRequest> current = load(reviewId);
                ReviewRequest review = current.value();
                if (!isAuthorized(review, reviewer)) {
                    throw new ReviewWorkflowException("Reviewer " + reviewer + " is not authorized for review " + reviewId);
                }
                if (review.hasApprovalFrom(reviewer)) {
                    log.info("review.duplicate_approval id={} reviewer={}", reviewId, reviewer);
                    return false;
                }
                requirePending(review, "approve");

                ReviewRequest updated = review.withApproval(new Approval(reviewer, clock.instant(), comment));
                if (store.compareAndSet(reviewId, current.version(), updated)) {
                    log.info("review.approved_by id={} reviewer={} approvals={}/{} status={}",
                            reviewId, reviewer, updated.approvals().size(), updated.approvalCount(), updated.status().value());
                    if (updated.status() == ReviewStatus.APPROVED) {
                        notifyReviewers(updated, "review_approved", Map.of("approvers", updated.approvers()));
                    }
                    return true;
                }
                log.debug("review.approve_conflict id={} attempt={}", reviewId, attempt);
            }
            throw new IllegalStateException("Gave up approving review " + reviewId + " after repeated conflicts");
        } finally {
            MDC.remove("reviewId");
        }
    }

    public ReviewRequest reject(String reviewId, String reviewer, String reason) throws IOException {
        Objects.requireNonNull(reviewer, "reviewer");
        MDC.put("reviewId", reviewId);
        try {
            for (int attempt = 1; attempt <= VersionedStore.MAX_UPDATE_ATTEMPTS; attempt++) {
                Versioned<ReviewRequest> current = load(reviewId);
                ReviewRequest review = current.value();
                if (!isAuthorized(review, reviewer)) {
                    throw new ReviewWorkflowException("Reviewer " + reviewer + " is not authorized for review " + reviewId);
                }
                requirePending(review, "reject");

                String why = reason == null ? "" : reason;
                ReviewRequest updated = review.resolve(ReviewStatus.REJECTED,
                        new ReviewComment(reviewer, why, CommentType.REJECTION, clock.instant()), why);
                if (store.compareAndSet(reviewId, current.version(), updated)) {
                    log.info("review.rejected id={} reviewer={}", reviewId, reviewer);
                    notifyReviewers(updated, "review_rejected", Map.of("rejected_by", reviewer, "reason", why));
                    return updated;
                }
            }
            throw new IllegalStateException("Gave up rejecting review " + reviewId + " after repeated conflicts");
        } finally {
            MDC.remove("reviewId");
        }
    }

    public ReviewRequest cancel(String reviewId, String actor, String reason) throws IOException {
        Objects.requireNonNull(actor, "actor");
        MDC.put("reviewId", reviewId);
        try {
            for (int attempt = 1; attempt <= VersionedStore.MAX_UPDATE_ATTEMPTS; attempt++) {
                Versioned<ReviewRequest> current = load(reviewId);
                ReviewRequest review = current.value();
                if (!actor.equals(review.createdBy()) && !isAuthorized(review, actor)) {
                    throw new ReviewWorkflowException(actor + " may not cancel review " + reviewId);
                }
                requirePending(review, "cancel");

                String why = reason == null ? "" : reason;
                ReviewRequest updated = review.resolve(ReviewStatus.CANCELLED,
                        new ReviewComment(actor, why, CommentType.GENERAL, clock.instant()), why);
                if (store.compareAndSet(reviewId, current.version(), updated)) {
                    log.info("review.cancelled id={} actor={}", reviewId, actor);
                    notifyReviewers(updated, "review_cancelled", Map.of("cancelled_by", actor));
                    return updated;
                }
            }
            throw new IllegalStateException("Gave up cancelling review " + reviewId + " after repeated conflicts");
        } finally {
            MDC.remove("reviewId");
        }
    }

    public ReviewRequest addComment(String reviewId, String author, String content, CommentType type) throws IOException {
        Objects.requireNonNull(author, "author");
        for (int attempt = 1; attempt <= VersionedStore.MAX_UPDATE_ATTEMPTS; attempt++) {
            Versioned<ReviewRequest> current = load(reviewId);
            requirePending(current.value(), "comment on");
            ReviewRequest updated = current.value().withComment(new ReviewComment(author, content, type, clock.instant()));
            if (store.compareAndSet(reviewId, current.version(), updated)) {
                log.debug("review.commented id={} author={} comments={}", reviewId, author, updated.comments().size());
                return updated;
            }
        }
        throw new IllegalStateException("Gave up commenting on review " + reviewId + " after repeated conflicts");
    }

    public ApprovalStatus checkApprovalStatus(String reviewId) throws IOException {
        ReviewRequest review = load(reviewId).value();
        List<String> pending = new ArrayList<>();
        if (review.status() == ReviewStatus.PENDING) {
            for (String candidate : expand(review.requestedReviewers())) {
                if (!review.hasApprovalFrom(candidate)) {
                    pending.add(candidate);
                }
            }
        }
        return new ApprovalStatus(
                review.id(),
                review.status(),
                review.status() == ReviewStatus.APPROVED,
                review.approvals().size(),
                review.approvalCount(),
                review.approvers(),
                pending);
    }

    public ReviewRequest getReview(String reviewId) throws IOException {
        return load(reviewId).value();
    }

    public List<ReviewRequest> listPendingReviews(String reviewer) throws IOException {
        List<ReviewRequest> pending = new ArrayList<>();
        for (Versioned<ReviewRequest> entry : store.snapshot().values()) {
            ReviewRequest review = entry.value();
            if (review.status() != ReviewStatus.PENDING) {
                continue;
            }
            if (reviewer == null || isAuthorized(review, reviewer)) {
                pending.add(review);
            }
        }
        pending.sort(Comparator.comparing(ReviewRequest::createdAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return pending;
    }

    /**
     * Authority is evaluated against current team membership, not the snapshot taken at creation.
     */
    boolean isAuthorized(ReviewRequest review, String username) {
        for (Reviewer reviewer : review.requestedReviewers()) {
            if (reviewer instanceof Reviewer.Individual individual && individual.name().equals(username)) {
                return true;
            }
            if (reviewer instanceof Reviewer.TeamRef team && teamDirectory.isQualifiedReviewer(team.name(), username)) {
                return true;
            }
        }
        return false;
    }

    private List<String> expand(List<Reviewer> reviewers) {
        Set<String> names = new LinkedHashSet<>();
        for (Reviewer reviewer : reviewers) {
            if (reviewer instanceof Reviewer.TeamRef team) {
                List<String> members = teamDirectory.qualifiedReviewers(team.name());
                if (members.isEmpty()) {
                    log.warn("review.team_unresolved team={}", team.name());
                }
                names.addAll(members);
            } else {
                names.add(reviewer.name());
            }
        }
        return new ArrayList<>(names);
    }

    private Versioned<ReviewRequest> load(String reviewId) throws IOException {
        return store.get(reviewId)
                .orElseThrow(() -> new ReviewWorkflowException("Review request " + reviewId + " not found"));
    }

    private static void requirePending(ReviewRequest review, String action) {
        if (review.status().isTerminal()) {
            throw new ReviewWorkflowException("Cannot " + action + " review " + review.id()
                    + " in terminal status " + review.status().value());
        }
    }

    private void notifyReviewers(ReviewRequest review, String type, Map<String, Object> details) {
        NotificationPayload payload = new NotificationPayload(type, review.id(), review.target(), details, clock.instant());
        for (String recipient : review.notificationRecipients()) {
            try {
                notifier.notifyTeam(recipient, payload);
            } catch (RuntimeException e) {
                log.warn("review.notify_failed id={} recipient={} type={} error={}", review.id(), recipient, type, e.getMessage());
            }
        }
    }
}
