package com.schemagov.review;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.schemagov.notify.NotificationPayload;
import com.schemagov.store.InMemoryVersionedStore;
import com.schemagov.team.MutableTeamDirectory;
import com.schemagov.team.TeamRole;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReviewWorkflowEngineTest {

    private static final String TARGET = "acme/payments/v1/payment.proto";

    private final List<String> notifications = Collections.synchronizedList(new ArrayList<>());
    private MutableTeamDirectory teams;
    private ReviewWorkflowEngine engine;

    @BeforeEach
    void setUp() {
        teams = new MutableTeamDirectory()
                .member("payments-team", "alice", TeamRole.MAINTAINER)
                .member("payments-team", "bob", TeamRole.ADMIN)
                .member("payments-team", "carol", TeamRole.CONTRIBUTOR)
                .member("payments-team", "dave", TeamRole.MAINTAINER);
        AtomicInteger sequence = new AtomicInteger();
        engine = new ReviewWorkflowEngine(
                new InMemoryVersionedStore<>(),
                teams,
                (String team, NotificationPayload payload) -> notifications.add(team + ":" + payload.type()),
                Clock.fixed(Instant.parse("2026-02-10T09:00:00Z"), ZoneOffset.UTC),
                () -> "rev" + sequence.incrementAndGet());
    }

    @Test
    void shouldApproveOnceRequiredCountReached() throws Exception {
        ReviewRequest review = createTeamReview(2);

        assertEquals(List.of("alice", "bob", "dave"), review.resolvedReviewers());
        assertTrue(engine.approve(review.id(), "alice", "looks fine"));
        ApprovalStatus halfway = engine.checkApprovalStatus(review.id());
        assertFalse(halfway.approved());
        assertEquals(List.of("bob", "dave"), halfway.pendingReviewers());

        assertTrue(engine.approve(review.id(), "bob", ""));
        ApprovalStatus done = engine.checkApprovalStatus(review.id());
        assertTrue(done.approved());
        assertEquals(ReviewStatus.APPROVED, done.status());
        assertEquals(List.of("alice", "bob"), done.approvers());
        assertTrue(done.pendingReviewers().isEmpty());
        assertEquals(List.of("payments-team:review_requested", "payments-team:review_approved"), notifications);
        assertEquals(1, engine.getReview(review.id()).comments().size());
    }

    @Test
    void shouldStayPendingUntilBothNamedReviewersApprove() throws Exception {
        ReviewRequest review = engine.createReviewRequest(TARGET,
                List.of(Reviewer.parse("alice"), Reviewer.parse("bob")), 2, "Change currency type", "carol", null);

        engine.approve(review.id(), "alice", null);
        assertEquals(ReviewStatus.PENDING, engine.getReview(review.id()).status());

        engine.approve(review.id(), "bob", null);
        assertEquals(ReviewStatus.APPROVED, engine.getReview(review.id()).status());
        assertEquals(List.of("alice:review_requested", "bob:review_requested", "alice:review_approved", "bob:review_approved"),
                notifications);
    }

    @Test
    void shouldIgnoreDuplicateApproval() throws Exception {
        ReviewRequest review = createTeamReview(2);

        assertTrue(engine.approve(review.id(), "alice", null));
        assertFalse(engine.approve(review.id(), "alice", null));

        assertEquals(1, engine.checkApprovalStatus(review.id()).approvalCount());
    }

    @Test
    void shouldRejectUnauthorizedReviewer() throws Exception {
        ReviewRequest review = createTeamReview(1);

        assertThrows(ReviewWorkflowException.class, () -> engine.approve(review.id(), "carol", null));
        assertThrows(ReviewWorkflowException.class, () -> engine.approve(review.id(), "mallory", null));
        assertThrows(ReviewWorkflowException.class, () -> engine.approve("missing", "alice", null));
    }

    @Test
    void shouldEvaluateAuthorityAgainstCurrentMembership() throws Exception {
        ReviewRequest review = createTeamReview(1);
        teams.remove("payments-team", "dave");
        teams.member("payments-team", "erin", TeamRole.MAINTAINER);

        assertThrows(ReviewWorkflowException.class, () -> engine.approve(review.id(), "dave", null));
        assertTrue(engine.approve(review.id(), "erin", null));
    }

    @Test
    void shouldAcceptNamedIndividualReviewer() throws Exception {
        ReviewRequest review = engine.createReviewRequest(TARGET,
                List.of(Reviewer.parse("frank")), 1, "Rename field", "alice", null);

        assertTrue(engine.approve(review.id(), "frank", null));
        assertTrue(engine.checkApprovalStatus(review.id()).approved());
    }

    @Test
    void shouldKeepRejectedReviewTerminal() throws Exception {
        ReviewRequest review = createTeamReview(2);

        ReviewRequest rejected = engine.reject(review.id(), "bob", "Drops a field still in use");

        assertEquals(ReviewStatus.REJECTED, rejected.status());
        assertEquals("Drops a field still in use", rejected.resolutionReason());
        assertEquals(CommentType.REJECTION, rejected.comments().get(0).type());
        assertThrows(ReviewWorkflowException.class, () -> engine.approve(review.id(), "alice", null));
        assertThrows(ReviewWorkflowException.class, () -> engine.cancel(review.id(), "alice", "late"));
        assertTrue(notifications.contains("payments-team:review_rejected"));
    }

    @Test
    void shouldLetCreatorCancel() throws Exception {
        ReviewRequest review = engine.createReviewRequest(TARGET,
                List.of(Reviewer.team("payments-team")), 1, "Add enum value", "zoe", null);

        assertThrows(ReviewWorkflowException.class, () -> engine.cancel(review.id(), "mallory", null));
        assertEquals(ReviewStatus.CANCELLED, engine.cancel(review.id(), "zoe", "superseded").status());
        assertTrue(engine.listPendingReviews(null).isEmpty());
    }

    @Test
    void shouldAppendCommentsWhilePending() throws Exception {
        ReviewRequest review = createTeamReview(1);

        ReviewRequest commented = engine.addComment(review.id(), "carol", "Is the field still read by billing?", CommentType.QUESTION);

        assertEquals(1, commented.comments().size());
        assertEquals("carol", commented.comments().get(0).author());
        engine.approve(review.id(), "alice", null);
        assertThrows(ReviewWorkflowException.class,
                () -> engine.addComment(review.id(), "carol", "late", CommentType.GENERAL));
    }

    @Test
    void shouldValidateReviewRequest() {
        assertThrows(ReviewWorkflowException.class,
                () -> engine.createReviewRequest(TARGET, List.of(), 1, "", "alice", null));
        assertThrows(ReviewWorkflowException.class,
                () -> engine.createReviewRequest(TARGET, List.of(Reviewer.team("payments-team")), 0, "", "alice", null));
    }

    @Test
    void shouldReusePendingReviewForSameTarget() throws Exception {
        ReviewRequest first = engine.createOrGetReviewRequest(TARGET, List.of(Reviewer.team("payments-team")), 1, "", "alice", "CHG_1");
        ReviewRequest second = engine.createOrGetReviewRequest(TARGET, List.of(Reviewer.team("payments-team")), 2, "", "bob", "CHG_2");

        assertEquals(first.id(), second.id());
        assertEquals(1, engine.listPendingReviews("dave").size());
        assertTrue(engine.listPendingReviews("carol").isEmpty());
    }

    @Test
    void shouldRecordEachConcurrentApprovalExactlyOnce() throws Exception {
        ReviewRequest review = createTeamReview(2);
        List<String> reviewers = List.of("alice", "bob", "dave");
        ExecutorService executor = Executors.newFixedThreadPool(reviewers.size());
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger refused = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (String reviewer : reviewers) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        if (engine.approve(review.id(), reviewer, null)) {
                            accepted.incrementAndGet();
                        }
                    } catch (ReviewWorkflowException e) {
                        refused.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        ReviewRequest finished = engine.getReview(review.id());
        assertEquals(2, accepted.get());
        assertEquals(1, refused.get());
        assertEquals(2, finished.approvals().size());
        assertEquals(ReviewStatus.APPROVED, finished.status());
    }

    private ReviewRequest createTeamReview(int approvals) throws Exception {
        return engine.createReviewRequest(TARGET, List.of(Reviewer.team("payments-team")), approvals,
                "Remove deprecated field", "alice", "CHG_1700000000_abcd1234");
    }
}
