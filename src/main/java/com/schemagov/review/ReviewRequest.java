package com.schemagov.review;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Immutable snapshot of a review. Transitions produce a new instance which the workflow engine swaps in atomically.
 * {@code resolvedReviewers} is the team expansion captured at creation and serves only as a hint. Authority is
 * checked against live team membership.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewRequest(
        String id,
        String target,
        String changeId,
        String description,
        String createdBy,
        List<Reviewer> requestedReviewers,
        List<String> resolvedReviewers,
        int approvalCount,
        ReviewStatus status,
        List<Approval> approvals,
        List<ReviewComment> comments,
        Instant createdAt,
        Instant updatedAt,
        String resolutionReason) {

    public ReviewRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(target, "target");
        requestedReviewers = requestedReviewers == null ? List.of() : List.copyOf(requestedReviewers);
        resolvedReviewers = resolvedReviewers == null ? List.of() : List.copyOf(resolvedReviewers);
        status = status == null ? ReviewStatus.PENDING : status;
        approvals = approvals == null ? List.of() : List.copyOf(approvals);
        comments = comments == null ? List.of() : List.copyOf(comments);
        if (approvalCount < 1) {
            throw new IllegalArgumentException("approvalCount must be >= 1");
        }
        if (approvals.size() > approvalCount) {
            throw new IllegalStateException("Review " + id + " holds more approvals than required");
        }
        if (approvals.size() == approvalCount && status == ReviewStatus.PENDING) {
            throw new IllegalStateException("Review " + id + " reached its approval count but is still pending");
        }
    }

    public boolean hasApprovalFrom(String reviewer) {
        return approvals.stream().anyMatch(approval -> approval.reviewer().equals(reviewer));
    }

    public List<String> approvers() {
        return approvals.stream().map(Approval::reviewer).toList();
    }

    /**
     * Teams and named individuals to notify about this review, in request order.
     */
    public List<String> notificationRecipients() {
        return requestedReviewers.stream()
                .map(Reviewer::name)
                .distinct()
                .toList();
    }

    /**
     * Appends an approval, flipping to approved once the required count is reached.
     */
    ReviewRequest withApproval(Approval approval) {
        List<Approval> nextApprovals = new ArrayList<>(approvals);
        nextApprovals.add(approval);
        List<ReviewComment> nextComments = comments;
        if (!approval.comment().isBlank()) {
            nextComments = append(comments,
                    new ReviewComment(approval.reviewer(), approval.comment(), CommentType.APPROVAL, approval.timestamp()));
        }
        ReviewStatus nextStatus = nextApprovals.size() >= approvalCount ? ReviewStatus.APPROVED : ReviewStatus.PENDING;
        return new ReviewRequest(id, target, changeId, description, createdBy, requestedReviewers, resolvedReviewers,
                approvalCount, nextStatus, nextApprovals, nextComments, createdAt, approval.timestamp(), resolutionReason);
    }

    ReviewRequest withComment(ReviewComment comment) {
        return new ReviewRequest(id, target, changeId, description, createdBy, requestedReviewers, resolvedReviewers,
                approvalCount, status, approvals, append(comments, comment), createdAt, comment.timestamp(), resolutionReason);
    }

    ReviewRequest resolve(ReviewStatus terminalStatus, ReviewComment comment, String reason) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        return new ReviewRequest(id, target, changeId, description, createdBy, requestedReviewers, resolvedReviewers,
                approvalCount, terminalStatus, approvals, append(comments, comment), createdAt, comment.timestamp(), reason);
    }

    private static List<ReviewComment> append(List<ReviewComment> comments, ReviewComment comment) {
        List<ReviewComment> next = new ArrayList<>(comments);
        next.add(comment);
        return next;
    }
}
