package com.schemagov.review;

import java.util.List;

public record ApprovalStatus(
        String reviewId,
        ReviewStatus status,
        boolean approved,
        int approvalCount,
        int requiredCount,
        List<String> approvers,
        List<String> pendingReviewers) {

    public ApprovalStatus {
        approvers = approvers == null ? List.of() : List.copyOf(approvers);
        pendingReviewers = pendingReviewers == null ? List.of() : List.copyOf(pendingReviewers);
    }
}
