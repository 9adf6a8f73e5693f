package com.schemagov.governance;

import java.util.List;

import com.schemagov.review.Reviewer;

public record ReviewPolicy(String key, List<Reviewer> requiredReviewers, int approvalCount, boolean autoApproveMinor) {
    public ReviewPolicy {
        requiredReviewers = requiredReviewers == null ? List.of() : List.copyOf(requiredReviewers);
    }

    public static ReviewPolicy builtInDefault() {
        return new ReviewPolicy(PolicyStore.DEFAULT_POLICY, List.of(), 1, false);
    }

    public List<String> requiredHandles() {
        return requiredReviewers.stream().map(Reviewer::handle).toList();
    }
}
