package com.schemagov.governance;

import java.util.List;
import java.util.Objects;

public record PolicyResult(
        PolicyAction action,
        String reason,
        boolean hasApproval,
        List<String> requiredApprovers,
        List<String> actualApprovers,
        List<String> outstandingReviewers,
        List<String> violations) {

    public PolicyResult {
        Objects.requireNonNull(action, "action");
        reason = reason == null ? "" : reason;
        requiredApprovers = requiredApprovers == null ? List.of() : List.copyOf(requiredApprovers);
        actualApprovers = actualApprovers == null ? List.of() : List.copyOf(actualApprovers);
        outstandingReviewers = outstandingReviewers == null ? List.of() : List.copyOf(outstandingReviewers);
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static PolicyResult allow(String reason) {
        return new PolicyResult(PolicyAction.ALLOW, reason, false, List.of(), List.of(), List.of(), List.of());
    }

    public static PolicyResult approved(String reason, List<String> requiredApprovers, List<String> actualApprovers) {
        return new PolicyResult(PolicyAction.ALLOW, reason, true, requiredApprovers, actualApprovers, List.of(), List.of());
    }

    public static PolicyResult warn(String reason) {
        return new PolicyResult(PolicyAction.WARN, reason, false, List.of(), List.of(), List.of(), List.of());
    }

    public static PolicyResult error(String reason, List<String> violations) {
        return new PolicyResult(PolicyAction.ERROR, reason, false, List.of(), List.of(), List.of(), violations);
    }

    public static PolicyResult requireApproval(
            String reason,
            List<String> requiredApprovers,
            List<String> actualApprovers,
            List<String> outstandingReviewers) {
        return new PolicyResult(PolicyAction.REQUIRE_APPROVAL, reason, false, requiredApprovers, actualApprovers,
                outstandingReviewers, List.of());
    }

    public boolean blocking() {
        return action == PolicyAction.ERROR || action == PolicyAction.REQUIRE_APPROVAL;
    }
}
