package com.schemagov.governance;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.schemagov.detect.BreakingChange;
import com.schemagov.review.Reviewer;
import com.schemagov.store.AuditRecord;
import com.schemagov.store.AuditResult;
import com.schemagov.team.TeamDirectory;

/**
 * Evaluates schema changes against review and breaking change policies. Decisions are returned together with the
 * audit entry describing them. Nothing is written here.
 */
public class GovernancePolicyEnforcer {
    private final PolicyStore policyStore;
    private final TeamDirectory teamDirectory;
    private final ApprovalLedger approvalLedger;
    private final Clock clock;

    public GovernancePolicyEnforcer(PolicyStore policyStore, TeamDirectory teamDirectory, ApprovalLedger approvalLedger) {
        this(policyStore, teamDirectory, approvalLedger, Clock.systemUTC());
    }

    GovernancePolicyEnforcer(PolicyStore policyStore, TeamDirectory teamDirectory, ApprovalLedger approvalLedger, Clock clock) {
        this.policyStore = Objects.requireNonNull(policyStore, "policyStore");
        this.teamDirectory = Objects.requireNonNull(teamDirectory, "teamDirectory");
        this.approvalLedger = Objects.requireNonNull(approvalLedger, "approvalLedger");
        this.clock = clock;
    }

    public PolicyEvaluation enforceReviewPolicy(SchemaChange change) throws IOException {
        Objects.requireNonNull(change, "change");
        ReviewPolicy policy = policyStore.reviewPolicyFor(change.repository(), change.owningTeam());

        if (policy.autoApproveMinor() && !change.breaking()) {
            return PolicyEvaluation.of(
                    PolicyResult.allow("Non-breaking change auto-approved by policy " + policy.key()),
                    audit("auto_approve_minor", change.target(), change.author(), AuditResult.SUCCESS,
                            details("policy", policy.key(), "change_id", change.id())));
        }

        List<String> validApprovers = new ArrayList<>();
        for (String approver : approvalLedger.approversFor(change.id())) {
            if (isValidApprover(policy, approver)) {
                validApprovers.add(approver);
            }
        }

        if (validApprovers.size() >= policy.approvalCount()) {
            return PolicyEvaluation.of(
                    PolicyResult.approved("Approval requirement met (" + validApprovers.size() + "/" + policy.approvalCount() + ")",
                            policy.requiredHandles(), validApprovers),
                    audit("review_approved", change.target(), change.author(), AuditResult.SUCCESS,
                            details("policy", policy.key(), "change_id", change.id(), "approvers", validApprovers)));
        }

        List<String> outstanding = outstandingReviewers(policy, validApprovers);
        return PolicyEvaluation.of(
                PolicyResult.requireApproval(
                        "Requires " + policy.approvalCount() + " approval(s), has " + validApprovers.size(),
                        policy.requiredHandles(),
                        validApprovers,
                        outstanding),
                audit("review_required", change.target(), change.author(), AuditResult.WARNING,
                        details("policy", policy.key(), "change_id", change.id(), "outstanding", outstanding)));
    }

    public PolicyEvaluation enforceBreakingChangePolicy(List<BreakingChange> changes) throws IOException {
        if (changes == null || changes.isEmpty()) {
            return PolicyEvaluation.of(PolicyResult.allow("No breaking changes detected"), null);
        }
        return enforceBreakingChangePolicy(changes, policyStore.breakingChangePolicyFor(changes.get(0).repository()));
    }

    public PolicyEvaluation enforceBreakingChangePolicy(List<BreakingChange> changes, String policy) throws IOException {
        if (changes == null || changes.isEmpty()) {
            return PolicyEvaluation.of(PolicyResult.allow("No breaking changes detected"), null);
        }
        if (policy == null) {
            return enforceBreakingChangePolicy(changes);
        }
        return enforceBreakingChangePolicy(changes, BreakingChangePolicy.fromValue(policy));
    }

    public PolicyEvaluation enforceBreakingChangePolicy(List<BreakingChange> changes, BreakingChangePolicy policy) throws IOException {
        if (changes == null || changes.isEmpty()) {
            return PolicyEvaluation.of(PolicyResult.allow("No breaking changes detected"), null);
        }
        Objects.requireNonNull(policy, "policy");
        BreakingChange first = changes.get(0);
        String repository = first.repository();
        Map<String, Object> base = details("policy", policy.value(), "count", changes.size());

        return switch (policy) {
            case ALLOW -> PolicyEvaluation.of(
                    PolicyResult.allow(changes.size() + " breaking change(s) allowed by policy"),
                    audit("breaking_changes_allowed", repository, "system", AuditResult.WARNING, base));
            case WARN -> PolicyEvaluation.of(
                    PolicyResult.warn(changes.size() + " breaking change(s) detected"),
                    audit("breaking_changes_warning", repository, "system", AuditResult.WARNING, base));
            case ERROR -> {
                List<String> violations = changes.stream().map(BreakingChange::violationSummary).toList();
                Map<String, Object> blocked = new LinkedHashMap<>(base);
                blocked.put("violations", violations);
                yield PolicyEvaluation.of(
                        PolicyResult.error(changes.size() + " breaking change(s) violate policy", violations),
                        audit("breaking_changes_blocked", repository, "system", AuditResult.FAILURE, blocked));
            }
            case REQUIRE_APPROVAL -> requireBreakingApproval(changes, repository, base);
        };
    }

    private PolicyEvaluation requireBreakingApproval(List<BreakingChange> changes, String repository, Map<String, Object> base)
            throws IOException {
        List<String> approvers = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (BreakingChange change : changes) {
            Optional<BreakingChangeApproval> approval = approvalLedger.findBreakingChangeApproval(change.repository(), change.location());
            if (approval.isPresent()) {
                if (!approvers.contains(approval.get().approver())) {
                    approvers.add(approval.get().approver());
                }
            } else {
                missing.add(BreakingChangeApproval.key(change.repository(), change.location()));
            }
        }
        if (missing.isEmpty()) {
            Map<String, Object> approved = new LinkedHashMap<>(base);
            approved.put("approvers", approvers);
            return PolicyEvaluation.of(
                    PolicyResult.approved("Breaking changes approved", List.of(), approvers),
                    audit("breaking_changes_approved", repository, "system", AuditResult.SUCCESS, approved));
        }
        Map<String, Object> pending = new LinkedHashMap<>(base);
        pending.put("unapproved_locations", missing);
        return PolicyEvaluation.of(
                PolicyResult.requireApproval(
                        "Breaking changes require explicit approval for " + missing.size() + " location(s)",
                        List.of(), approvers, missing),
                audit("breaking_approval_required", repository, "system", AuditResult.WARNING, pending));
    }

    /**
     * An approver counts if named individually or if currently a reviewing member of a listed team. A policy with no
     * listed reviewers accepts any recorded approver.
     */
    boolean isValidApprover(ReviewPolicy policy, String approver) {
        if (policy.requiredReviewers().isEmpty()) {
            return true;
        }
        for (Reviewer reviewer : policy.requiredReviewers()) {
            if (reviewer instanceof Reviewer.Individual individual && individual.name().equals(approver)) {
                return true;
            }
            if (reviewer instanceof Reviewer.TeamRef team && teamDirectory.isQualifiedReviewer(team.name(), approver)) {
                return true;
            }
        }
        return false;
    }

    private List<String> outstandingReviewers(ReviewPolicy policy, List<String> validApprovers) {
        List<String> outstanding = new ArrayList<>();
        for (Reviewer reviewer : policy.requiredReviewers()) {
            boolean satisfied;
            if (reviewer instanceof Reviewer.TeamRef team) {
                satisfied = validApprovers.stream().anyMatch(approver -> teamDirectory.isQualifiedReviewer(team.name(), approver));
            } else {
                satisfied = validApprovers.contains(reviewer.name());
            }
            if (!satisfied) {
                outstanding.add(reviewer.handle());
            }
        }
        return outstanding;
    }

    private AuditRecord audit(String action, String target, String actor, AuditResult result, Map<String, Object> details) {
        return new AuditRecord(action, target, actor, clock.instant(), result, details);
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return details;
    }
}
