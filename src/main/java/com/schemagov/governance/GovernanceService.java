package com.schemagov.governance;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagov.detect.BreakingChange;
import com.schemagov.store.AuditRecord;
import com.schemagov.store.AuditResult;
import com.schemagov.store.AuditTrail;

/**
 * Entry point for policy decisions and approval recording. Every decision and approval is appended to the audit
 * trail before it is returned.
 */
public class GovernanceService {
    private static final Logger log = LoggerFactory.getLogger(GovernanceService.class);

    private final GovernancePolicyEnforcer enforcer;
    private final ApprovalLedger approvalLedger;
    private final AuditTrail auditTrail;
    private final Clock clock;

    public GovernanceService(GovernancePolicyEnforcer enforcer, ApprovalLedger approvalLedger, AuditTrail auditTrail) {
        this(enforcer, approvalLedger, auditTrail, Clock.systemUTC());
    }

    GovernanceService(GovernancePolicyEnforcer enforcer, ApprovalLedger approvalLedger, AuditTrail auditTrail, Clock clock) {
        this.enforcer = Objects.requireNonNull(enforcer, "enforcer");
        this.approvalLedger = Objects.requireNonNull(approvalLedger, "approvalLedger");
        this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail");
        this.clock = clock;
    }

    public PolicyResult enforceReviewPolicy(SchemaChange change) throws IOException {
        PolicyResult result = record(enforcer.enforceReviewPolicy(change));
        log.info("policy.review change={} target={} action={} reason={}",
                change.id(), change.target(), result.action().value(), result.reason());
        return result;
    }

    public PolicyResult enforceBreakingChangePolicy(List<BreakingChange> changes, String policy) throws IOException {
        PolicyResult result = record(enforcer.enforceBreakingChangePolicy(changes, policy));
        log.info("policy.breaking changes={} policy={} action={} violations={}",
                changes == null ? 0 : changes.size(), policy == null ? "configured" : policy,
                result.action().value(), result.violations().size());
        return result;
    }

    /**
     * Evaluates the configured breaking change policy without touching the audit trail. Callers that commit the
     * decision pass the evaluation to {@link #recordEvaluation}.
     */
    public PolicyEvaluation evaluateBreakingChangePolicy(List<BreakingChange> changes) throws IOException {
        return enforcer.enforceBreakingChangePolicy(changes);
    }

    public PolicyResult recordEvaluation(PolicyEvaluation evaluation) throws IOException {
        return record(evaluation);
    }

    public ChangeApprovals recordChangeApproval(String changeId, String approver, String target) throws IOException {
        ChangeApprovals approvals = approvalLedger.recordChangeApproval(changeId, approver);
        auditTrail.append(new AuditRecord("change_approval_recorded", target, approver, clock.instant(), AuditResult.SUCCESS,
                Map.of("change_id", changeId, "approvers", approvals.approvers())));
        return approvals;
    }

    public boolean recordBreakingChangeApproval(String repository, String location, String approver, String target) throws IOException {
        boolean recorded = approvalLedger.recordBreakingChangeApproval(repository, location, approver, target);
        auditTrail.append(new AuditRecord("breaking_changes_approved", target, approver, clock.instant(),
                recorded ? AuditResult.SUCCESS : AuditResult.WARNING,
                Map.of("repository", repository == null ? "" : repository,
                        "location", location == null ? "" : location,
                        "already_approved", !recorded)));
        log.info("policy.breaking_approval repository={} location={} approver={} recorded={}", repository, location, approver, recorded);
        return recorded;
    }

    /**
     * Signs off every breaking change in the list. Returns the number of locations newly approved.
     */
    public int approveBreakingChanges(List<BreakingChange> changes, String approver, String target) throws IOException {
        int recorded = 0;
        for (BreakingChange change : changes) {
            if (recordBreakingChangeApproval(change.repository(), change.location(), approver, target)) {
                recorded++;
            }
        }
        return recorded;
    }

    private PolicyResult record(PolicyEvaluation evaluation) throws IOException {
        if (evaluation.audit().isPresent()) {
            auditTrail.append(evaluation.audit().get());
        }
        return evaluation.result();
    }
}
