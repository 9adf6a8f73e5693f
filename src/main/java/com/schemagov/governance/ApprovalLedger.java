package com.schemagov.governance;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.schemagov.store.Versioned;
import com.schemagov.store.VersionedStore;

/**
 * Approvals recorded outside the review workflow: per-change approvers and per-location breaking change sign-offs.
 * Both are written with a single compare-and-swap per key.
 */
public class ApprovalLedger {
    private final VersionedStore<ChangeApprovals> changeApprovals;
    private final VersionedStore<BreakingChangeApproval> breakingApprovals;
    private final Clock clock;

    public ApprovalLedger(VersionedStore<ChangeApprovals> changeApprovals, VersionedStore<BreakingChangeApproval> breakingApprovals) {
        this(changeApprovals, breakingApprovals, Clock.systemUTC());
    }

    ApprovalLedger(VersionedStore<ChangeApprovals> changeApprovals, VersionedStore<BreakingChangeApproval> breakingApprovals, Clock clock) {
        this.changeApprovals = Objects.requireNonNull(changeApprovals, "changeApprovals");
        this.breakingApprovals = Objects.requireNonNull(breakingApprovals, "breakingApprovals");
        this.clock = clock;
    }

    public ChangeApprovals recordChangeApproval(String changeId, String approver) throws IOException {
        Objects.requireNonNull(changeId, "changeId");
        Objects.requireNonNull(approver, "approver");
        return changeApprovals.update(changeId,
                () -> new ChangeApprovals(changeId, List.of(), clock.instant()),
                current -> {
                    if (current.approvers().contains(approver)) {
                        return current;
                    }
                    List<String> approvers = new ArrayList<>(current.approvers());
                    approvers.add(approver);
                    return new ChangeApprovals(changeId, approvers, clock.instant());
                }).value();
    }

    public List<String> approversFor(String changeId) throws IOException {
        return changeApprovals.get(changeId)
                .map(Versioned::value)
                .map(ChangeApprovals::approvers)
                .orElse(List.of());
    }

    /**
     * Returns {@code true} if this call recorded the approval, {@code false} if the location was already approved.
     */
    public boolean recordBreakingChangeApproval(String repository, String location, String approver, String target) throws IOException {
        Objects.requireNonNull(approver, "approver");
        BreakingChangeApproval approval = new BreakingChangeApproval(repository, location, approver, target, clock.instant());
        return breakingApprovals.compareAndSet(BreakingChangeApproval.key(repository, location), 0, approval);
    }

    public Optional<BreakingChangeApproval> findBreakingChangeApproval(String repository, String location) throws IOException {
        return breakingApprovals.get(BreakingChangeApproval.key(repository, location)).map(Versioned::value);
    }
}
