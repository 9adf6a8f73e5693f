package com.schemagov.governance;

import java.util.Objects;
import java.util.Optional;

import com.schemagov.store.AuditRecord;

/**
 * A policy decision plus the audit entry describing it. Recording the entry is up to the caller.
 */
public record PolicyEvaluation(PolicyResult result, Optional<AuditRecord> audit) {
    public PolicyEvaluation {
        Objects.requireNonNull(result, "result");
        audit = audit == null ? Optional.empty() : audit;
    }

    static PolicyEvaluation of(PolicyResult result, AuditRecord audit) {
        return new PolicyEvaluation(result, Optional.ofNullable(audit));
    }
}
