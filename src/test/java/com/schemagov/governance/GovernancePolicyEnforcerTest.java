package com.schemagov.governance;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.schemagov.detect.BreakingChange;
import com.schemagov.detect.ImpactTier;
import com.schemagov.review.Reviewer;
import com.schemagov.runtime.GovernanceConfig;
import com.schemagov.runtime.GovernanceConfigLoader;
import com.schemagov.store.AuditResult;
import com.schemagov.store.InMemoryVersionedStore;
import com.schemagov.team.ConfiguredTeamDirectory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GovernancePolicyEnforcerTest {

    private static final Instant NOW = Instant.parse("2026-05-04T08:30:00Z");

    private ApprovalLedger ledger;
    private GovernancePolicyEnforcer enforcer;

    @BeforeEach
    void setUp() {
        GovernanceConfig config = new GovernanceConfigLoader().load(Path.of("src/main/resources/governance.yml"));
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ledger = new ApprovalLedger(new InMemoryVersionedStore<>(), new InMemoryVersionedStore<>(), clock);
        enforcer = new GovernancePolicyEnforcer(new PolicyStore(config), new ConfiguredTeamDirectory(config), ledger, clock);
    }

    @Test
    void shouldAutoApproveNonBreakingChange() throws Exception {
        PolicyEvaluation evaluation = enforcer.enforceReviewPolicy(change("CHG_1", "acme/platform-schemas", "platform-team", false));

        assertEquals(PolicyAction.ALLOW, evaluation.result().action());
        assertFalse(evaluation.result().hasApproval());
        assertEquals("auto_approve_minor", evaluation.audit().orElseThrow().action());
        assertEquals(NOW, evaluation.audit().orElseThrow().timestamp());
    }

    @Test
    void shouldRequireQualifiedApproverForBreakingChange() throws Exception {
        SchemaChange change = change("CHG_2", "acme/platform-schemas", "platform-team", true);

        PolicyResult pending = enforcer.enforceReviewPolicy(change).result();
        assertEquals(PolicyAction.REQUIRE_APPROVAL, pending.action());
        assertEquals(List.of("@platform-team"), pending.outstandingReviewers());

        ledger.recordChangeApproval("CHG_2", "carol");
        assertEquals(PolicyAction.REQUIRE_APPROVAL, enforcer.enforceReviewPolicy(change).result().action());

        ledger.recordChangeApproval("CHG_2", "alice");
        PolicyEvaluation approved = enforcer.enforceReviewPolicy(change);
        assertEquals(PolicyAction.ALLOW, approved.result().action());
        assertTrue(approved.result().hasApproval());
        assertEquals(List.of("alice"), approved.result().actualApprovers());
        assertEquals("review_approved", approved.audit().orElseThrow().action());
    }

    @Test
    void shouldApplyTeamOverridePolicy() throws Exception {
        SchemaChange change = change("CHG_3", "acme/payments-schemas", "payments-team", false);
        ledger.recordChangeApproval("CHG_3", "alice");

        PolicyResult partial = enforcer.enforceReviewPolicy(change).result();
        assertEquals(PolicyAction.REQUIRE_APPROVAL, partial.action());
        assertEquals(List.of("@api-team"), partial.outstandingReviewers());

        ledger.recordChangeApproval("CHG_3", "dave");
        assertEquals(PolicyAction.ALLOW, enforcer.enforceReviewPolicy(change).result().action());
    }

    @Test
    void shouldRequireExplicitApprovalForBreakingChangeLocation() throws Exception {
        List<BreakingChange> changes = List.of(breaking("acme/payments-schemas", "acme/payments/v1/refund.proto:14"));

        PolicyEvaluation pending = enforcer.enforceBreakingChangePolicy(changes);
        assertEquals(PolicyAction.REQUIRE_APPROVAL, pending.result().action());
        assertFalse(pending.result().hasApproval());
        assertEquals(List.of("acme/payments-schemas:acme/payments/v1/refund.proto:14"), pending.result().outstandingReviewers());
        assertEquals(AuditResult.WARNING, pending.audit().orElseThrow().result());

        ledger.recordBreakingChangeApproval("acme/payments-schemas", "acme/payments/v1/refund.proto:14", "erin", "refund.proto");
        PolicyEvaluation approved = enforcer.enforceBreakingChangePolicy(changes);
        assertEquals(PolicyAction.ALLOW, approved.result().action());
        assertTrue(approved.result().hasApproval());
        assertEquals(List.of("erin"), approved.result().actualApprovers());
    }

    @Test
    void shouldBlockWithOneViolationPerBreakingChange() throws Exception {
        List<BreakingChange> changes = List.of(
                breaking("acme/platform-schemas", "a.proto:1"),
                breaking("acme/platform-schemas", "a.proto:2"));

        PolicyEvaluation evaluation = enforcer.enforceBreakingChangePolicy(changes);

        assertEquals(PolicyAction.ERROR, evaluation.result().action());
        assertEquals(2, evaluation.result().violations().size());
        assertTrue(evaluation.result().blocking());
        assertEquals("breaking_changes_blocked", evaluation.audit().orElseThrow().action());
        assertEquals(AuditResult.FAILURE, evaluation.audit().orElseThrow().result());
    }

    @Test
    void shouldHonourExplicitPolicyOverride() throws Exception {
        List<BreakingChange> changes = List.of(breaking("acme/platform-schemas", "a.proto:1"));

        assertEquals(PolicyAction.WARN, enforcer.enforceBreakingChangePolicy(changes, "warn").result().action());
        assertEquals(PolicyAction.ALLOW, enforcer.enforceBreakingChangePolicy(changes, "allow").result().action());
        assertEquals(PolicyAction.WARN,
                enforcer.enforceBreakingChangePolicy(List.of(breaking("acme/experimental-schemas", "x.proto:2")), (String) null)
                        .result().action());
        assertThrows(GovernanceException.class, () -> enforcer.enforceBreakingChangePolicy(changes, "yolo"));
    }

    @Test
    void shouldAllowWhenNothingIsBreaking() throws Exception {
        PolicyEvaluation evaluation = enforcer.enforceBreakingChangePolicy(List.of(), "error");

        assertEquals(PolicyAction.ALLOW, evaluation.result().action());
        assertTrue(evaluation.audit().isEmpty());
    }

    @Test
    void shouldAllowEmptyChangeListWhateverPolicyIsNamed() throws Exception {
        assertEquals(PolicyAction.ALLOW, enforcer.enforceBreakingChangePolicy(List.of(), "block").result().action());
        assertEquals(PolicyAction.ALLOW, enforcer.enforceBreakingChangePolicy(null, "require_approval").result().action());
    }

    @Test
    void shouldAcceptAnyApproverWhenPolicyListsNobody() {
        ReviewPolicy open = new ReviewPolicy("open", List.of(), 1, false);
        ReviewPolicy restricted = new ReviewPolicy("restricted", List.of(Reviewer.parse("zoe")), 1, false);

        assertTrue(enforcer.isValidApprover(open, "anyone"));
        assertTrue(enforcer.isValidApprover(restricted, "zoe"));
        assertFalse(enforcer.isValidApprover(restricted, "anyone"));
    }

    private static SchemaChange change(String id, String repository, String team, boolean breaking) {
        return new SchemaChange(id, repository + "/v1/schema.proto", ChangeKind.MODIFICATION, "alice", repository, team,
                List.of(), breaking, "", NOW);
    }

    private static BreakingChange breaking(String repository, String location) {
        return new BreakingChange("FIELD_NO_DELETE", "Field deleted", location, ImpactTier.HIGH, repository, null, null, null);
    }
}
