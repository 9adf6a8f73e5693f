package com.schemagov.impact;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.schemagov.detect.BreakingChange;
import com.schemagov.detect.BreakingChangeRules;
import com.schemagov.detect.ImpactTier;

import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationGuideRendererTest {

    private final MigrationGuideRenderer renderer = new MigrationGuideRenderer();

    @Test
    void shouldRenderSectionPerComponent() {
        String guide = renderer.render("acme/orders", List.of(
                new BreakingChange("FIELD_NO_DELETE", "Field 3 deleted", "acme/orders/v1/order.proto:30", ImpactTier.HIGH,
                        "acme/orders", null, null, BreakingChangeRules.migrationNoteFor("FIELD_NO_DELETE")),
                new BreakingChange("RPC_NO_DELETE", "RPC Cancel deleted", "acme/orders/v1/service.proto:8", ImpactTier.HIGH,
                        "acme/orders", null, null, null)));

        assertTrue(guide.startsWith("# Migration guide for acme/orders"));
        assertTrue(guide.contains("## order\n"));
        assertTrue(guide.contains("## service\n"));
        assertTrue(guide.contains("### FIELD_NO_DELETE (high)"));
        assertTrue(guide.contains("- Migration: Field contract changed"));
        assertTrue(guide.contains("## Recommendations"));
    }

    @Test
    void shouldStateThatNoMigrationIsNeeded() {
        assertTrue(renderer.render("acme/orders", List.of()).contains("No migration is required"));
    }
}
