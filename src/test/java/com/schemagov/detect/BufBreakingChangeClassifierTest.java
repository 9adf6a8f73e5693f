package com.schemagov.detect;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BufBreakingChangeClassifierTest {

    @Test
    void shouldInvokeBufAndParseJsonLines() {
        List<BufInvocation> invocations = new ArrayList<>();
        String output = """
                {"path":"acme/payments/v1/payment.proto","start_line":12,"type":"FIELD_NO_DELETE","message":"Previously present field \\"3\\" with name \\"amount\\" on message \\"Payment\\" was deleted."}
                {"path":"acme/payments/v1/payment.proto","start_line":20,"type":"FIELD_SAME_TYPE","message":"Field \\"4\\" changed type."}
                """;
        BufBreakingChangeClassifier classifier = new BufBreakingChangeClassifier(invocation -> {
            invocations.add(invocation);
            return new BufRun(BufRun.VIOLATIONS_EXIT_CODE, output, "");
        }, "/usr/local/bin/buf", Path.of("."));

        List<BreakingChange> changes = classifier.detect("acme/payments", ".git#branch=main");

        assertEquals(List.of("/usr/local/bin/buf", "breaking", "acme/payments", "--against", ".git#branch=main",
                "--error-format", "json"), invocations.get(0).argv());
        assertEquals(Path.of("."), invocations.get(0).workingDirectory());
        assertEquals(2, changes.size());
        BreakingChange removal = changes.get(0);
        assertEquals("FIELD_NO_DELETE", removal.type());
        assertEquals("acme/payments/v1/payment.proto:12", removal.location());
        assertEquals(ImpactTier.HIGH, removal.impact());
        assertEquals("", removal.repository());
        assertTrue(removal.migrationNote().startsWith("Field contract changed"));
        assertEquals(ImpactTier.MEDIUM, changes.get(1).impact());
    }

    @Test
    void shouldDefaultToBufOnPath() {
        List<BufInvocation> invocations = new ArrayList<>();
        BufBreakingChangeClassifier classifier = new BufBreakingChangeClassifier(invocation -> {
            invocations.add(invocation);
            return new BufRun(0, "", "");
        }, " ", null);

        assertTrue(classifier.detect("proto", "main").isEmpty());
        assertEquals("buf", invocations.get(0).argv().get(0));
    }

    @Test
    void shouldAcceptViolationsWrapper() {
        String output = "{\"violations\":[{\"file\":\"a.proto\",\"line\":3,\"type\":\"FILE_NO_DELETE\",\"message\":\"gone\"}]}";
        BufBreakingChangeClassifier classifier = new BufBreakingChangeClassifier(
                invocation -> new BufRun(1, output, ""), null, null);

        List<BreakingChange> changes = classifier.detect("current", "baseline");

        assertEquals(1, changes.size());
        assertEquals("a.proto:3", changes.get(0).location());
        assertEquals(ImpactTier.CRITICAL, changes.get(0).impact());
    }

    @Test
    void shouldFailInsteadOfReportingNoChangesWhenBufErrors() {
        BufBreakingChangeClassifier classifier = new BufBreakingChangeClassifier(
                invocation -> new BufRun(2, "", "Failure: buf.yaml not found"), "buf", null);

        BreakingChangeDetectionException error = assertThrows(BreakingChangeDetectionException.class,
                () -> classifier.detect("current", "baseline"));
        assertTrue(error.getMessage().contains("buf.yaml not found"));
    }

    @Test
    void shouldFailOnRunnerFailureAndGarbage() {
        BreakingChangeDetectionException launchFailure = new BreakingChangeDetectionException("Unable to launch buf");
        BufBreakingChangeClassifier missingBinary = new BufBreakingChangeClassifier(invocation -> {
            throw launchFailure;
        }, "buf", null);
        BufBreakingChangeClassifier garbage = new BufBreakingChangeClassifier(
                invocation -> new BufRun(BufRun.VIOLATIONS_EXIT_CODE, "not json", ""), "buf", null);

        assertSame(launchFailure, assertThrows(BreakingChangeDetectionException.class,
                () -> missingBinary.detect("current", "baseline")));
        assertThrows(BreakingChangeDetectionException.class, () -> garbage.detect("current", "baseline"));
    }
}
