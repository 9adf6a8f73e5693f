package com.schemagov.detect;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnabledOnOs({OS.LINUX, OS.MAC})
class BufCliRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCaptureViolationsReportedByBuf() throws Exception {
        Path buf = script("fake-buf", """
                #!/bin/sh
                echo "$@" >&2
                echo '{"path":"a.proto","start_line":3,"type":"FIELD_NO_DELETE","message":"gone"}'
                exit 100
                """);

        BufRun run = new BufCliRunner(Duration.ofSeconds(10))
                .run(new BufInvocation(buf.toString(), "proto", ".git#branch=main", tempDir));

        assertTrue(run.reportedViolations());
        assertEquals("{\"path\":\"a.proto\",\"start_line\":3,\"type\":\"FIELD_NO_DELETE\",\"message\":\"gone\"}", run.stdout());
        assertEquals("breaking proto --against .git#branch=main --error-format json", run.stderr());
    }

    @Test
    void shouldReturnFailureExitCodeWithDiagnostics() throws Exception {
        Path buf = script("broken-buf", """
                #!/bin/sh
                echo "Failure: buf.yaml not found" >&2
                exit 2
                """);

        BufRun run = new BufCliRunner(Duration.ofSeconds(10)).run(new BufInvocation(buf.toString(), "proto", "main", null));

        assertEquals(2, run.exitCode());
        assertEquals("Failure: buf.yaml not found", run.diagnostics());
    }

    @Test
    void shouldKillBufThatOutlivesTimeout() throws Exception {
        Path buf = script("slow-buf", """
                #!/bin/sh
                sleep 5
                """);

        BreakingChangeDetectionException error = assertThrows(BreakingChangeDetectionException.class,
                () -> new BufCliRunner(Duration.ofMillis(200)).run(new BufInvocation(buf.toString(), "proto", "main", null)));
        assertTrue(error.getMessage().contains("did not finish within 200 ms"));
    }

    @Test
    void shouldReportMissingBinary() {
        BreakingChangeDetectionException error = assertThrows(BreakingChangeDetectionException.class,
                () -> new BufCliRunner(Duration.ofSeconds(1))
                        .run(new BufInvocation(tempDir.resolve("no-such-buf").toString(), "proto", "main", null)));
        assertTrue(error.getMessage().startsWith("Unable to launch"));
    }

    private Path script(String name, String body) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, body);
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
        return file;
    }
}
