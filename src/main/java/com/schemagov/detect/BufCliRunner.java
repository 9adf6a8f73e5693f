package com.schemagov.detect;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the buf binary as a child process. Output goes to temporary files so the process never blocks on a full
 * pipe, and the files are read once buf has exited.
 */
public class BufCliRunner implements BufRunner {
    private static final Logger log = LoggerFactory.getLogger(BufCliRunner.class);

    private final Duration timeout;

    public BufCliRunner(Duration timeout) {
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative()
                ? TimeBoundedClassifier.DEFAULT_TIMEOUT
                : timeout;
    }

    @Override
    public BufRun run(BufInvocation invocation) {
        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("buf-breaking", ".out");
            stderr = Files.createTempFile("buf-breaking", ".err");
            ProcessBuilder builder = new ProcessBuilder(invocation.argv())
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            if (invocation.workingDirectory() != null) {
                builder.directory(invocation.workingDirectory().toFile());
            }
            Process process = start(builder, invocation);
            log.debug("buf.started pid={} input={} against={}", process.pid(), invocation.input(), invocation.against());
            awaitExit(process, invocation);
            return new BufRun(process.exitValue(), read(stdout), read(stderr));
        } catch (IOException e) {
            throw new BreakingChangeDetectionException("Unable to capture buf output for " + invocation.input(), e);
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private static Process start(ProcessBuilder builder, BufInvocation invocation) {
        try {
            return builder.start();
        } catch (IOException e) {
            throw new BreakingChangeDetectionException("Unable to launch " + invocation.bufPath() + ": " + e.getMessage(), e);
        }
    }

    private void awaitExit(Process process, BufInvocation invocation) {
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new BreakingChangeDetectionException(
                        "buf breaking did not finish within " + timeout.toMillis() + " ms for " + invocation.input());
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new BreakingChangeDetectionException("Interrupted while waiting for buf on " + invocation.input(), e);
        }
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8).trim();
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("buf.temp_cleanup_failed file={} error={}", file, e.getMessage());
        }
    }
}
