package com.schemagov.detect;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds any classifier by a wall-clock timeout. The detection task is cancelled when the timeout elapses.
 */
public class TimeBoundedClassifier implements BreakingChangeClassifier {
    private static final Logger log = LoggerFactory.getLogger(TimeBoundedClassifier.class);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final BreakingChangeClassifier delegate;
    private final Duration timeout;

    public TimeBoundedClassifier(BreakingChangeClassifier delegate) {
        this(delegate, DEFAULT_TIMEOUT);
    }

    public TimeBoundedClassifier(BreakingChangeClassifier delegate, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
    }

    @Override
    public List<BreakingChange> detect(String currentSchemaRef, String baselineRef) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<List<BreakingChange>> future = executor.submit(() -> delegate.detect(currentSchemaRef, baselineRef));
        try {
            return List.copyOf(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("detect.timeout current={} baseline={} timeoutMs={}", currentSchemaRef, baselineRef, timeout.toMillis());
            throw new BreakingChangeDetectionException(
                    "Breaking change detection exceeded " + timeout.toMillis() + " ms for " + currentSchemaRef, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BreakingChangeDetectionException detectionException) {
                throw detectionException;
            }
            throw new BreakingChangeDetectionException("Breaking change detection failed for " + currentSchemaRef, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BreakingChangeDetectionException("Interrupted while detecting breaking changes for " + currentSchemaRef, e);
        } finally {
            executor.shutdownNow();
        }
    }
}
