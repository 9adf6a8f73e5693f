package com.schemagov.detect;

/**
 * Runs buf. Implementations throw {@link BreakingChangeDetectionException} when buf cannot be started or does not
 * finish; any exit code is returned as a {@link BufRun}.
 */
@FunctionalInterface
public interface BufRunner {
    BufRun run(BufInvocation invocation);
}
