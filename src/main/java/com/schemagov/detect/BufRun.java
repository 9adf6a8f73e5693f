package com.schemagov.detect;

/**
 * Exit status and captured output of a finished {@code buf breaking} call.
 */
public record BufRun(int exitCode, String stdout, String stderr) {
    /**
     * buf exits with this code when it printed file annotations, i.e. found violations.
     */
    public static final int VIOLATIONS_EXIT_CODE = 100;

    public BufRun {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean clean() {
        return exitCode == 0;
    }

    public boolean reportedViolations() {
        return exitCode == VIOLATIONS_EXIT_CODE;
    }

    public String diagnostics() {
        return stderr.isBlank() ? stdout : stderr;
    }
}
