package com.schemagov.detect;

public class BreakingChangeDetectionException extends RuntimeException {
    public BreakingChangeDetectionException(String message) {
        super(message);
    }

    public BreakingChangeDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
