package com.schemagov.tracking;

/**
 * Raised when a tracked change or its audit entry cannot be persisted. Tracking fails closed.
 */
public class ChangeTrackingException extends RuntimeException {
    public ChangeTrackingException(String message) {
        super(message);
    }

    public ChangeTrackingException(String message, Throwable cause) {
        super(message, cause);
    }
}
