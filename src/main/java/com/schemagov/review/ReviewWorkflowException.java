package com.schemagov.review;

/**
 * Raised for review lookups that fail, reviewers without authority, and transitions out of a terminal state.
 */
public class ReviewWorkflowException extends RuntimeException {
    public ReviewWorkflowException(String message) {
        super(message);
    }
}
