package com.schemagov.governance;

/**
 * Raised when a governance decision is asked for under a policy value the engine does not know.
 */
public class GovernanceException extends RuntimeException {
    public GovernanceException(String message) {
        super(message);
    }
}
