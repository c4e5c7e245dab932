package com.wordduel.error;

/**
 * Raised after an expired session has been moved to {@code COMPLETED}.
 */
public class ExpiredException extends GameException {
    public ExpiredException(String reason, String message) {
        super(reason, message);
    }
}
