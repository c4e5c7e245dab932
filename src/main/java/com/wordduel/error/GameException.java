package com.wordduel.error;

/**
 * Base of all recoverable core failures. {@link #reason()} is a stable code callers can map to a response.
 */
public abstract class GameException extends RuntimeException {
    private final String reason;

    protected GameException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
