package com.wordduel.error;

/**
 * Malformed letter or word input, rejected before any state is read.
 */
public class ValidationException extends GameException {
    public ValidationException(String reason, String message) {
        super(reason, message);
    }
}
