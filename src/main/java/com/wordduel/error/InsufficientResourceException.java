package com.wordduel.error;

public class InsufficientResourceException extends GameException {
    public InsufficientResourceException(String reason, String message) {
        super(reason, message);
    }
}
