package com.wordduel.error;

public class NotFoundException extends GameException {
    public NotFoundException(String reason, String message) {
        super(reason, message);
    }
}
