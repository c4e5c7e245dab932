package com.wordduel.error;

/**
 * Wrong session status, wrong turn, duplicate join or a lost optimistic-lock race.
 */
public class StateConflictException extends GameException {
    public StateConflictException(String reason, String message) {
        super(reason, message);
    }
}
