package com.wordduel.session;

import com.wordduel.config.GameProperties;
import com.wordduel.config.GameProperties.FirstTurnPolicy;
import com.wordduel.domain.DomainModels.*;
import com.wordduel.error.ErrorReasons;
import com.wordduel.error.StateConflictException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

/**
 * Lifecycle of a session: {@code WAITING -> ACTIVE -> COMPLETED}, turn ownership and lazy expiry.
 * Transitions only ever move forward.
 */
@Component
public class SessionStateMachine {
    private final GameProperties properties;
    private final Random random;

    public SessionStateMachine(GameProperties properties, Random random) {
        this.properties = properties;
        this.random = random;
    }

    public Duration timeBudget(Difficulty difficulty) {
        return properties.difficulty().of(difficulty).timeBudget();
    }

    public boolean readyToActivate(SessionSnapshot snapshot) {
        return snapshot.session().status() == SessionStatus.WAITING
                && snapshot.participants().size() >= Math.max(2, properties.session().playersToStart());
    }

    public Session activate(SessionSnapshot snapshot, Instant now) {
        Session s = snapshot.session();
        if (s.status() != SessionStatus.WAITING) {
            throw new StateConflictException(ErrorReasons.SESSION_NOT_WAITING, "Session " + s.id() + " is not waiting for players");
        }
        List<Participant> players = snapshot.participants();
        String firstTurn = properties.session().firstTurn() == FirstTurnPolicy.RANDOM
                ? players.get(random.nextInt(players.size())).playerId()
                : players.get(0).playerId();
        return s.activated(now, now.plus(timeBudget(s.difficulty())), firstTurn);
    }

    public boolean isExpired(Session s, Instant now) {
        return s.status() == SessionStatus.ACTIVE && s.endTime() != null && now.isAfter(s.endTime());
    }

    public Session complete(Session s, CompletionReason reason) {
        if (s.status() == SessionStatus.COMPLETED) {
            throw new StateConflictException(ErrorReasons.SESSION_COMPLETED, "Session " + s.id() + " is already completed");
        }
        String finalMask = switch (reason) {
            case WORD_GUESSED, WORD_MISSED -> s.word();
            case MASK_REVEALED, TIMED_OUT -> s.mask();
        };
        return s.completed(reason, finalMask);
    }

    /**
     * Next participant in join order after the current turn holder, wrapping around. With no (or an unknown)
     * holder the first joiner gets the turn.
     */
    public String nextTurn(Session s, List<Participant> participants) {
        if (participants.isEmpty()) return null;
        if (s.currentTurn() == null) return participants.get(0).playerId();
        for (int i = 0; i < participants.size(); i++) {
            if (participants.get(i).playerId().equals(s.currentTurn())) {
                return participants.get((i + 1) % participants.size()).playerId();
            }
        }
        return participants.get(0).playerId();
    }

    public void requireActive(Session s) {
        switch (s.status()) {
            case COMPLETED -> throw new StateConflictException(ErrorReasons.SESSION_COMPLETED, "Session " + s.id() + " is already completed");
            case WAITING -> throw new StateConflictException(ErrorReasons.SESSION_NOT_ACTIVE, "Session " + s.id() + " is not active yet");
            case ACTIVE -> { }
        }
    }

    public void requireTurn(Session s, String playerId) {
        if (!playerId.equals(s.currentTurn())) {
            throw new StateConflictException(ErrorReasons.NOT_YOUR_TURN, "Not your turn");
        }
    }
}
