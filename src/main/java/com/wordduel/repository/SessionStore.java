package com.wordduel.repository;

import com.wordduel.domain.DomainModels.*;
import com.wordduel.error.ErrorReasons;
import com.wordduel.error.StateConflictException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable state of sessions, participants and their append-only guess and outcome logs.
 */
public interface SessionStore {
    Session insertSession(Session draft);

    Optional<Session> findSession(long sessionId);

    /**
     * Compare-and-swap write keyed on {@code session.version()}. Returns {@code false} when another writer got there first.
     */
    boolean updateSession(Session session, Instant now);

    List<Session> findByStatus(SessionStatus status);

    boolean hasOpenSession(String creatorId);

    Optional<Long> findActiveSessionId(String playerId);

    List<Participant> participants(long sessionId);

    Participant addParticipant(long sessionId, String playerId, Instant now);

    void updateScore(long sessionId, String playerId, int score);

    void appendGuess(GuessRecord guess);

    List<GuessRecord> guesses(long sessionId);

    void appendOutcome(OutcomeRecord outcome);

    boolean hasOutcomes(long sessionId);

    List<OutcomeRecord> outcomesForPlayer(String playerId);

    /**
     * {@link #updateSession} that fails loudly on a lost race and returns the state as stored.
     */
    default Session commit(Session session, Instant now) {
        if (!updateSession(session, now)) {
            throw new StateConflictException(ErrorReasons.CONCURRENT_MODIFICATION,
                    "Session " + session.id() + " was modified concurrently");
        }
        return session.saved(now);
    }

    default Optional<SessionSnapshot> findSnapshot(long sessionId) {
        return findSession(sessionId).map(s -> new SessionSnapshot(s, participants(sessionId)));
    }
}
