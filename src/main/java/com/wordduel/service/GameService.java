package com.wordduel.service;

import com.wordduel.cache.SessionCache;
import com.wordduel.config.GameProperties;
import com.wordduel.domain.DomainModels.*;
import com.wordduel.error.*;
import com.wordduel.guess.GuessEngine;
import com.wordduel.guess.GuessModels.*;
import com.wordduel.progression.ProgressionLedger;
import com.wordduel.progression.ProgressionModels.LeaderboardEntry;
import com.wordduel.progression.ProgressionModels.ProgressView;
import com.wordduel.repository.SessionStore;
import com.wordduel.reward.RewardEngine;
import com.wordduel.session.SessionLocks;
import com.wordduel.session.SessionModels.JoinResult;
import com.wordduel.session.SessionModels.ParticipantView;
import com.wordduel.session.SessionModels.SessionView;
import com.wordduel.session.SessionStateMachine;
import com.wordduel.word.WordSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Entry point of the game core. Every write resolves the session, takes its lock, re-reads the durable state,
 * applies lazy expiry and then mutates inside a transaction; the session cache is refreshed afterwards.
 */
@Slf4j
@Service
public class GameService {
    private final SessionStore store;
    private final SessionStateMachine stateMachine;
    private final GuessEngine guessEngine;
    private final RewardEngine rewardEngine;
    private final ProgressionLedger ledger;
    private final WordSource wordSource;
    private final SessionCache cache;
    private final SessionLocks locks;
    private final TransactionTemplate tx;
    private final GameProperties properties;
    private final Clock clock;

    public GameService(SessionStore store,
                       SessionStateMachine stateMachine,
                       GuessEngine guessEngine,
                       RewardEngine rewardEngine,
                       ProgressionLedger ledger,
                       WordSource wordSource,
                       SessionCache cache,
                       SessionLocks locks,
                       TransactionTemplate tx,
                       GameProperties properties,
                       Clock clock) {
        this.store = store;
        this.stateMachine = stateMachine;
        this.guessEngine = guessEngine;
        this.rewardEngine = rewardEngine;
        this.ledger = ledger;
        this.wordSource = wordSource;
        this.cache = cache;
        this.locks = locks;
        this.tx = tx;
        this.properties = properties;
        this.clock = clock;
    }

    public SessionView createSession(String creatorId, Difficulty difficulty) {
        requireIdentity(creatorId);
        if (difficulty == null) {
            throw new ValidationException(ErrorReasons.INVALID_DIFFICULTY, "Difficulty is required");
        }
        return locks.withLock("creator:" + creatorId, () -> {
            sweepExpired(s -> creatorId.equals(s.creatorId()));
            Instant now = clock.instant();
            SessionSnapshot created = tx.execute(status -> {
                if (store.hasOpenSession(creatorId)) {
                    throw new StateConflictException(ErrorReasons.OPEN_SESSION_EXISTS, "You already have an active or waiting game");
                }
                String word = wordSource.randomWord(difficulty).orElseThrow(() ->
                        new NotFoundException(ErrorReasons.NO_WORDS, "No words available for difficulty " + difficulty));
                ledger.getOrCreate(creatorId);
                Session session = store.insertSession(Session.draft(creatorId, difficulty, word, now));
                Participant creator = store.addParticipant(session.id(), creatorId, now);
                return new SessionSnapshot(session, List.of(creator));
            });
            cache.refresh(created);
            log.info("Session {} created by {} ({})", created.id(), creatorId, difficulty);
            return SessionView.of(created, now);
        });
    }

    public JoinResult joinSession(long sessionId, String playerId) {
        requireIdentity(playerId);
        return locks.withLock(sessionId, () -> {
            SessionSnapshot live = loadLive(sessionId);
            Instant now = clock.instant();
            SessionSnapshot joined = tx.execute(status -> {
                Session session = live.session();
                switch (session.status()) {
                    case COMPLETED -> throw new StateConflictException(ErrorReasons.SESSION_COMPLETED, "Session " + sessionId + " is already completed");
                    case ACTIVE -> throw new StateConflictException(ErrorReasons.SESSION_NOT_WAITING, "Cannot join a game that is not waiting for players");
                    case WAITING -> { }
                }
                if (live.isParticipant(playerId)) {
                    throw new StateConflictException(ErrorReasons.ALREADY_JOINED, "You are already in this game");
                }
                ledger.getOrCreate(playerId);
                Participant added;
                try {
                    added = store.addParticipant(sessionId, playerId, now);
                } catch (DuplicateKeyException e) {
                    throw new StateConflictException(ErrorReasons.ALREADY_JOINED, "You are already in this game");
                }
                List<Participant> participants = new ArrayList<>(live.participants());
                participants.add(added);
                SessionSnapshot withPlayer = new SessionSnapshot(session, participants);
                if (!stateMachine.readyToActivate(withPlayer)) {
                    return withPlayer;
                }
                Session active = store.commit(stateMachine.activate(withPlayer, now), now);
                log.info("Session {} activated, {} to play first", sessionId, active.currentTurn());
                return withPlayer.with(active);
            });
            cache.refresh(joined);
            ParticipantView participant = joined.participant(playerId)
                    .map(p -> new ParticipantView(p.playerId(), p.score(), p.joinOrder()))
                    .orElseThrow();
            return new JoinResult(participant, SessionView.of(joined, now));
        });
    }

    public LetterGuessResult guessLetter(String playerId, String letter) {
        requireIdentity(playerId);
        char parsed = GuessEngine.parseLetter(letter);
        return applyToActiveSession(playerId, (live, now) -> guessEngine.guessLetter(live, playerId, parsed, now));
    }

    public WordGuessResult guessWord(String playerId, String word) {
        requireIdentity(playerId);
        String parsed = guessEngine.parseWord(word);
        return applyToActiveSession(playerId, (live, now) -> guessEngine.guessWord(live, playerId, parsed, now));
    }

    public RevealResult revealLetter(String playerId) {
        requireIdentity(playerId);
        return applyToActiveSession(playerId, (live, now) -> guessEngine.revealLetter(live, playerId, now));
    }

    /**
     * Guess log of a session, most recent first. An expired session is completed before the log is read.
     */
    public List<GuessRecord> history(long sessionId) {
        locks.withLock(sessionId, () -> completeIfExpired(
                store.findSnapshot(sessionId).orElseThrow(() -> notFound(sessionId))));
        return store.guesses(sessionId);
    }

    public List<LeaderboardEntry> leaderboard() {
        return ledger.leaderboard(properties.leaderboard().size());
    }

    /**
     * A session by id. An expired session is completed first and returned in its final state.
     */
    public SessionView session(long sessionId) {
        Instant now = clock.instant();
        Optional<SessionSnapshot> cached = cache.snapshot(sessionId);
        if (cached.isPresent() && !stateMachine.isExpired(cached.get().session(), now)) {
            return SessionView.of(cached.get(), now);
        }
        SessionSnapshot snapshot = locks.withLock(sessionId, () -> completeIfExpired(
                store.findSnapshot(sessionId).orElseThrow(() -> notFound(sessionId))));
        return SessionView.of(snapshot, clock.instant());
    }

    /**
     * The caller's active session, served from the cache when possible.
     */
    public SessionView currentSession(String playerId) {
        requireIdentity(playerId);
        SessionSnapshot snapshot = cache.activeSession(playerId, this::loadActiveSnapshot)
                .orElseThrow(() -> new NotFoundException(ErrorReasons.NO_ACTIVE_SESSION, "No active game"));
        Instant now = clock.instant();
        if (stateMachine.isExpired(snapshot.session(), now)) {
            locks.withLock(snapshot.id(), () -> loadLive(snapshot.id()));
        }
        return SessionView.of(snapshot, now);
    }

    /**
     * Sessions newest first, optionally filtered by status. Expired active sessions are completed before listing.
     */
    public List<SessionView> listSessions(SessionStatus status) {
        sweepExpired(s -> true);
        Instant now = clock.instant();
        return store.findByStatus(status).stream()
                .map(s -> SessionView.of(new SessionSnapshot(s, store.participants(s.id())), now))
                .toList();
    }

    public List<OutcomeRecord> outcomes(String playerId) {
        requireIdentity(playerId);
        return store.outcomesForPlayer(playerId);
    }

    public ProgressView progression(String playerId) {
        requireIdentity(playerId);
        return ledger.progress(playerId);
    }

    private <R> R applyToActiveSession(String playerId, EngineCall<R> call) {
        long sessionId = cache.activeSession(playerId, this::loadActiveSnapshot)
                .map(SessionSnapshot::id)
                .orElseThrow(() -> new NotFoundException(ErrorReasons.NO_ACTIVE_SESSION, "No active game"));
        return locks.withLock(sessionId, () -> {
            SessionSnapshot live = loadLive(sessionId);
            if (live.session().status() != SessionStatus.ACTIVE) {
                cache.refresh(live);
            }
            Instant now = clock.instant();
            Applied<R> applied = tx.execute(status -> call.apply(live, now));
            cache.refresh(applied.snapshot());
            if (applied.snapshot().session().status() == SessionStatus.COMPLETED) {
                locks.release(sessionId);
            }
            return applied.result();
        });
    }

    /**
     * Durable state of a session for a write. An expired session is completed in its own transaction and the
     * triggering operation is rejected.
     */
    private SessionSnapshot loadLive(long sessionId) {
        SessionSnapshot snapshot = store.findSnapshot(sessionId).orElseThrow(() -> notFound(sessionId));
        if (!stateMachine.isExpired(snapshot.session(), clock.instant())) {
            return snapshot;
        }
        completeIfExpired(snapshot);
        throw new ExpiredException(ErrorReasons.SESSION_EXPIRED, "Game has expired");
    }

    private SessionSnapshot completeIfExpired(SessionSnapshot snapshot) {
        Instant now = clock.instant();
        if (!stateMachine.isExpired(snapshot.session(), now)) {
            return snapshot;
        }
        SessionSnapshot completed = tx.execute(status -> {
            Session timedOut = store.commit(stateMachine.complete(snapshot.session(), CompletionReason.TIMED_OUT), now);
            SessionSnapshot after = snapshot.with(timedOut);
            rewardEngine.distribute(after, Set.of(), now);
            return after;
        });
        log.info("Session {} timed out", snapshot.id());
        cache.evict(completed);
        locks.release(snapshot.id());
        return completed;
    }

    private void sweepExpired(Predicate<Session> filter) {
        Instant now = clock.instant();
        store.findByStatus(SessionStatus.ACTIVE).stream()
                .filter(filter)
                .filter(s -> stateMachine.isExpired(s, now))
                .forEach(s -> locks.withLock(s.id(), () -> store.findSnapshot(s.id()).map(this::completeIfExpired)));
    }

    private Optional<SessionSnapshot> loadActiveSnapshot(String playerId) {
        return store.findActiveSessionId(playerId).flatMap(store::findSnapshot);
    }

    private static NotFoundException notFound(long sessionId) {
        return new NotFoundException(ErrorReasons.SESSION_NOT_FOUND, "Session " + sessionId + " not found");
    }

    private static void requireIdentity(String playerId) {
        if (playerId == null || playerId.isBlank()) {
            throw new ValidationException(ErrorReasons.INVALID_IDENTITY, "Player identity is required");
        }
    }

    @FunctionalInterface
    private interface EngineCall<R> {
        Applied<R> apply(SessionSnapshot live, Instant now);
    }
}
