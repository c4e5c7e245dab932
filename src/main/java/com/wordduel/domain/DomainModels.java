package com.wordduel.domain;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class DomainModels {
    public enum Difficulty { EASY, MEDIUM, HARD }

    public enum SessionStatus { WAITING, ACTIVE, COMPLETED }

    public enum CompletionReason { MASK_REVEALED, WORD_GUESSED, WORD_MISSED, TIMED_OUT }

    public enum OutcomeResult { WIN, LOSE, DRAW }

    /**
     * Durable session row. The secret word never leaves the core; clients see {@code SessionView}.
     */
    public record Session(long id,
                          String creatorId,
                          Difficulty difficulty,
                          String word,
                          String mask,
                          SessionStatus status,
                          String currentTurn,
                          Instant startTime,
                          Instant endTime,
                          CompletionReason completionReason,
                          String guessedLetters,
                          long version,
                          Instant createdAt,
                          Instant updatedAt) {
        public Session {
            if (word == null || mask == null || word.length() != mask.length()) {
                throw new IllegalArgumentException("mask length must match word length");
            }
            guessedLetters = guessedLetters == null ? "" : guessedLetters;
        }

        public static Session draft(String creatorId, Difficulty difficulty, String word, Instant now) {
            return new Session(0L, creatorId, difficulty, word, Mask.hidden(word), SessionStatus.WAITING,
                    null, null, null, null, "", 0L, now, now);
        }

        public boolean timedOut() {
            return completionReason == CompletionReason.TIMED_OUT;
        }

        public Session withMask(String newMask) {
            return new Session(id, creatorId, difficulty, word, newMask, status, currentTurn, startTime, endTime,
                    completionReason, guessedLetters, version, createdAt, updatedAt);
        }

        public Session withTurn(String playerId) {
            return new Session(id, creatorId, difficulty, word, mask, status, playerId, startTime, endTime,
                    completionReason, guessedLetters, version, createdAt, updatedAt);
        }

        public Session withGuessedLetter(char letter) {
            String letters = guessedLetters.indexOf(letter) >= 0 ? guessedLetters : guessedLetters + letter;
            return new Session(id, creatorId, difficulty, word, mask, status, currentTurn, startTime, endTime,
                    completionReason, letters, version, createdAt, updatedAt);
        }

        public Session activated(Instant start, Instant end, String firstTurn) {
            return new Session(id, creatorId, difficulty, word, mask, SessionStatus.ACTIVE, firstTurn, start, end,
                    null, guessedLetters, version, createdAt, updatedAt);
        }

        public Session completed(CompletionReason reason, String finalMask) {
            return new Session(id, creatorId, difficulty, word, finalMask, SessionStatus.COMPLETED, currentTurn, startTime,
                    endTime, reason, guessedLetters, version, createdAt, updatedAt);
        }

        /** State after a successful compare-and-swap write. */
        public Session saved(Instant now) {
            return new Session(id, creatorId, difficulty, word, mask, status, currentTurn, startTime, endTime,
                    completionReason, guessedLetters, version + 1, createdAt, now);
        }
    }

    public record Participant(long sessionId, String playerId, int score, int joinOrder, Instant joinedAt) {
        public Participant withScore(int newScore) {
            return new Participant(sessionId, playerId, newScore, joinOrder, joinedAt);
        }
    }

    public record GuessRecord(long id, long sessionId, String playerId, char letter, boolean correct, int points, Instant ts) {}

    public record OutcomeRecord(long id, long sessionId, String playerId, int finalScore, OutcomeResult result, String finalMask, Instant ts) {}

    public record PlayerProgression(String playerId, int level, int xp, int coins) {}

    /**
     * A session together with its participants in join order.
     */
    public record SessionSnapshot(Session session, List<Participant> participants) {
        public SessionSnapshot {
            participants = participants.stream()
                    .sorted(Comparator.comparingInt(Participant::joinOrder))
                    .toList();
        }

        public long id() {
            return session.id();
        }

        public Optional<Participant> participant(String playerId) {
            return participants.stream().filter(p -> p.playerId().equals(playerId)).findFirst();
        }

        public boolean isParticipant(String playerId) {
            return participant(playerId).isPresent();
        }

        public SessionSnapshot with(Session updated) {
            return new SessionSnapshot(updated, participants);
        }

        public SessionSnapshot with(Participant updated) {
            return new SessionSnapshot(session, participants.stream()
                    .map(p -> p.playerId().equals(updated.playerId()) ? updated : p)
                    .toList());
        }
    }
}
