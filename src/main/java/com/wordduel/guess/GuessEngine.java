package com.wordduel.guess;

import com.wordduel.config.GameProperties;
import com.wordduel.config.GameProperties.RepeatGuessPolicy;
import com.wordduel.config.GameProperties.RevealPolicy;
import com.wordduel.domain.DomainModels.*;
import com.wordduel.domain.Mask;
import com.wordduel.error.*;
import com.wordduel.guess.GuessModels.*;
import com.wordduel.progression.ProgressionLedger;
import com.wordduel.repository.SessionStore;
import com.wordduel.reward.RewardEngine;
import com.wordduel.reward.RewardModels.RewardSummary;
import com.wordduel.session.SessionModels.SessionView;
import com.wordduel.session.SessionStateMachine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies letter guesses, word guesses and paid reveals to an active session. Callers hold the session lock and
 * pass a snapshot freshly read from the store that has already been checked for expiry.
 */
@Slf4j
@Service
public class GuessEngine {
    private final SessionStore store;
    private final SessionStateMachine stateMachine;
    private final RewardEngine rewardEngine;
    private final ProgressionLedger ledger;
    private final GameProperties properties;
    private final Random random;

    public GuessEngine(SessionStore store,
                       SessionStateMachine stateMachine,
                       RewardEngine rewardEngine,
                       ProgressionLedger ledger,
                       GameProperties properties,
                       Random random) {
        this.store = store;
        this.stateMachine = stateMachine;
        this.rewardEngine = rewardEngine;
        this.ledger = ledger;
        this.properties = properties;
        this.random = random;
    }

    public static char parseLetter(String input) {
        if (input == null || input.length() != 1 || !Character.isLetter(input.charAt(0))) {
            throw new ValidationException(ErrorReasons.INVALID_LETTER, "Guess must be a single letter");
        }
        return Character.toLowerCase(input.charAt(0));
    }

    public String parseWord(String input) {
        int min = properties.session().minWordGuessLength();
        if (input == null || input.isBlank()) {
            throw new ValidationException(ErrorReasons.INVALID_WORD, "Word guess must not be empty");
        }
        String word = input.trim();
        if (word.length() < min) {
            throw new ValidationException(ErrorReasons.INVALID_WORD, "Word guess must be at least " + min + " letters");
        }
        if (!word.chars().allMatch(Character::isLetter)) {
            throw new ValidationException(ErrorReasons.INVALID_WORD, "Word guess must contain letters only");
        }
        return word;
    }

    public Applied<LetterGuessResult> guessLetter(SessionSnapshot snapshot, String playerId, char letter, Instant now) {
        Session session = snapshot.session();
        stateMachine.requireActive(session);
        stateMachine.requireTurn(session, playerId);
        Participant player = member(snapshot, playerId);

        char needle = Character.toLowerCase(letter);
        if (properties.session().repeatGuesses() == RepeatGuessPolicy.REJECT && session.guessedLetters().indexOf(needle) >= 0) {
            throw new ValidationException(ErrorReasons.LETTER_ALREADY_GUESSED, "Letter '" + needle + "' was already guessed");
        }

        String mask = properties.session().revealPolicy() == RevealPolicy.FIRST_UNREVEALED
                ? Mask.revealFirst(session.word(), session.mask(), needle)
                : Mask.revealAll(session.word(), session.mask(), needle);
        boolean correct = !mask.equals(session.mask());
        int points = correct ? properties.scoring().correctLetter() : properties.scoring().wrongLetter();

        Participant scored = player.withScore(player.score() + points);
        store.updateScore(session.id(), playerId, scored.score());
        store.appendGuess(new GuessRecord(0L, session.id(), playerId, needle, correct, points, now));

        Session next = session.withMask(mask).withGuessedLetter(needle);
        if (Mask.isSolved(mask)) {
            next = stateMachine.complete(next, CompletionReason.MASK_REVEALED);
        } else {
            next = next.withTurn(stateMachine.nextTurn(next, snapshot.participants()));
        }
        SessionSnapshot after = save(snapshot.with(scored), next, now);
        log.debug("Session {}: {} guessed '{}' ({} points)", session.id(), playerId, needle, points);

        RewardSummary rewards = completedRewards(after, Set.of(), now);
        String message = correct ? "Correct guess" : "Incorrect guess";
        if (after.session().status() == SessionStatus.COMPLETED) {
            message = "Correct! You win the game";
        }
        return new Applied<>(after, new LetterGuessResult(correct, message, points, SessionView.of(after, now), rewards.levelUps()));
    }

    public Applied<WordGuessResult> guessWord(SessionSnapshot snapshot, String playerId, String word, Instant now) {
        Session session = snapshot.session();
        stateMachine.requireActive(session);
        Participant player = member(snapshot, playerId);

        boolean correct = word.toLowerCase(Locale.ROOT).equals(session.word().toLowerCase(Locale.ROOT));
        int points = correct ? properties.scoring().correctWord() : properties.scoring().wrongWord();
        Participant scored = player.withScore(player.score() + points);
        store.updateScore(session.id(), playerId, scored.score());

        Session next = stateMachine.complete(session, correct ? CompletionReason.WORD_GUESSED : CompletionReason.WORD_MISSED);
        SessionSnapshot after = save(snapshot.with(scored), next, now);

        Set<String> winners = correct
                ? Set.of(playerId)
                : snapshot.participants().stream()
                        .map(Participant::playerId)
                        .filter(id -> !id.equals(playerId))
                        .collect(Collectors.toSet());
        RewardSummary rewards = rewardEngine.distribute(after, winners, now);
        String message = correct ? "Correct! You win the game" : "Incorrect guess. You lost the game";
        return new Applied<>(after, new WordGuessResult(correct, message, points, SessionView.of(after, now), rewards));
    }

    public Applied<RevealResult> revealLetter(SessionSnapshot snapshot, String playerId, Instant now) {
        Session session = snapshot.session();
        stateMachine.requireActive(session);
        member(snapshot, playerId);

        List<Integer> hidden = Mask.hiddenPositions(session.mask());
        if (hidden.isEmpty()) {
            throw new StateConflictException(ErrorReasons.NOTHING_TO_REVEAL, "No hidden letters to reveal");
        }
        int cost = properties.hints().revealCost();
        if (!ledger.deductCoins(playerId, cost)) {
            throw new InsufficientResourceException(ErrorReasons.INSUFFICIENT_FUNDS, "Not enough coins to reveal a letter (cost " + cost + ")");
        }
        int balance = ledger.getOrCreate(playerId).coins();

        int index = hidden.get(random.nextInt(hidden.size()));
        Session next = session.withMask(Mask.revealAt(session.word(), session.mask(), index));
        if (Mask.isSolved(next.mask())) {
            next = stateMachine.complete(next, CompletionReason.MASK_REVEALED);
        }
        SessionSnapshot after = save(snapshot, next, now);
        RewardSummary rewards = completedRewards(after, Set.of(), now);

        log.debug("Session {}: {} revealed position {} for {} coins", session.id(), playerId, index + 1, cost);
        return new Applied<>(after, new RevealResult(index + 1, after.session().mask(), cost, balance, rewards.levelUps()));
    }

    private Participant member(SessionSnapshot snapshot, String playerId) {
        return snapshot.participant(playerId).orElseThrow(() ->
                new NotFoundException(ErrorReasons.NOT_A_MEMBER, "You are not part of session " + snapshot.id()));
    }

    private SessionSnapshot save(SessionSnapshot base, Session next, Instant now) {
        Session saved = store.commit(next, now);
        if (saved.status() == SessionStatus.COMPLETED) {
            log.info("Session {} completed: {}", saved.id(), saved.completionReason());
        }
        return base.with(saved);
    }

    private RewardSummary completedRewards(SessionSnapshot after, Set<String> winners, Instant now) {
        if (after.session().status() != SessionStatus.COMPLETED) {
            return RewardSummary.empty();
        }
        return rewardEngine.distribute(after, winners, now);
    }
}
