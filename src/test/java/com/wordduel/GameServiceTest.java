package com.wordduel;

import com.wordduel.domain.DomainModels.*;
import com.wordduel.error.*;
import com.wordduel.guess.GuessModels.LetterGuessResult;
import com.wordduel.guess.GuessModels.RevealResult;
import com.wordduel.guess.GuessModels.WordGuessResult;
import com.wordduel.progression.ProgressionLedger;
import com.wordduel.service.GameService;
import com.wordduel.session.SessionModels.SessionView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(TestGameConfig.class)
class GameServiceTest {
    @Autowired
    private GameService gameService;
    @Autowired
    private ProgressionLedger ledger;
    @Autowired
    private MutableClock clock;
    @Autowired
    private FixedWordSource words;

    private String alice;
    private String bob;

    @BeforeEach
    void setUp() {
        clock.set(MutableClock.BASE);
        words.use("GAME");
        alice = "alice-" + UUID.randomUUID();
        bob = "bob-" + UUID.randomUUID();
    }

    @Test
    void secondJoinActivatesSessionWithCreatorToPlay() {
        SessionView created = gameService.createSession(alice, Difficulty.EASY);
        assertEquals(SessionStatus.WAITING, created.status());
        assertEquals("____", created.mask());
        assertNull(created.secondsRemaining());

        var joined = gameService.joinSession(created.id(), bob);
        assertEquals(1, joined.participant().joinOrder());
        SessionView session = joined.session();
        assertEquals(SessionStatus.ACTIVE, session.status());
        assertEquals(alice, session.currentTurn());
        assertEquals(MutableClock.BASE.plus(Duration.ofMinutes(10)), session.endTime());
        assertEquals(600L, session.secondsRemaining());
    }

    @Test
    void correctLetterRevealsAndRotatesTurn() {
        long id = startGame("GAME");

        LetterGuessResult a = gameService.guessLetter(alice, "a");
        assertTrue(a.correct());
        assertEquals(20, a.points());
        assertEquals("_A__", a.session().mask());
        assertEquals(bob, a.session().currentTurn());
        assertEquals(20, score(a.session(), alice));

        LetterGuessResult z = gameService.guessLetter(bob, "Z");
        assertFalse(z.correct());
        assertEquals(-10, z.points());
        assertEquals("_A__", z.session().mask());
        assertEquals(alice, z.session().currentTurn());
        assertEquals(-10, score(z.session(), bob));

        List<GuessRecord> history = gameService.history(id);
        assertEquals(2, history.size());
        assertEquals('z', history.get(0).letter());
        assertEquals('a', history.get(1).letter());
    }

    @Test
    void revealingLastLetterCompletesWithoutRotation() {
        long id = startGame("GO");

        assertEquals(bob, gameService.guessLetter(alice, "g").session().currentTurn());
        LetterGuessResult last = gameService.guessLetter(bob, "o");

        assertEquals(SessionStatus.COMPLETED, last.session().status());
        assertEquals("GO", last.session().mask());
        assertEquals(bob, last.session().currentTurn());
        assertEquals(CompletionReason.MASK_REVEALED, last.session().completionReason());
        assertEquals(SessionStatus.COMPLETED, gameService.session(id).status());
        assertFalse(gameService.outcomes(alice).isEmpty());
    }

    @Test
    void turnAlternatesStrictlyBetweenTwoPlayers() {
        startGame("ABCDEFGHIJKLMNOP");
        String[] letters = {"a", "b", "c", "d", "x", "y", "e"};
        String expected = alice;
        for (String letter : letters) {
            LetterGuessResult r = gameService.guessLetter(expected, letter);
            expected = expected.equals(alice) ? bob : alice;
            assertEquals(expected, r.session().currentTurn());
            assertEquals(16, r.session().mask().length());
        }
    }

    @Test
    void guessOutOfTurnIsRejected() {
        startGame("GAME");
        StateConflictException e = assertThrows(StateConflictException.class, () -> gameService.guessLetter(bob, "g"));
        assertEquals(ErrorReasons.NOT_YOUR_TURN, e.reason());
    }

    @Test
    void repeatedLetterIsRejectedWithoutScoring() {
        startGame("GAME");
        gameService.guessLetter(alice, "z");
        ValidationException e = assertThrows(ValidationException.class, () -> gameService.guessLetter(bob, "Z"));
        assertEquals(ErrorReasons.LETTER_ALREADY_GUESSED, e.reason());
        assertEquals(0, score(gameService.currentSession(bob), bob));
    }

    @Test
    void malformedInputIsRejectedBeforeState() {
        startGame("GAME");
        assertThrows(ValidationException.class, () -> gameService.guessLetter(alice, "ab"));
        assertThrows(ValidationException.class, () -> gameService.guessLetter(alice, "1"));
        assertThrows(ValidationException.class, () -> gameService.guessWord(alice, "go"));
        assertEquals(alice, gameService.currentSession(alice).currentTurn());
    }

    @Test
    void revealWithoutEnoughCoinsChangesNothing() {
        startGame("GAME");
        ledger.addCoins(alice, 25);

        InsufficientResourceException e = assertThrows(InsufficientResourceException.class, () -> gameService.revealLetter(alice));
        assertEquals(ErrorReasons.INSUFFICIENT_FUNDS, e.reason());
        assertEquals("____", gameService.currentSession(alice).mask());
        assertEquals(25, ledger.getOrCreate(alice).coins());
    }

    @Test
    void revealSpendsCoinsAndKeepsTurn() {
        startGame("GAME");
        ledger.addCoins(bob, 100);

        RevealResult r = gameService.revealLetter(bob);

        assertEquals(30, r.cost());
        assertEquals(70, r.remainingBalance());
        assertTrue(r.position() >= 1 && r.position() <= 4);
        assertEquals("GAME".charAt(r.position() - 1), r.mask().charAt(r.position() - 1));
        assertEquals(3, r.mask().chars().filter(c -> c == '_').count());
        assertEquals(alice, gameService.currentSession(bob).currentTurn());
    }

    @Test
    void revealCompletingWordReportsLevelUpsAndHintBalance() {
        long id = startGame("GO");
        ledger.addCoins(bob, 100);
        ledger.addXp(bob, 99);

        RevealResult first = gameService.revealLetter(bob);
        assertEquals(70, first.remainingBalance());
        assertTrue(first.levelUps().isEmpty());

        RevealResult last = gameService.revealLetter(bob);

        assertEquals("GO", last.mask());
        assertEquals(40, last.remainingBalance());
        assertTrue(last.levelUps().stream().anyMatch(l -> l.playerId().equals(bob) && l.newLevel() == 2));
        assertEquals(SessionStatus.COMPLETED, gameService.session(id).status());
        assertTrue(ledger.getOrCreate(bob).coins() > 40);
    }

    @Test
    void historyCompletesExpiredSession() {
        long id = startGame("GAME");
        gameService.guessLetter(alice, "g");
        clock.advance(Duration.ofMinutes(11));

        List<GuessRecord> history = gameService.history(id);

        assertEquals(1, history.size());
        assertEquals(1, gameService.outcomes(alice).size());
        assertEquals(1, gameService.outcomes(bob).size());
        assertTrue(gameService.session(id).timedOut());
    }

    @Test
    void guessAfterEndTimeExpiresSession() {
        long id = startGame("GAME");
        clock.advance(Duration.ofMinutes(10).plusSeconds(1));

        ExpiredException e = assertThrows(ExpiredException.class, () -> gameService.guessLetter(alice, "g"));
        assertEquals(ErrorReasons.SESSION_EXPIRED, e.reason());

        SessionView after = gameService.session(id);
        assertEquals(SessionStatus.COMPLETED, after.status());
        assertTrue(after.timedOut());
        assertEquals("____", after.mask());
        assertThrows(NotFoundException.class, () -> gameService.guessLetter(alice, "g"));
        assertEquals(2, gameService.outcomes(alice).size() + gameService.outcomes(bob).size());
    }

    @Test
    void correctWordGuessWinsAndPaysRewards() {
        startGame("GAME");
        gameService.guessLetter(alice, "z");

        WordGuessResult r = gameService.guessWord(bob, "game");

        assertTrue(r.correct());
        assertEquals(100, r.points());
        assertEquals(SessionStatus.COMPLETED, r.session().status());
        assertEquals("GAME", r.session().mask());
        assertEquals(CompletionReason.WORD_GUESSED, r.session().completionReason());
        assertEquals(2, r.rewards().rewards().size());
        assertEquals(OutcomeResult.WIN, gameService.outcomes(bob).get(0).result());
        assertEquals(OutcomeResult.LOSE, gameService.outcomes(alice).get(0).result());
        assertTrue(ledger.getOrCreate(bob).xp() >= 15);
    }

    @Test
    void wrongWordGuessEndsSessionAndLoses() {
        startGame("GAME");

        WordGuessResult r = gameService.guessWord(alice, "gate");

        assertFalse(r.correct());
        assertEquals(-50, r.points());
        assertEquals(SessionStatus.COMPLETED, r.session().status());
        assertEquals("GAME", r.session().mask());
        assertEquals(OutcomeResult.LOSE, gameService.outcomes(alice).get(0).result());
        assertEquals(OutcomeResult.WIN, gameService.outcomes(bob).get(0).result());
        assertEquals(ErrorReasons.NO_ACTIVE_SESSION,
                assertThrows(NotFoundException.class, () -> gameService.guessWord(bob, "game")).reason());
    }

    @Test
    void joinAndCreateGuards() {
        SessionView created = gameService.createSession(alice, Difficulty.HARD);
        assertEquals(ErrorReasons.OPEN_SESSION_EXISTS,
                assertThrows(StateConflictException.class, () -> gameService.createSession(alice, Difficulty.EASY)).reason());
        assertEquals(ErrorReasons.ALREADY_JOINED,
                assertThrows(StateConflictException.class, () -> gameService.joinSession(created.id(), alice)).reason());

        gameService.joinSession(created.id(), bob);
        String carol = "carol-" + UUID.randomUUID();
        assertEquals(ErrorReasons.SESSION_NOT_WAITING,
                assertThrows(StateConflictException.class, () -> gameService.joinSession(created.id(), carol)).reason());
        assertThrows(NotFoundException.class, () -> gameService.joinSession(Long.MAX_VALUE, carol));
    }

    @Test
    void waitingSessionRejectsGuessesUntilActive() {
        gameService.createSession(alice, Difficulty.EASY);
        assertEquals(ErrorReasons.NO_ACTIVE_SESSION,
                assertThrows(NotFoundException.class, () -> gameService.guessLetter(alice, "a")).reason());
    }

    @Test
    void listingSweepsExpiredSessions() {
        long id = startGame("GAME");
        clock.advance(Duration.ofMinutes(11));

        List<SessionView> completed = gameService.listSessions(SessionStatus.COMPLETED);

        assertTrue(completed.stream().anyMatch(s -> s.id() == id && s.timedOut()));
        assertTrue(gameService.listSessions(SessionStatus.ACTIVE).stream().noneMatch(s -> s.id() == id));
    }

    private long startGame(String word) {
        words.use(word);
        long id = gameService.createSession(alice, Difficulty.EASY).id();
        gameService.joinSession(id, bob);
        return id;
    }

    private static int score(SessionView view, String playerId) {
        return view.participants().stream()
                .filter(p -> p.playerId().equals(playerId))
                .findFirst()
                .orElseThrow()
                .score();
    }
}
