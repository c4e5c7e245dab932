package com.wordduel.config;

import com.wordduel.domain.DomainModels.Difficulty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Tunables of the game core, bound from {@code game.*}.
 */
@ConfigurationProperties(prefix = "game")
public record GameProperties(@DefaultValue Difficulties difficulty,
                             @DefaultValue Session session,
                             @DefaultValue Scoring scoring,
                             @DefaultValue Rewards rewards,
                             @DefaultValue Hints hints,
                             @DefaultValue Cache cache,
                             @DefaultValue Leaderboard leaderboard) {

    public enum FirstTurnPolicy { FIRST_JOINER, RANDOM }

    public enum RevealPolicy { ALL_OCCURRENCES, FIRST_UNREVEALED }

    public enum RepeatGuessPolicy { REJECT, RESCORE }

    public record DifficultyProfile(Duration timeBudget, double multiplier) {}

    public record Difficulties(DifficultyProfile easy, DifficultyProfile medium, DifficultyProfile hard) {
        public DifficultyProfile of(Difficulty difficulty) {
            return switch (difficulty) {
                case EASY -> easy;
                case MEDIUM -> medium;
                case HARD -> hard;
            };
        }
    }

    public record Session(@DefaultValue("2") int playersToStart,
                          @DefaultValue("FIRST_JOINER") FirstTurnPolicy firstTurn,
                          @DefaultValue("ALL_OCCURRENCES") RevealPolicy revealPolicy,
                          @DefaultValue("REJECT") RepeatGuessPolicy repeatGuesses,
                          @DefaultValue("3") int minWordGuessLength) {}

    public record Scoring(@DefaultValue("20") int correctLetter,
                          @DefaultValue("-10") int wrongLetter,
                          @DefaultValue("100") int correctWord,
                          @DefaultValue("-50") int wrongWord) {}

    public record Rewards(@DefaultValue({"50", "30"}) List<Integer> rankXp,
                          @DefaultValue({"50", "30"}) List<Integer> rankCoins,
                          @DefaultValue("10") int participationXp,
                          @DefaultValue("15") int minXp,
                          @DefaultValue("5") int scoreXpDivisor,
                          @DefaultValue("50") int maxTimeBonus,
                          @DefaultValue("30") int completionXp,
                          @DefaultValue("10") int completionCoins,
                          @DefaultValue("5") int wordLengthDivisor) {
        public int rankXp(int rank) {
            return rank < rankXp.size() ? rankXp.get(rank) : 0;
        }

        public int rankCoins(int rank) {
            return rank < rankCoins.size() ? rankCoins.get(rank) : 0;
        }
    }

    public record Hints(@DefaultValue("30") int revealCost) {}

    public record Cache(@DefaultValue("10m") Duration pointerTtl,
                        @DefaultValue("15m") Duration snapshotTtl,
                        @DefaultValue("60s") Duration negativeTtl) {}

    public record Leaderboard(@DefaultValue("10") int size) {}

    public static GameProperties defaults() {
        return new GameProperties(
                new Difficulties(
                        new DifficultyProfile(Duration.ofMinutes(10), 1.0),
                        new DifficultyProfile(Duration.ofMinutes(7), 1.5),
                        new DifficultyProfile(Duration.ofMinutes(5), 2.0)),
                new Session(2, FirstTurnPolicy.FIRST_JOINER, RevealPolicy.ALL_OCCURRENCES, RepeatGuessPolicy.REJECT, 3),
                new Scoring(20, -10, 100, -50),
                new Rewards(List.of(50, 30), List.of(50, 30), 10, 15, 5, 50, 30, 10, 5),
                new Hints(30),
                new Cache(Duration.ofMinutes(10), Duration.ofMinutes(15), Duration.ofSeconds(60)),
                new Leaderboard(10));
    }
}
