package com.wordduel.guess;

import com.wordduel.domain.DomainModels.SessionSnapshot;
import com.wordduel.reward.RewardModels.LevelUp;
import com.wordduel.reward.RewardModels.RewardSummary;
import com.wordduel.session.SessionModels.SessionView;

import java.util.List;

public class GuessModels {
    public record LetterGuessResult(boolean correct, String message, int points, SessionView session, List<LevelUp> levelUps) {}

    public record WordGuessResult(boolean correct, String message, int points, SessionView session, RewardSummary rewards) {}

    /**
     * {@code remainingBalance} is the balance right after paying for the hint, before any completion rewards.
     */
    public record RevealResult(int position, String mask, int cost, int remainingBalance, List<LevelUp> levelUps) {}

    /**
     * Result of an engine operation together with the session state it left behind.
     */
    public record Applied<R>(SessionSnapshot snapshot, R result) {}
}
