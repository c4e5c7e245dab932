package com.wordduel.reward;

import com.wordduel.domain.DomainModels.OutcomeResult;

import java.util.List;

public class RewardModels {
    public record PlayerReward(String playerId, int rank, int score, int xp, int coins, OutcomeResult result) {}

    public record LevelUp(String playerId, int newLevel, int levelsGained, int xpGained) {}

    public record RewardSummary(List<PlayerReward> rewards, List<LevelUp> levelUps) {
        public static RewardSummary empty() {
            return new RewardSummary(List.of(), List.of());
        }
    }
}
