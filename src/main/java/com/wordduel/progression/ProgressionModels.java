package com.wordduel.progression;

public class ProgressionModels {
    public record XpGain(boolean leveledUp, int levelsGained, int newLevel) {
        public static XpGain none(int level) {
            return new XpGain(false, 0, level);
        }
    }

    public record LeaderboardEntry(int rank, String playerId, int totalExperience, int level) {}

    public record ProgressView(String playerId, int level, int xp, int coins, int xpForNextLevel, double progressPercent) {}
}
