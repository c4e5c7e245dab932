package com.wordduel.progression;

import com.wordduel.domain.DomainModels.PlayerProgression;
import com.wordduel.progression.ProgressionModels.LeaderboardEntry;
import com.wordduel.progression.ProgressionModels.ProgressView;
import com.wordduel.progression.ProgressionModels.XpGain;

import java.util.List;

/**
 * Level, experience and currency of a player identity. New identities start at level 1 with no XP and no coins.
 */
public interface ProgressionLedger {
    PlayerProgression getOrCreate(String playerId);

    /**
     * Non-positive amounts are ignored and report no level gained.
     */
    XpGain addXp(String playerId, int amount);

    boolean addCoins(String playerId, int amount);

    /**
     * All-or-nothing: fails without touching the balance when {@code amount} is non-positive or exceeds it.
     */
    boolean deductCoins(String playerId, int amount);

    List<LeaderboardEntry> leaderboard(int limit);

    default ProgressView progress(String playerId) {
        PlayerProgression p = getOrCreate(playerId);
        return new ProgressView(p.playerId(), p.level(), p.xp(), p.coins(),
                LevelCurve.xpToNextLevel(p.level()), LevelCurve.progressPercent(p.level(), p.xp()));
    }
}
