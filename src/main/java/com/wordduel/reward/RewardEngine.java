package com.wordduel.reward;

import com.wordduel.config.GameProperties;
import com.wordduel.domain.DomainModels.*;
import com.wordduel.progression.ProgressionLedger;
import com.wordduel.progression.ProgressionModels.XpGain;
import com.wordduel.repository.SessionStore;
import com.wordduel.reward.RewardModels.LevelUp;
import com.wordduel.reward.RewardModels.PlayerReward;
import com.wordduel.reward.RewardModels.RewardSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Pays out XP and coins when a session completes and writes one outcome record per participant.
 */
@Slf4j
@Service
public class RewardEngine {
    private final SessionStore store;
    private final ProgressionLedger ledger;
    private final RewardCalculator calculator;

    public RewardEngine(SessionStore store, ProgressionLedger ledger, GameProperties properties) {
        this.store = store;
        this.ledger = ledger;
        this.calculator = new RewardCalculator(properties);
    }

    public RewardSummary distribute(SessionSnapshot completed, Set<String> winners, Instant completedAt) {
        Session session = completed.session();
        if (session.status() != SessionStatus.COMPLETED) {
            throw new IllegalStateException("Rewards requested for session " + session.id() + " in status " + session.status());
        }
        if (completed.participants().size() < 2 || store.hasOutcomes(session.id())) {
            return RewardSummary.empty();
        }

        List<PlayerReward> rewards = calculator.compute(completed, winners, completedAt);
        List<LevelUp> levelUps = new ArrayList<>();
        for (PlayerReward reward : rewards) {
            XpGain gain = ledger.addXp(reward.playerId(), reward.xp());
            ledger.addCoins(reward.playerId(), reward.coins());
            if (gain.leveledUp()) {
                levelUps.add(new LevelUp(reward.playerId(), gain.newLevel(), gain.levelsGained(), reward.xp()));
            }
            store.appendOutcome(new OutcomeRecord(0L, session.id(), reward.playerId(), reward.score(), reward.result(),
                    session.mask(), completedAt));
        }
        log.info("Session {} rewards distributed to {} players ({} level-ups)", session.id(), rewards.size(), levelUps.size());
        return new RewardSummary(rewards, levelUps);
    }
}
