package com.wordduel.reward;

import com.wordduel.config.GameProperties;
import com.wordduel.domain.DomainModels.*;
import com.wordduel.domain.Mask;
import com.wordduel.reward.RewardModels.PlayerReward;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Pure XP and coin arithmetic for a completed session.
 */
public class RewardCalculator {
    private final GameProperties properties;

    public RewardCalculator(GameProperties properties) {
        this.properties = properties;
    }

    /**
     * Rewards ranked by descending score, ties broken by join order.
     *
     * @param winners players decided as winners by the way the session ended; empty to rank by score
     */
    public List<PlayerReward> compute(SessionSnapshot completed, Set<String> winners, Instant completedAt) {
        Session session = completed.session();
        GameProperties.Rewards r = properties.rewards();
        double multiplier = properties.difficulty().of(session.difficulty()).multiplier();
        double lengthModifier = session.word().length() / (double) r.wordLengthDivisor();
        boolean timedOut = session.timedOut();
        boolean solved = !timedOut && Mask.isSolved(session.mask());

        double timeBonus = timedOut ? 0.0 : timeBonus(session, completedAt);
        double completionXp = solved ? r.completionXp() * multiplier : 0.0;

        List<Participant> ranked = completed.participants().stream()
                .sorted(Comparator.comparingInt(Participant::score).reversed().thenComparingInt(Participant::joinOrder))
                .toList();
        boolean draw = winners.isEmpty() && ranked.size() == 2 && ranked.get(0).score() == ranked.get(1).score();

        List<PlayerReward> out = new ArrayList<>(ranked.size());
        for (int rank = 0; rank < ranked.size(); rank++) {
            Participant p = ranked.get(rank);
            int scoreXp = Math.max(0, Math.floorDiv(p.score(), r.scoreXpDivisor()));
            double raw = r.rankXp(rank) + scoreXp + completionXp + timeBonus + r.participationXp();
            int xp = Math.max((int) (raw * multiplier * lengthModifier), r.minXp());

            double coins = r.rankCoins(rank) * multiplier;
            if (solved) {
                coins += r.completionCoins() * multiplier;
            }
            out.add(new PlayerReward(p.playerId(), rank, p.score(), xp, (int) coins, result(p, rank, winners, draw)));
        }
        return out;
    }

    double timeBonus(Session session, Instant completedAt) {
        if (session.startTime() == null) return 0.0;
        Duration budget = properties.difficulty().of(session.difficulty()).timeBudget();
        double budgetSeconds = budget.toMillis() / 1000.0;
        double elapsed = Math.max(0, Duration.between(session.startTime(), completedAt).toMillis()) / 1000.0;
        if (budgetSeconds <= 0 || elapsed >= budgetSeconds) return 0.0;
        return properties.rewards().maxTimeBonus() * (1 - elapsed / budgetSeconds);
    }

    private OutcomeResult result(Participant p, int rank, Set<String> winners, boolean draw) {
        if (!winners.isEmpty()) {
            return winners.contains(p.playerId()) ? OutcomeResult.WIN : OutcomeResult.LOSE;
        }
        if (draw) return OutcomeResult.DRAW;
        return rank == 0 ? OutcomeResult.WIN : OutcomeResult.LOSE;
    }
}
