package com.wordduel.progression;

import com.wordduel.domain.DomainModels.PlayerProgression;
import com.wordduel.progression.ProgressionModels.LeaderboardEntry;
import com.wordduel.progression.ProgressionModels.XpGain;
import com.wordduel.repository.PlayerJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class JdbcProgressionLedger implements ProgressionLedger {
    private final PlayerJdbcRepository repository;

    public JdbcProgressionLedger(PlayerJdbcRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public PlayerProgression getOrCreate(String playerId) {
        repository.insertIfAbsent(playerId);
        return repository.find(playerId).orElseThrow();
    }

    @Override
    @Transactional
    public XpGain addXp(String playerId, int amount) {
        repository.insertIfAbsent(playerId);
        PlayerProgression current = repository.findForUpdate(playerId).orElseThrow();
        if (amount <= 0) {
            return XpGain.none(current.level());
        }
        int xp = (int) Math.min((long) current.xp() + amount, Integer.MAX_VALUE);
        int level = LevelCurve.levelFor(xp, current.level());
        repository.updateLevelAndXp(playerId, level, xp);

        int gained = level - current.level();
        if (gained > 0) {
            log.info("Player {} reached level {} (+{})", playerId, level, gained);
        }
        return new XpGain(gained > 0, gained, level);
    }

    @Override
    @Transactional
    public boolean addCoins(String playerId, int amount) {
        if (amount <= 0) return false;
        repository.insertIfAbsent(playerId);
        repository.addCoins(playerId, amount);
        return true;
    }

    @Override
    @Transactional
    public boolean deductCoins(String playerId, int amount) {
        if (amount <= 0) return false;
        repository.insertIfAbsent(playerId);
        return repository.deductCoins(playerId, amount);
    }

    @Override
    public List<LeaderboardEntry> leaderboard(int limit) {
        List<PlayerProgression> top = repository.topByXp(limit);
        List<LeaderboardEntry> out = new ArrayList<>(top.size());
        for (int i = 0; i < top.size(); i++) {
            PlayerProgression p = top.get(i);
            out.add(new LeaderboardEntry(i + 1, p.playerId(), p.xp(), p.level()));
        }
        return out;
    }
}
