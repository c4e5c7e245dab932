package com.wordduel.repository;

import com.wordduel.domain.DomainModels.PlayerProgression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class PlayerJdbcRepository {
    private static final RowMapper<PlayerProgression> MAPPER = (rs, n) ->
            new PlayerProgression(rs.getString(1), rs.getInt(2), rs.getInt(3), rs.getInt(4));

    private final JdbcTemplate jdbcTemplate;

    public PlayerJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insertIfAbsent(String playerId) {
        jdbcTemplate.update("MERGE INTO players(player_id) KEY(player_id) VALUES (?)", playerId);
    }

    public Optional<PlayerProgression> find(String playerId) {
        return jdbcTemplate.query("SELECT player_id, level, xp, coins FROM players WHERE player_id=?", MAPPER, playerId)
                .stream().findFirst();
    }

    /**
     * Row-locking read, used while the level is recomputed.
     */
    public Optional<PlayerProgression> findForUpdate(String playerId) {
        return jdbcTemplate.query("SELECT player_id, level, xp, coins FROM players WHERE player_id=? FOR UPDATE", MAPPER, playerId)
                .stream().findFirst();
    }

    public void updateLevelAndXp(String playerId, int level, int xp) {
        jdbcTemplate.update("UPDATE players SET level=?, xp=? WHERE player_id=?", level, xp, playerId);
    }

    public void addCoins(String playerId, int amount) {
        jdbcTemplate.update("UPDATE players SET coins = coins + ? WHERE player_id=?", amount, playerId);
    }

    /**
     * Deducts only when the balance covers the whole amount.
     */
    public boolean deductCoins(String playerId, int amount) {
        return jdbcTemplate.update("UPDATE players SET coins = coins - ? WHERE player_id=? AND coins >= ?",
                amount, playerId, amount) == 1;
    }

    public List<PlayerProgression> topByXp(int limit) {
        return jdbcTemplate.query("SELECT player_id, level, xp, coins FROM players ORDER BY xp DESC, player_id LIMIT ?",
                MAPPER, limit);
    }
}
