package com.wordduel.repository;

import com.wordduel.domain.DomainModels.Difficulty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class WordBankJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public WordBankJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<String> wordsFor(Difficulty difficulty) {
        return jdbcTemplate.queryForList("SELECT word FROM word_bank WHERE difficulty=? ORDER BY id", String.class, difficulty.name());
    }
}
