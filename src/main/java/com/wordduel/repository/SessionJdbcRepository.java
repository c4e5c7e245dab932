package com.wordduel.repository;

import com.wordduel.domain.DomainModels.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Slf4j
@Repository
public class SessionJdbcRepository implements SessionStore {
    private static final String SESSION_COLUMNS = "id, creator_id, difficulty, word, mask, status, current_turn, start_time, end_time, " +
            "completion_reason, guessed_letters, version, created_at, updated_at";

    private static final RowMapper<Session> SESSION_MAPPER = (rs, n) -> new Session(
            rs.getLong(1), rs.getString(2), Difficulty.valueOf(rs.getString(3)), rs.getString(4), rs.getString(5),
            SessionStatus.valueOf(rs.getString(6)), rs.getString(7), toInstant(rs.getTimestamp(8)), toInstant(rs.getTimestamp(9)),
            rs.getString(10) == null ? null : CompletionReason.valueOf(rs.getString(10)),
            rs.getString(11), rs.getLong(12), toInstant(rs.getTimestamp(13)), toInstant(rs.getTimestamp(14)));

    private static final RowMapper<Participant> PARTICIPANT_MAPPER = (rs, n) -> new Participant(
            rs.getLong(1), rs.getString(2), rs.getInt(3), rs.getInt(4), toInstant(rs.getTimestamp(5)));

    private final JdbcTemplate jdbcTemplate;

    public SessionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Session insertSession(Session draft) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO game_sessions(creator_id, difficulty, word, mask, status, guessed_letters, version, created_at, updated_at) VALUES (?,?,?,?,?,?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, draft.creatorId());
            ps.setString(2, draft.difficulty().name());
            ps.setString(3, draft.word());
            ps.setString(4, draft.mask());
            ps.setString(5, draft.status().name());
            ps.setString(6, draft.guessedLetters());
            ps.setLong(7, draft.version());
            ps.setTimestamp(8, Timestamp.from(draft.createdAt()));
            ps.setTimestamp(9, Timestamp.from(draft.updatedAt()));
            return ps;
        }, keys);
        long id = keys.getKeyAs(Long.class);
        return new Session(id, draft.creatorId(), draft.difficulty(), draft.word(), draft.mask(), draft.status(),
                draft.currentTurn(), draft.startTime(), draft.endTime(), draft.completionReason(), draft.guessedLetters(),
                draft.version(), draft.createdAt(), draft.updatedAt());
    }

    @Override
    public Optional<Session> findSession(long sessionId) {
        return jdbcTemplate.query("SELECT " + SESSION_COLUMNS + " FROM game_sessions WHERE id=?", SESSION_MAPPER, sessionId)
                .stream().findFirst();
    }

    @Override
    public boolean updateSession(Session s, Instant now) {
        int rows = jdbcTemplate.update(
                "UPDATE game_sessions SET mask=?, status=?, current_turn=?, start_time=?, end_time=?, completion_reason=?, " +
                        "guessed_letters=?, version=version+1, updated_at=? WHERE id=? AND version=?",
                s.mask(), s.status().name(), s.currentTurn(), toTimestamp(s.startTime()), toTimestamp(s.endTime()),
                s.completionReason() == null ? null : s.completionReason().name(),
                s.guessedLetters(), Timestamp.from(now), s.id(), s.version());
        if (rows != 1) {
            log.warn("Session {} changed concurrently, expected version {}", s.id(), s.version());
        }
        return rows == 1;
    }

    @Override
    public List<Session> findByStatus(SessionStatus status) {
        if (status == null) {
            return jdbcTemplate.query("SELECT " + SESSION_COLUMNS + " FROM game_sessions ORDER BY created_at DESC, id DESC", SESSION_MAPPER);
        }
        return jdbcTemplate.query("SELECT " + SESSION_COLUMNS + " FROM game_sessions WHERE status=? ORDER BY created_at DESC, id DESC",
                SESSION_MAPPER, status.name());
    }

    @Override
    public boolean hasOpenSession(String creatorId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM game_sessions WHERE creator_id=? AND status IN ('WAITING','ACTIVE')",
                Long.class, creatorId);
        return count != null && count > 0;
    }

    @Override
    public Optional<Long> findActiveSessionId(String playerId) {
        return jdbcTemplate.query(
                "SELECT s.id FROM game_sessions s JOIN session_participants p ON p.session_id = s.id " +
                        "WHERE p.player_id=? AND s.status='ACTIVE' ORDER BY s.start_time DESC, s.id DESC",
                (rs, n) -> rs.getLong(1), playerId).stream().findFirst();
    }

    @Override
    public List<Participant> participants(long sessionId) {
        return jdbcTemplate.query(
                "SELECT session_id, player_id, score, join_order, joined_at FROM session_participants WHERE session_id=? ORDER BY join_order",
                PARTICIPANT_MAPPER, sessionId);
    }

    @Override
    public Participant addParticipant(long sessionId, String playerId, Instant now) {
        Integer next = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(join_order) + 1, 0) FROM session_participants WHERE session_id=?", Integer.class, sessionId);
        int joinOrder = next == null ? 0 : next;
        jdbcTemplate.update(
                "INSERT INTO session_participants(session_id, player_id, score, join_order, joined_at) VALUES (?,?,?,?,?)",
                sessionId, playerId, 0, joinOrder, Timestamp.from(now));
        return new Participant(sessionId, playerId, 0, joinOrder, now);
    }

    @Override
    public void updateScore(long sessionId, String playerId, int score) {
        jdbcTemplate.update("UPDATE session_participants SET score=? WHERE session_id=? AND player_id=?", score, sessionId, playerId);
    }

    @Override
    public void appendGuess(GuessRecord g) {
        jdbcTemplate.update(
                "INSERT INTO guess_records(session_id, player_id, letter, correct, points, ts) VALUES (?,?,?,?,?,?)",
                g.sessionId(), g.playerId(), String.valueOf(g.letter()), g.correct(), g.points(), Timestamp.from(g.ts()));
    }

    @Override
    public List<GuessRecord> guesses(long sessionId) {
        return jdbcTemplate.query(
                "SELECT id, session_id, player_id, letter, correct, points, ts FROM guess_records WHERE session_id=? ORDER BY ts DESC, id DESC",
                (rs, n) -> new GuessRecord(rs.getLong(1), rs.getLong(2), rs.getString(3), rs.getString(4).charAt(0),
                        rs.getBoolean(5), rs.getInt(6), toInstant(rs.getTimestamp(7))),
                sessionId);
    }

    @Override
    public void appendOutcome(OutcomeRecord o) {
        jdbcTemplate.update(
                "INSERT INTO outcome_records(session_id, player_id, final_score, result, final_mask, ts) VALUES (?,?,?,?,?,?)",
                o.sessionId(), o.playerId(), o.finalScore(), o.result().name(), o.finalMask(), Timestamp.from(o.ts()));
    }

    @Override
    public boolean hasOutcomes(long sessionId) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM outcome_records WHERE session_id=?", Long.class, sessionId);
        return count != null && count > 0;
    }

    @Override
    public List<OutcomeRecord> outcomesForPlayer(String playerId) {
        return jdbcTemplate.query(
                "SELECT id, session_id, player_id, final_score, result, final_mask, ts FROM outcome_records WHERE player_id=? ORDER BY ts DESC, id DESC",
                (rs, n) -> new OutcomeRecord(rs.getLong(1), rs.getLong(2), rs.getString(3), rs.getInt(4),
                        OutcomeResult.valueOf(rs.getString(5)), rs.getString(6), toInstant(rs.getTimestamp(7))),
                playerId);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
