package com.syncrecovery.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncrecovery.core.exception.EventSerializationException;
import com.syncrecovery.core.model.EventFilter;
import com.syncrecovery.core.model.ReplayEventResult;
import com.syncrecovery.core.model.ReplayEventStatus;
import com.syncrecovery.core.model.ReplayOptions;
import com.syncrecovery.core.model.ReplaySession;
import com.syncrecovery.core.model.ReplayStatus;
import com.syncrecovery.core.model.ReplaySummary;
import com.syncrecovery.core.repository.ReplaySessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of ReplaySessionRepository.
 * Filter, options and final summary are stored as jsonb.
 */
@Repository
@ConditionalOnProperty(name = "syncrecovery.store.type", havingValue = "jdbc")
public class JdbcReplaySessionRepository implements ReplaySessionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcReplaySessionRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final ReplaySessionRowMapper sessionRowMapper = new ReplaySessionRowMapper();
    private final ReplayEventResultRowMapper resultRowMapper = new ReplayEventResultRowMapper();

    public JdbcReplaySessionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void save(ReplaySession session) {
        String sql = """
            INSERT INTO replay_sessions (
                id, name, description, filter, options, status,
                total_events, processed_events, succeeded_events, failed_events, skipped_events,
                current_event_id, created_at, started_at, completed_at, duration_ms, error, result
            ) VALUES (?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
            ON CONFLICT (id) DO UPDATE SET
                status = EXCLUDED.status,
                total_events = EXCLUDED.total_events,
                processed_events = EXCLUDED.processed_events,
                succeeded_events = EXCLUDED.succeeded_events,
                failed_events = EXCLUDED.failed_events,
                skipped_events = EXCLUDED.skipped_events,
                current_event_id = EXCLUDED.current_event_id,
                started_at = EXCLUDED.started_at,
                completed_at = EXCLUDED.completed_at,
                duration_ms = EXCLUDED.duration_ms,
                error = EXCLUDED.error,
                result = EXCLUDED.result
            """;

        jdbcTemplate.update(sql,
            session.id(),
            session.name(),
            session.description(),
            toJson(session.filter()),
            toJson(session.options()),
            session.status().name(),
            session.totalEvents(),
            session.processedEvents(),
            session.succeededEvents(),
            session.failedEvents(),
            session.skippedEvents(),
            session.currentEventId(),
            Timestamp.from(session.createdAt()),
            toTimestamp(session.startedAt()),
            toTimestamp(session.completedAt()),
            session.duration() != null ? session.duration().toMillis() : null,
            session.error(),
            session.result() != null ? toJson(session.result()) : null
        );

        log.debug("Saved replay session {} with status {}", session.id(), session.status());
    }

    @Override
    public Optional<ReplaySession> findById(String sessionId) {
        String sql = "SELECT * FROM replay_sessions WHERE id = ?";
        List<ReplaySession> results = jdbcTemplate.query(sql, sessionRowMapper, sessionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ReplaySession> findAll() {
        String sql = "SELECT * FROM replay_sessions ORDER BY created_at DESC, id DESC";
        return jdbcTemplate.query(sql, sessionRowMapper);
    }

    @Override
    public List<ReplaySession> findByStatus(ReplayStatus status) {
        String sql = """
            SELECT * FROM replay_sessions
            WHERE status = ?
            ORDER BY created_at DESC, id DESC
            """;
        return jdbcTemplate.query(sql, sessionRowMapper, status.name());
    }

    @Override
    @Transactional
    public boolean delete(String sessionId) {
        jdbcTemplate.update("DELETE FROM replay_results WHERE session_id = ?", sessionId);
        return jdbcTemplate.update("DELETE FROM replay_sessions WHERE id = ?", sessionId) > 0;
    }

    @Override
    @Transactional
    public void appendResult(ReplayEventResult result) {
        String sql = """
            INSERT INTO replay_results (
                session_id, result_order, event_id, status, duration_ms, error, ts
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (session_id, result_order) DO NOTHING
            """;
        jdbcTemplate.update(sql,
            result.sessionId(),
            result.order(),
            result.eventId(),
            result.status().name(),
            result.duration() != null ? result.duration().toMillis() : 0L,
            result.error(),
            Timestamp.from(result.timestamp())
        );
    }

    @Override
    public List<ReplayEventResult> findResults(String sessionId) {
        String sql = """
            SELECT * FROM replay_results
            WHERE session_id = ?
            ORDER BY result_order ASC
            """;
        return jdbcTemplate.query(sql, resultRowMapper, sessionId);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize replay session field", e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize replay session field", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private class ReplaySessionRowMapper implements RowMapper<ReplaySession> {
        @Override
        public ReplaySession mapRow(ResultSet rs, int rowNum) throws SQLException {
            long durationMs = rs.getLong("duration_ms");
            Duration duration = rs.wasNull() ? null : Duration.ofMillis(durationMs);

            return new ReplaySession(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("description"),
                fromJson(rs.getString("filter"), EventFilter.class),
                fromJson(rs.getString("options"), ReplayOptions.class),
                ReplayStatus.valueOf(rs.getString("status")),
                rs.getInt("total_events"),
                rs.getInt("processed_events"),
                rs.getInt("succeeded_events"),
                rs.getInt("failed_events"),
                rs.getInt("skipped_events"),
                rs.getString("current_event_id"),
                rs.getTimestamp("created_at").toInstant(),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at")),
                duration,
                rs.getString("error"),
                fromJson(rs.getString("result"), ReplaySummary.class)
            );
        }
    }

    private static class ReplayEventResultRowMapper implements RowMapper<ReplayEventResult> {
        @Override
        public ReplayEventResult mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ReplayEventResult(
                rs.getString("session_id"),
                rs.getString("event_id"),
                rs.getInt("result_order"),
                ReplayEventStatus.valueOf(rs.getString("status")),
                Duration.ofMillis(rs.getLong("duration_ms")),
                rs.getString("error"),
                rs.getTimestamp("ts").toInstant()
            );
        }
    }
}
