package com.syncrecovery.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncrecovery.core.exception.EventSerializationException;
import com.syncrecovery.core.model.RollbackPoint;
import com.syncrecovery.core.repository.RollbackPointRepository;
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
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of RollbackPointRepository.
 */
@Repository
@ConditionalOnProperty(name = "syncrecovery.store.type", havingValue = "jdbc")
public class JdbcRollbackPointRepository implements RollbackPointRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRollbackPointRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RollbackPointRowMapper rowMapper = new RollbackPointRowMapper();

    public JdbcRollbackPointRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void save(RollbackPoint rollbackPoint) {
        String sql = """
            INSERT INTO rollback_points (
                id, created_at, description, backup_id, operation_ids, owner_session_id, expires_at
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?, ?)
            ON CONFLICT (id) DO UPDATE SET
                description = EXCLUDED.description,
                expires_at = EXCLUDED.expires_at
            """;
        try {
            jdbcTemplate.update(sql,
                rollbackPoint.id(),
                Timestamp.from(rollbackPoint.createdAt()),
                rollbackPoint.description(),
                rollbackPoint.backupId(),
                objectMapper.writeValueAsString(rollbackPoint.operationIds()),
                rollbackPoint.ownerSessionId(),
                rollbackPoint.expiresAt() != null ? Timestamp.from(rollbackPoint.expiresAt()) : null
            );
            log.debug("Saved rollback point {} for backup {}", rollbackPoint.id(), rollbackPoint.backupId());
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize rollback point operations", e);
        }
    }

    @Override
    public Optional<RollbackPoint> findById(String rollbackPointId) {
        String sql = "SELECT * FROM rollback_points WHERE id = ?";
        List<RollbackPoint> results = jdbcTemplate.query(sql, rowMapper, rollbackPointId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<RollbackPoint> findByOwner(String sessionId) {
        String sql = """
            SELECT * FROM rollback_points
            WHERE owner_session_id = ?
            ORDER BY created_at ASC, id ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, sessionId);
    }

    @Override
    public List<RollbackPoint> findAll() {
        return jdbcTemplate.query("SELECT * FROM rollback_points ORDER BY created_at ASC, id ASC", rowMapper);
    }

    @Override
    public List<RollbackPoint> findExpired(Instant now, int limit) {
        String sql = """
            SELECT * FROM rollback_points
            WHERE expires_at <= ?
            ORDER BY expires_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(now), limit);
    }

    @Override
    @Transactional
    public boolean delete(String rollbackPointId) {
        return jdbcTemplate.update("DELETE FROM rollback_points WHERE id = ?", rollbackPointId) > 0;
    }

    private class RollbackPointRowMapper implements RowMapper<RollbackPoint> {
        @Override
        public RollbackPoint mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp expiresAt = rs.getTimestamp("expires_at");
            List<String> operationIds;
            try {
                operationIds = objectMapper.readValue(rs.getString("operation_ids"), STRING_LIST);
            } catch (JsonProcessingException e) {
                throw new EventSerializationException("Failed to deserialize rollback point operations", e);
            }

            return new RollbackPoint(
                rs.getString("id"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getString("description"),
                rs.getString("backup_id"),
                operationIds,
                rs.getString("owner_session_id"),
                expiresAt != null ? expiresAt.toInstant() : null
            );
        }
    }
}
