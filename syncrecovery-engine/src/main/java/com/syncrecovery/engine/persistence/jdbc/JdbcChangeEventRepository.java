package com.syncrecovery.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.syncrecovery.core.exception.EventSerializationException;
import com.syncrecovery.core.exception.InvalidRequestException;
import com.syncrecovery.core.model.ChangeEvent;
import com.syncrecovery.core.model.ChangeEventType;
import com.syncrecovery.core.model.EventFilter;
import com.syncrecovery.core.model.EventProcessing;
import com.syncrecovery.core.model.EventSeverity;
import com.syncrecovery.core.model.EventSort;
import com.syncrecovery.core.model.EventSource;
import com.syncrecovery.core.model.ProcessingStatus;
import com.syncrecovery.core.repository.ChangeEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * PostgreSQL-backed implementation of ChangeEventRepository.
 * 
 * Events are append-only; the BIGSERIAL seq column gives the stable
 * tie-break for events sharing a timestamp.
 */
@Repository
@ConditionalOnProperty(name = "syncrecovery.store.type", havingValue = "jdbc")
public class JdbcChangeEventRepository implements ChangeEventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcChangeEventRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final ChangeEventRowMapper rowMapper = new ChangeEventRowMapper();

    public JdbcChangeEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public ChangeEvent append(ChangeEvent event) {
        String sql = """
            INSERT INTO change_events (
                id, type, severity, severity_rank, source, ts,
                project_id, change_id, correlation_id, session_id, user_id,
                data, metadata,
                processing_status, processed_at, processing_error, retry_count, max_retries
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?)
            RETURNING seq
            """;

        String dataJson = serialize(event.data());
        String metadataJson = serialize(event.metadata());
        EventProcessing processing = event.processing();

        try {
            Long seq = jdbcTemplate.queryForObject(sql, Long.class,
                event.id(),
                event.type().name(),
                event.severity().name(),
                event.severity().ordinal(),
                event.source().name(),
                Timestamp.from(event.timestamp()),
                event.projectId(),
                event.changeId(),
                event.correlationId(),
                event.sessionId(),
                event.userId(),
                dataJson,
                metadataJson,
                processing.status().name(),
                toTimestamp(processing.processedAt()),
                processing.error(),
                processing.retryCount(),
                processing.maxRetries()
            );
            log.debug("Appended change event {} (seq={}, type={})", event.id(), seq, event.type());
            return event.withSequence(seq != null ? seq : 0L);
        } catch (DuplicateKeyException e) {
            throw new InvalidRequestException("Duplicate change event id: " + event.id());
        } catch (Exception e) {
            log.error("Failed to append change event {}: {}", event.id(), e.getMessage());
            throw new RuntimeException("Failed to append change event", e);
        }
    }

    @Override
    public Optional<ChangeEvent> findById(String eventId) {
        String sql = "SELECT * FROM change_events WHERE id = ?";
        List<ChangeEvent> results = jdbcTemplate.query(sql, rowMapper, eventId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ChangeEvent> find(EventFilter filter) {
        Where where = where(filter);
        String sql = "SELECT * FROM change_events" + where.sql() + orderBy(filter.sort()) + limit(filter, where);
        return jdbcTemplate.query(sql, rowMapper, where.params().toArray());
    }

    @Override
    public long count(EventFilter filter) {
        Where where = where(filter);
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM change_events" + where.sql(), Long.class, where.params().toArray());
        return count != null ? count : 0L;
    }

    @Override
    public List<ChangeEvent> search(String text, EventFilter filter) {
        Where where = where(filter);
        String pattern = "%" + escapeLike(text == null ? "" : text.toLowerCase(Locale.ROOT)) + "%";
        String clause = """
            (LOWER(id) LIKE ? ESCAPE '\\' OR LOWER(type) LIKE ? ESCAPE '\\'
             OR LOWER(source) LIKE ? ESCAPE '\\' OR LOWER(data::text) LIKE ? ESCAPE '\\'
             OR LOWER(metadata::text) LIKE ? ESCAPE '\\')""";
        for (int i = 0; i < 5; i++) {
            where.params().add(pattern);
        }
        String sql = "SELECT * FROM change_events"
            + (where.sql().isEmpty() ? " WHERE " : where.sql() + " AND ") + clause
            + orderBy(filter.sort()) + limit(filter, where);
        return jdbcTemplate.query(sql, rowMapper, where.params().toArray());
    }

    /**
     * Match the text literally: LIKE wildcards and the escape character are escaped.
     */
    static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    @Override
    @Transactional
    public boolean updateProcessing(String eventId, EventProcessing processing) {
        String sql = """
            UPDATE change_events SET
                processing_status = ?,
                processed_at = ?,
                processing_error = ?,
                retry_count = ?,
                max_retries = ?
            WHERE id = ?
            """;
        int rows = jdbcTemplate.update(sql,
            processing.status().name(),
            toTimestamp(processing.processedAt()),
            processing.error(),
            processing.retryCount(),
            processing.maxRetries(),
            eventId
        );
        log.debug("Updated processing of event {} to {}", eventId, processing.status());
        return rows > 0;
    }

    @Override
    @Transactional
    public int deleteBySeverityOlderThan(EventSeverity severity, Instant cutoff) {
        String sql = "DELETE FROM change_events WHERE severity = ? AND ts < ?";
        return jdbcTemplate.update(sql, severity.name(), Timestamp.from(cutoff));
    }

    @Override
    @Transactional
    public int deleteOldest(int count) {
        if (count <= 0) {
            return 0;
        }
        String sql = """
            DELETE FROM change_events WHERE id IN (
                SELECT id FROM change_events ORDER BY ts ASC, seq ASC LIMIT ?
            )
            """;
        return jdbcTemplate.update(sql, count);
    }

    @Override
    public long countAll() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM change_events", Long.class);
        return count != null ? count : 0L;
    }

    // ========== SQL building ==========

    private record Where(String sql, List<Object> params) {}

    private Where where(EventFilter filter) {
        List<String> clauses = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        in(clauses, params, "type", filter.eventTypes().stream().map(Enum::name).collect(Collectors.toList()));
        in(clauses, params, "severity", filter.severities().stream().map(Enum::name).collect(Collectors.toList()));
        in(clauses, params, "source", filter.sources().stream().map(Enum::name).collect(Collectors.toList()));
        in(clauses, params, "project_id", filter.projectIds());
        in(clauses, params, "change_id", filter.changeIds());
        in(clauses, params, "correlation_id", filter.correlationIds());
        in(clauses, params, "user_id", filter.userIds());
        in(clauses, params, "session_id", filter.sessionIds());

        if (filter.timeRange() != null) {
            if (filter.timeRange().start() != null) {
                clauses.add("ts >= ?");
                params.add(Timestamp.from(filter.timeRange().start()));
            }
            if (filter.timeRange().end() != null) {
                clauses.add("ts <= ?");
                params.add(Timestamp.from(filter.timeRange().end()));
            }
        }

        String sql = clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
        return new Where(sql, params);
    }

    private static void in(List<String> clauses, List<Object> params, String column, Collection<String> values) {
        if (values.isEmpty()) {
            return;
        }
        String placeholders = String.join(",", values.stream().map(v -> "?").toList());
        clauses.add(column + " IN (" + placeholders + ")");
        params.addAll(values);
    }

    private static String orderBy(EventSort sort) {
        String column = switch (sort.field()) {
            case TIMESTAMP -> "ts";
            case SEVERITY -> "severity_rank";
            case TYPE -> "type";
        };
        String direction = sort.direction() == EventSort.Direction.ASC ? "ASC" : "DESC";
        return " ORDER BY " + column + " " + direction + ", seq " + direction;
    }

    private static String limit(EventFilter filter, Where where) {
        if (filter.pagination() == null) {
            return "";
        }
        where.params().add(filter.pagination().limit());
        where.params().add(filter.pagination().offset());
        return " LIMIT ? OFFSET ?";
    }

    private String serialize(JsonNode node) {
        if (node == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize change event payload", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class ChangeEventRowMapper implements RowMapper<ChangeEvent> {
        @Override
        public ChangeEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp processedAt = rs.getTimestamp("processed_at");
            EventProcessing processing = new EventProcessing(
                ProcessingStatus.valueOf(rs.getString("processing_status")),
                processedAt != null ? processedAt.toInstant() : null,
                rs.getString("processing_error"),
                rs.getInt("retry_count"),
                rs.getInt("max_retries")
            );

            return new ChangeEvent(
                rs.getString("id"),
                rs.getLong("seq"),
                ChangeEventType.valueOf(rs.getString("type")),
                EventSeverity.valueOf(rs.getString("severity")),
                EventSource.valueOf(rs.getString("source")),
                rs.getTimestamp("ts").toInstant(),
                rs.getString("project_id"),
                rs.getString("change_id"),
                rs.getString("correlation_id"),
                rs.getString("session_id"),
                rs.getString("user_id"),
                deserialize(rs.getString("data")),
                deserialize(rs.getString("metadata")),
                processing
            );
        }

        private JsonNode deserialize(String json) {
            if (json == null || json.isBlank()) {
                return JsonNodeFactory.instance.objectNode();
            }
            try {
                return objectMapper.readTree(json);
            } catch (JsonProcessingException e) {
                throw new EventSerializationException("Failed to deserialize change event payload", e);
            }
        }
    }
}
