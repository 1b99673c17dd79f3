package com.syncrecovery.engine.changelog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.syncrecovery.core.exception.EventSerializationException;
import com.syncrecovery.core.exception.InvalidRequestException;
import com.syncrecovery.core.exception.NotFoundException;
import com.syncrecovery.core.model.ChangeEvent;
import com.syncrecovery.core.model.ChangeEventType;
import com.syncrecovery.core.model.EventFilter;
import com.syncrecovery.core.model.EventProcessing;
import com.syncrecovery.core.model.EventSeverity;
import com.syncrecovery.core.model.EventSource;
import com.syncrecovery.core.model.ProcessingStatus;
import com.syncrecovery.core.repository.ChangeEventRepository;
import com.syncrecovery.engine.metrics.SyncRecoveryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Append-only store for change events.
 * 
 * Responsibilities:
 * - Stamp events with schema version and checksum on append
 * - Filtered queries, search, statistics and hourly timelines
 * - Export to JSON, CSV or SQL
 * - Retention cleanup
 */
public class ChangeEventStore {

    private static final Logger log = LoggerFactory.getLogger(ChangeEventStore.class);

    private static final String CSV_HEADER = "id,type,severity,source,timestamp,projectId";

    private final ChangeEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SyncRecoveryMetrics metrics;
    private final RetentionPolicy retentionPolicy;

    public ChangeEventStore(
            ChangeEventRepository repository,
            ObjectMapper objectMapper,
            Clock clock,
            SyncRecoveryMetrics metrics,
            RetentionPolicy retentionPolicy) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
        this.retentionPolicy = retentionPolicy;
    }

    // ========== Append ==========

    /**
     * Append an event to the log.
     * 
     * @param event The event; id, timestamp and processing are filled in when missing
     * @return The stored event id
     */
    public String append(ChangeEvent event) {
        if (event == null || event.type() == null) {
            throw new InvalidRequestException("Change event type is required");
        }

        Instant timestamp = event.timestamp() != null ? event.timestamp() : clock.instant();
        ObjectNode metadata = event.metadata() instanceof ObjectNode existing
            ? existing.deepCopy() : JsonNodeFactory.instance.objectNode();
        if (!metadata.hasNonNull(ChangeEvent.METADATA_VERSION)) {
            metadata.put(ChangeEvent.METADATA_VERSION, ChangeEvent.SCHEMA_VERSION);
        }
        if (!metadata.has(ChangeEvent.METADATA_TAGS)) {
            metadata.putArray(ChangeEvent.METADATA_TAGS);
        }
        metadata.put(ChangeEvent.METADATA_CHECKSUM,
            ChangeEvent.computeChecksum(event.type(), event.data(), timestamp));

        ChangeEvent prepared = event.toBuilder()
            .id(event.id() != null ? event.id() : ChangeEvent.newId(timestamp))
            .timestamp(timestamp)
            .metadata(metadata)
            .processing(event.processing() != null ? event.processing() : EventProcessing.pending())
            .build();

        ChangeEvent stored = repository.append(prepared);
        metrics.eventAppended(stored.type().name());
        log.debug("Appended change event {} type={} severity={}", stored.id(), stored.type(), stored.severity());
        return stored.id();
    }

    /**
     * Append a batch of events in order.
     */
    public List<String> appendAll(List<ChangeEvent> events) {
        List<String> ids = new ArrayList<>(events.size());
        for (ChangeEvent event : events) {
            ids.add(append(event));
        }
        return ids;
    }

    // ========== Queries ==========

    public Optional<ChangeEvent> findEvent(String eventId) {
        return repository.findById(eventId);
    }

    public ChangeEvent getEvent(String eventId) {
        return repository.findById(eventId)
            .orElseThrow(() -> new NotFoundException("ChangeEvent", eventId));
    }

    public List<ChangeEvent> query(EventFilter filter) {
        return repository.find(filterOrAll(filter));
    }

    public long count(EventFilter filter) {
        return repository.count(filterOrAll(filter));
    }

    public List<ChangeEvent> search(String text, EventFilter filter) {
        if (text == null || text.isBlank()) {
            return query(filter);
        }
        return repository.search(text, filterOrAll(filter));
    }

    /**
     * Move an event's processing marker forward.
     */
    public ChangeEvent markProcessing(String eventId, ProcessingStatus status, String error) {
        ChangeEvent event = getEvent(eventId);
        EventProcessing next = event.processing().transitionTo(status, clock.instant(), error);
        repository.updateProcessing(eventId, next);
        return event.withProcessing(next);
    }

    // ========== Statistics ==========

    public EventStatistics statistics(EventFilter filter) {
        List<ChangeEvent> events = repository.find(filterOrAll(filter).withoutPagination());

        Map<ChangeEventType, Long> byType = new EnumMap<>(ChangeEventType.class);
        Map<EventSeverity, Long> bySeverity = new EnumMap<>(EventSeverity.class);
        Map<EventSource, Long> bySource = new EnumMap<>(EventSource.class);
        Instant earliest = null;
        Instant latest = null;
        long errors = 0;
        long storageSize = 0;

        for (ChangeEvent event : events) {
            byType.merge(event.type(), 1L, Long::sum);
            bySeverity.merge(event.severity(), 1L, Long::sum);
            bySource.merge(event.source(), 1L, Long::sum);
            if (earliest == null || event.timestamp().isBefore(earliest)) {
                earliest = event.timestamp();
            }
            if (latest == null || event.timestamp().isAfter(latest)) {
                latest = event.timestamp();
            }
            if (event.severity().isError()) {
                errors++;
            }
            storageSize += serializedSize(event);
        }

        double errorRate = events.isEmpty() ? 0.0 : (double) errors / events.size();
        return new EventStatistics(events.size(), byType, bySeverity, bySource,
            buildTimeline(events), earliest, latest, errorRate, storageSize);
    }

    /**
     * Hourly event counts, oldest bucket first.
     */
    public List<TimelineBucket> timeline(EventFilter filter) {
        return buildTimeline(repository.find(filterOrAll(filter).withoutPagination()));
    }

    private List<TimelineBucket> buildTimeline(List<ChangeEvent> events) {
        Map<Instant, Map<ChangeEventType, Long>> buckets = new TreeMap<>();
        for (ChangeEvent event : events) {
            Instant hour = event.timestamp().truncatedTo(ChronoUnit.HOURS);
            buckets.computeIfAbsent(hour, h -> new EnumMap<>(ChangeEventType.class))
                .merge(event.type(), 1L, Long::sum);
        }
        return buckets.entrySet().stream()
            .map(e -> new TimelineBucket(
                e.getKey(),
                e.getValue().values().stream().mapToLong(Long::longValue).sum(),
                e.getValue()))
            .collect(Collectors.toList());
    }

    // ========== Export ==========

    public String export(EventFilter filter, ExportFormat format) {
        if (format == null) {
            throw new InvalidRequestException("Export format is required");
        }
        List<ChangeEvent> events = query(filter);
        return switch (format) {
            case JSON -> toJson(events);
            case CSV -> toCsv(events);
            case SQL -> toSql(events);
        };
    }

    private String toJson(List<ChangeEvent> events) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(events);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to export change events as JSON", e);
        }
    }

    private String toCsv(List<ChangeEvent> events) {
        StringBuilder csv = new StringBuilder(CSV_HEADER);
        for (ChangeEvent event : events) {
            csv.append('\n')
                .append(csvField(event.id())).append(',')
                .append(csvField(event.type().name())).append(',')
                .append(csvField(event.severity().name())).append(',')
                .append(csvField(event.source().name())).append(',')
                .append(csvField(event.timestamp().toString())).append(',')
                .append(csvField(event.projectId()));
        }
        return csv.toString();
    }

    private static String csvField(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private String toSql(List<ChangeEvent> events) {
        return events.stream()
            .map(event -> String.format(
                "INSERT INTO change_events (id, type, severity, source, timestamp, data, metadata) "
                    + "VALUES (%s, %s, %s, %s, %s, %s, %s);",
                sqlLiteral(event.id()),
                sqlLiteral(event.type().name()),
                sqlLiteral(event.severity().name()),
                sqlLiteral(event.source().name()),
                sqlLiteral(event.timestamp().toString()),
                sqlLiteral(writeJson(event.data())),
                sqlLiteral(writeJson(event.metadata()))))
            .collect(Collectors.joining("\n"));
    }

    private static String sqlLiteral(String value) {
        return value == null ? "NULL" : "'" + value.replace("'", "''") + "'";
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize change event payload", e);
        }
    }

    private long serializedSize(ChangeEvent event) {
        try {
            return objectMapper.writeValueAsBytes(event).length;
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to size change event " + event.id(), e);
        }
    }

    // ========== Retention ==========

    /**
     * Apply per-severity retention windows, then evict the oldest events above the cap.
     * 
     * @return Number of events deleted
     */
    public int cleanup() {
        Instant now = clock.instant();
        int deleted = 0;

        for (EventSeverity severity : EventSeverity.values()) {
            Duration retention = retentionPolicy.retentionFor(severity);
            int removed = repository.deleteBySeverityOlderThan(severity, now.minus(retention));
            if (removed > 0) {
                log.info("Removed {} {} events older than {} days", removed, severity, retention.toDays());
            }
            deleted += removed;
        }

        long overflow = repository.countAll() - retentionPolicy.maxTotalEvents();
        if (overflow > 0) {
            int evicted = repository.deleteOldest((int) overflow);
            log.info("Evicted {} oldest events above the cap of {}", evicted, retentionPolicy.maxTotalEvents());
            deleted += evicted;
        }

        if (deleted > 0) {
            metrics.eventsCleaned(deleted);
        }
        return deleted;
    }

    public long countAll() {
        return repository.countAll();
    }

    private static EventFilter filterOrAll(EventFilter filter) {
        return filter != null ? filter : EventFilter.all();
    }

    /**
     * Tags array helper for callers building metadata.
     */
    static ObjectNode metadataWithTags(String... tags) {
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put(ChangeEvent.METADATA_VERSION, ChangeEvent.SCHEMA_VERSION);
        ArrayNode array = metadata.putArray(ChangeEvent.METADATA_TAGS);
        for (String tag : tags) {
            array.add(tag);
        }
        return metadata;
    }
}
