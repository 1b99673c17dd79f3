package com.syncrecovery.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * Immutable record of something that happened in the sync subsystem.
 * Append-only change log for audit and replay.
 *
 * Primary Key: id
 * Index: (type, timestamp), (severity, timestamp), (projectId, timestamp)
 *
 * Invariants:
 * - sequence is assigned by the store on append and is strictly increasing
 * - data and metadata are never modified after append
 * - only the processing marker may change
 */
public record ChangeEvent(
    // Primary key
    String id,

    // Ordering (assigned on append)
    long sequence,

    // Classification
    ChangeEventType type,
    EventSeverity severity,
    EventSource source,
    Instant timestamp,

    // References
    String projectId,
    String changeId,
    String correlationId,
    String sessionId,
    String userId,

    // Event data
    JsonNode data,
    JsonNode metadata,

    EventProcessing processing
) {
    public static final String METADATA_VERSION = "version";
    public static final String METADATA_TAGS = "tags";
    public static final String METADATA_CHECKSUM = "checksum";
    public static final String METADATA_DEPENDS_ON = "dependsOn";
    public static final String SCHEMA_VERSION = "1.0";

    /**
     * Deterministic replay order: timestamp, then append sequence.
     */
    public static final Comparator<ChangeEvent> CHRONOLOGICAL =
        Comparator.comparing(ChangeEvent::timestamp).thenComparingLong(ChangeEvent::sequence);

    /**
     * Generate a time-sortable event id.
     */
    public static String newId(Instant timestamp) {
        return "evt_" + timestamp.toEpochMilli() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Compute the integrity checksum over type, data and timestamp.
     */
    public static String computeChecksum(ChangeEventType type, JsonNode data, Instant timestamp) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String content = type.name() + "|" + canonical(data) + "|" + timestamp.toEpochMilli();
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // Stores may reorder object keys (jsonb does), so keys are sorted first
    private static String canonical(JsonNode node) {
        if (node == null) {
            return "null";
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            StringJoiner joiner = new StringJoiner(",", "{", "}");
            for (String name : names) {
                joiner.add(JsonNodeFactory.instance.textNode(name) + ":" + canonical(node.get(name)));
            }
            return joiner.toString();
        }
        if (node.isArray()) {
            StringJoiner joiner = new StringJoiner(",", "[", "]");
            node.forEach(element -> joiner.add(canonical(element)));
            return joiner.toString();
        }
        return node.toString();
    }

    /**
     * Checksum recorded in metadata at append time.
     */
    public String checksum() {
        return metadataText(METADATA_CHECKSUM);
    }

    /**
     * Check that the recorded checksum still matches the event content.
     */
    public boolean verifyChecksum() {
        String recorded = checksum();
        return recorded == null || recorded.equals(computeChecksum(type, data, timestamp));
    }

    /**
     * Ids of events that must be replayed before this one.
     */
    public List<String> dependsOn() {
        List<String> result = new ArrayList<>();
        if (metadata != null && metadata.has(METADATA_DEPENDS_ON)) {
            metadata.get(METADATA_DEPENDS_ON).forEach(node -> result.add(node.asText()));
        }
        return result;
    }

    /**
     * Key of the resource this event mutates, or null if unknown.
     * Events with the same key are not independent of each other.
     */
    public String resourceKey() {
        if (projectId == null && changeId == null) {
            return null;
        }
        return projectId + ":" + changeId;
    }

    public String metadataText(String field) {
        if (metadata == null || !metadata.hasNonNull(field)) {
            return null;
        }
        return metadata.get(field).asText();
    }

    public ChangeEvent withSequence(long newSequence) {
        return toBuilder().sequence(newSequence).build();
    }

    public ChangeEvent withProcessing(EventProcessing newProcessing) {
        return toBuilder().processing(newProcessing).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .sequence(sequence)
            .type(type)
            .severity(severity)
            .source(source)
            .timestamp(timestamp)
            .projectId(projectId)
            .changeId(changeId)
            .correlationId(correlationId)
            .sessionId(sessionId)
            .userId(userId)
            .data(data)
            .metadata(metadata)
            .processing(processing);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private long sequence;
        private ChangeEventType type;
        private EventSeverity severity = EventSeverity.INFO;
        private EventSource source = EventSource.SYSTEM;
        private Instant timestamp;
        private String projectId;
        private String changeId;
        private String correlationId;
        private String sessionId;
        private String userId;
        private JsonNode data;
        private JsonNode metadata;
        private EventProcessing processing;

        public Builder id(String id) { this.id = id; return this; }
        public Builder sequence(long sequence) { this.sequence = sequence; return this; }
        public Builder type(ChangeEventType type) { this.type = type; return this; }
        public Builder severity(EventSeverity severity) { this.severity = severity; return this; }
        public Builder source(EventSource source) { this.source = source; return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        public Builder projectId(String projectId) { this.projectId = projectId; return this; }
        public Builder changeId(String changeId) { this.changeId = changeId; return this; }
        public Builder correlationId(String correlationId) { this.correlationId = correlationId; return this; }
        public Builder sessionId(String sessionId) { this.sessionId = sessionId; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder data(JsonNode data) { this.data = data; return this; }
        public Builder metadata(JsonNode metadata) { this.metadata = metadata; return this; }
        public Builder processing(EventProcessing processing) { this.processing = processing; return this; }

        /**
         * Declare events that must be replayed before this one.
         */
        public Builder dependsOn(String... eventIds) {
            ObjectNode node = metadata instanceof ObjectNode existing
                ? existing.deepCopy() : JsonNodeFactory.instance.objectNode();
            var array = node.putArray(METADATA_DEPENDS_ON);
            for (String eventId : eventIds) {
                array.add(eventId);
            }
            this.metadata = node;
            return this;
        }

        public ChangeEvent build() {
            if (type == null) {
                throw new IllegalArgumentException("Change event type is required");
            }
            Instant ts = timestamp != null ? timestamp : Instant.now();
            return new ChangeEvent(
                id != null ? id : newId(ts),
                sequence,
                type,
                severity,
                source,
                ts,
                projectId,
                changeId,
                correlationId,
                sessionId,
                userId,
                data != null ? data : JsonNodeFactory.instance.objectNode(),
                metadata != null ? metadata : JsonNodeFactory.instance.objectNode(),
                processing != null ? processing : EventProcessing.pending()
            );
        }
    }
}
