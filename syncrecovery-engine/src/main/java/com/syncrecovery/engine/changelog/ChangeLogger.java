package com.syncrecovery.engine.changelog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.syncrecovery.core.model.ChangeEvent;
import com.syncrecovery.core.model.ChangeEventType;
import com.syncrecovery.core.model.EventSeverity;
import com.syncrecovery.core.model.EventSource;
import com.syncrecovery.core.model.SyncOperation;
import com.syncrecovery.core.model.SyncOperationStatus;

import java.time.Clock;
import java.util.Locale;

/**
 * Convenience facade over the change event store.
 * Each method fixes the event type, source and default severity.
 * 
 * projectId, changeId, correlationId, sessionId and userId are lifted
 * from the payload when present.
 */
public class ChangeLogger {

    public static final String RESULT_SUCCESS = "SUCCESS";
    public static final String BACKUP_ACTION_RESTORE = "RESTORE";

    private final ChangeEventStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ChangeLogger(ChangeEventStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String logFileChange(Object data) {
        return logFileChange(data, EventSeverity.INFO);
    }

    public String logFileChange(Object data, EventSeverity severity) {
        return log(ChangeEventType.FILE_CHANGE, severity, EventSource.FILE_WATCHER, data, "file", "filesystem");
    }

    public String logDBChange(Object data) {
        return logDBChange(data, EventSeverity.INFO);
    }

    public String logDBChange(Object data, EventSeverity severity) {
        return log(ChangeEventType.DB_CHANGE, severity, EventSource.SYNC_MANAGER, data, "database", "sync");
    }

    /**
     * Log a sync operation; failed operations are logged at ERROR.
     */
    public String logSyncOperation(SyncOperation operation) {
        EventSeverity severity = operation.status() == SyncOperationStatus.FAILED
            ? EventSeverity.ERROR : EventSeverity.INFO;
        return logSyncOperation(operation, severity);
    }

    public String logSyncOperation(Object data, EventSeverity severity) {
        return log(ChangeEventType.SYNC_OPERATION, severity, EventSource.SYNC_MANAGER, data, "sync", "operation");
    }

    /**
     * Log a conflict; a payload carrying a resolutionStrategy is logged as resolved.
     */
    public String logConflict(Object data) {
        return logConflict(data, EventSeverity.WARNING);
    }

    public String logConflict(Object data, EventSeverity severity) {
        JsonNode payload = toTree(data);
        ChangeEventType type = payload.hasNonNull("resolutionStrategy")
            ? ChangeEventType.CONFLICT_RESOLVED : ChangeEventType.CONFLICT_DETECTED;
        return log(type, severity, EventSource.SYNC_MANAGER, payload, "conflict", "resolution");
    }

    /**
     * Log recovery progress; a payload with result SUCCESS marks the recovery completed.
     */
    public String logRecovery(Object data) {
        return logRecovery(data, EventSeverity.INFO);
    }

    public String logRecovery(Object data, EventSeverity severity) {
        JsonNode payload = toTree(data);
        ChangeEventType type = RESULT_SUCCESS.equals(payload.path("result").asText(null))
            ? ChangeEventType.RECOVERY_COMPLETED : ChangeEventType.RECOVERY_STARTED;
        return log(type, severity, EventSource.RECOVERY_MANAGER, payload, "recovery", "failure");
    }

    public String logBackup(Object data) {
        return logBackup(data, EventSeverity.INFO);
    }

    public String logBackup(Object data, EventSeverity severity) {
        JsonNode payload = toTree(data);
        ChangeEventType type = BACKUP_ACTION_RESTORE.equals(payload.path("action").asText(null))
            ? ChangeEventType.BACKUP_RESTORED : ChangeEventType.BACKUP_CREATED;
        return log(type, severity, EventSource.BACKUP_MANAGER, payload, "backup", "storage");
    }

    public String logSystemEvent(Object data) {
        return logSystemEvent(data, EventSeverity.INFO);
    }

    public String logSystemEvent(Object data, EventSeverity severity) {
        return log(ChangeEventType.SYSTEM_EVENT, severity, EventSource.SYSTEM, data, "system", "monitoring");
    }

    /**
     * Log an event with explicit type and source.
     */
    public String logEvent(ChangeEventType type, EventSeverity severity, EventSource source, Object data) {
        return log(type, severity, source, data, type.name().toLowerCase(Locale.ROOT));
    }

    private String log(ChangeEventType type, EventSeverity severity, EventSource source,
                       Object data, String... tags) {
        JsonNode payload = toTree(data);
        ChangeEvent event = ChangeEvent.builder()
            .type(type)
            .severity(severity != null ? severity : EventSeverity.INFO)
            .source(source)
            .timestamp(clock.instant())
            .projectId(text(payload, "projectId"))
            .changeId(text(payload, "changeId"))
            .correlationId(text(payload, "correlationId"))
            .sessionId(text(payload, "sessionId"))
            .userId(text(payload, "userId"))
            .data(payload)
            .metadata(ChangeEventStore.metadataWithTags(tags))
            .build();
        return store.append(event);
    }

    private JsonNode toTree(Object data) {
        if (data == null) {
            return objectMapper.createObjectNode();
        }
        if (data instanceof JsonNode node) {
            return node;
        }
        JsonNode tree = objectMapper.valueToTree(data);
        return tree != null ? tree : objectMapper.createObjectNode();
    }

    private static String text(JsonNode payload, String field) {
        if (payload instanceof ObjectNode && payload.hasNonNull(field)) {
            return payload.get(field).asText();
        }
        return null;
    }
}
