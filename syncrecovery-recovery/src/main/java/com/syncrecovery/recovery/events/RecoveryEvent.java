package com.syncrecovery.recovery.events;

import com.syncrecovery.core.model.FailureClassification;
import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.core.model.SyncError;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Entry in the recovery manager's event history.
 */
public record RecoveryEvent(
    String id,
    RecoveryEventType type,
    Instant timestamp,
    String operationId,
    RecoveryAction action,
    FailureClassification classification,
    RecoveryResult result,
    SyncError error,
    Map<String, Object> metadata
) {
    public RecoveryEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static RecoveryEvent failureDetected(FailureClassification classification, SyncError error, Instant now) {
        return new RecoveryEvent(newId(now), RecoveryEventType.FAILURE_DETECTED, now,
            classification.operationId(), classification.recommendedAction(), classification, null, error, null);
    }

    public static RecoveryEvent recoveryStarted(FailureClassification classification, String strategy, Instant now) {
        return new RecoveryEvent(newId(now), RecoveryEventType.RECOVERY_STARTED, now,
            classification.operationId(), classification.recommendedAction(), classification, null, null,
            Map.of("strategy", strategy));
    }

    public static RecoveryEvent recoveryFinished(FailureClassification classification, RecoveryResult result,
                                                 Instant now) {
        RecoveryEventType type = result.success()
            ? RecoveryEventType.RECOVERY_COMPLETED
            : RecoveryEventType.RECOVERY_FAILED;
        return new RecoveryEvent(newId(now), type, now, classification.operationId(), result.action(),
            classification, result, result.error(), result.metadata());
    }

    public static RecoveryEvent backupCreated(String backupId, String reason, Instant now) {
        return new RecoveryEvent(newId(now), RecoveryEventType.BACKUP_CREATED, now, null, null, null, null, null,
            Map.of("backupId", backupId, "reason", reason));
    }

    private static String newId(Instant now) {
        return "recovery_" + now.toEpochMilli() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
