package com.syncrecovery.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One unit of sync work protected by the recovery core.
 * Owned by the sync subsystem; recovery only bumps retryCount per attempt.
 */
public record SyncOperation(
    String id,
    SyncDirection type,
    String tableName,
    String recordId,
    SyncOperationStatus status,
    Instant timestamp,
    int retryCount,
    int maxRetries,
    JsonNode data,
    SyncError error
) {
    public static final int DEFAULT_MAX_RETRIES = 3;

    /**
     * Create a new pending operation.
     */
    public static SyncOperation create(String id, SyncDirection type, String tableName) {
        return new SyncOperation(id, type, tableName, null, SyncOperationStatus.PENDING,
            Instant.now(), 0, DEFAULT_MAX_RETRIES, null, null);
    }

    public SyncOperation withError(SyncError newError) {
        return new SyncOperation(id, type, tableName, recordId, SyncOperationStatus.FAILED,
            timestamp, retryCount, maxRetries, data, newError);
    }

    /**
     * Copy with the retry counter bumped, marked as recovering.
     */
    public SyncOperation withRetry() {
        return new SyncOperation(id, type, tableName, recordId, SyncOperationStatus.RECOVERING,
            timestamp, retryCount + 1, maxRetries, data, error);
    }

    public SyncOperation withRetryCount(int newRetryCount) {
        return new SyncOperation(id, type, tableName, recordId, status,
            timestamp, newRetryCount, maxRetries, data, error);
    }

    public boolean hasRetriesLeft() {
        return retryCount < maxRetries;
    }
}
