package com.syncrecovery.core.model;

/**
 * Status of a sync operation as reported by the sync subsystem.
 */
public enum SyncOperationStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    RECOVERING
}
