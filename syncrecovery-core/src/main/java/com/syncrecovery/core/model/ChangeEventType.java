package com.syncrecovery.core.model;

/**
 * Kinds of facts recorded in the change log.
 */
public enum ChangeEventType {
    // Data changes
    FILE_CHANGE,
    DB_CHANGE,
    SYNC_OPERATION,

    // Conflicts
    CONFLICT_DETECTED,
    CONFLICT_RESOLVED,

    // Recovery
    RECOVERY_STARTED,
    RECOVERY_COMPLETED,

    // Backups
    BACKUP_CREATED,
    BACKUP_RESTORED,

    SYSTEM_EVENT;

    /**
     * Check if this event type describes a data mutation.
     */
    public boolean isDataChange() {
        return this == FILE_CHANGE || this == DB_CHANGE || this == SYNC_OPERATION;
    }
}
