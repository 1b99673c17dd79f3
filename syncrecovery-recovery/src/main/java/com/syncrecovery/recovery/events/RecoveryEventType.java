package com.syncrecovery.recovery.events;

public enum RecoveryEventType {
    FAILURE_DETECTED,
    RECOVERY_STARTED,
    RECOVERY_COMPLETED,
    RECOVERY_FAILED,
    BACKUP_CREATED
}
