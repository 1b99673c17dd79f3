package com.syncrecovery.core.model;

/**
 * Subsystem that produced a change event.
 */
public enum EventSource {
    FILE_WATCHER,
    SYNC_MANAGER,
    RECOVERY_MANAGER,
    BACKUP_MANAGER,
    REPLAY_ENGINE,
    SYSTEM,
    USER
}
