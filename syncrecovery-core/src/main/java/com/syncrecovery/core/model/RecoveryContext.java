package com.syncrecovery.core.model;

import java.util.Optional;

/**
 * Everything a recovery strategy gets to decide and act on.
 *
 * @param backupInfo most recent usable backup, may be null
 */
public record RecoveryContext(
    SyncOperation operation,
    FailureClassification classification,
    int previousAttempts,
    BackupInfo backupInfo,
    SystemState systemState
) {
    public Optional<BackupInfo> backup() {
        return Optional.ofNullable(backupInfo);
    }
}
