package com.syncrecovery.recovery.manager;

import com.syncrecovery.engine.config.SyncRecoveryProperties;

import java.time.Duration;

/**
 * Tunables of the recovery manager.
 */
public record RecoverySettings(
    boolean enableAutoRecovery,
    boolean autoBackup,
    Duration backupInterval,
    Duration healthCheckInterval,
    Duration cleanupInterval,
    int alertThreshold,
    int eventHistorySize,
    Duration rollbackPointTtl,
    int workerThreads
) {
    public static RecoverySettings defaults() {
        return new RecoverySettings(true, true, Duration.ofHours(24), Duration.ofMinutes(5),
            Duration.ofHours(1), 5, 1000, Duration.ofHours(24), 4);
    }

    public static RecoverySettings from(SyncRecoveryProperties.Recovery recovery) {
        return new RecoverySettings(
            recovery.isEnableAutoRecovery(),
            recovery.isAutoBackup(),
            recovery.getBackupInterval(),
            recovery.getHealthCheckInterval(),
            recovery.getCleanupInterval(),
            recovery.getAlertThreshold(),
            recovery.getEventHistorySize(),
            recovery.getRollbackPointTtl(),
            recovery.getWorkerThreads()
        );
    }

    public RecoverySettings withAutoRecovery(boolean enabled) {
        return new RecoverySettings(enabled, autoBackup, backupInterval, healthCheckInterval, cleanupInterval,
            alertThreshold, eventHistorySize, rollbackPointTtl, workerThreads);
    }

    public RecoverySettings withAutoBackup(boolean enabled) {
        return new RecoverySettings(enableAutoRecovery, enabled, backupInterval, healthCheckInterval,
            cleanupInterval, alertThreshold, eventHistorySize, rollbackPointTtl, workerThreads);
    }
}
