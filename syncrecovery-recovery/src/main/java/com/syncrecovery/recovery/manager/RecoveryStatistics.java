package com.syncrecovery.recovery.manager;

import com.syncrecovery.core.model.FailureType;
import com.syncrecovery.core.model.RecoveryAction;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of the recovery manager's rolling statistics.
 *
 * @param successRate recoveredFailures / totalFailures, 1.0 before any failure
 */
public record RecoveryStatistics(
    long totalFailures,
    long recoveredFailures,
    long failedRecoveries,
    long manualInterventions,
    Map<FailureType, Long> failuresByType,
    Map<RecoveryAction, Long> recoveryActionCounts,
    Duration averageRecoveryTime,
    double successRate,
    Instant lastRecoveryTime
) {
    public RecoveryStatistics {
        failuresByType = Map.copyOf(failuresByType);
        recoveryActionCounts = Map.copyOf(recoveryActionCounts);
    }

    public long failuresOf(FailureType type) {
        return failuresByType.getOrDefault(type, 0L);
    }
}
