package com.syncrecovery.recovery.manager;

import com.syncrecovery.core.model.FailureType;
import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.RecoveryResult;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Mutable counters behind {@link RecoveryStatistics}.
 */
class RecoveryStatisticsTracker {

    private long totalFailures;
    private long recoveredFailures;
    private long failedRecoveries;
    private long manualInterventions;
    private long completedAttempts;
    private Duration averageRecoveryTime = Duration.ZERO;
    private Instant lastRecoveryTime;
    private final Map<FailureType, Long> failuresByType = new EnumMap<>(FailureType.class);
    private final Map<RecoveryAction, Long> actionCounts = new EnumMap<>(RecoveryAction.class);

    synchronized void failureDetected(FailureType type) {
        totalFailures++;
        failuresByType.merge(type, 1L, Long::sum);
    }

    synchronized void recoveryFinished(RecoveryResult result, Instant finishedAt) {
        if (result.success()) {
            recoveredFailures++;
        } else {
            failedRecoveries++;
        }
        actionCounts.merge(result.action(), 1L, Long::sum);

        // Cumulative moving average over every finished attempt
        completedAttempts++;
        long avgMillis = averageRecoveryTime.toMillis();
        long newAvg = avgMillis + (result.duration().toMillis() - avgMillis) / completedAttempts;
        averageRecoveryTime = Duration.ofMillis(newAvg);
        lastRecoveryTime = finishedAt;
    }

    synchronized void manualIntervention() {
        manualInterventions++;
    }

    synchronized long failuresOf(FailureType type) {
        return failuresByType.getOrDefault(type, 0L);
    }

    synchronized RecoveryStatistics snapshot() {
        double successRate = totalFailures == 0
            ? 1.0
            : Math.min(1.0, (double) recoveredFailures / totalFailures);
        return new RecoveryStatistics(
            totalFailures,
            recoveredFailures,
            failedRecoveries,
            manualInterventions,
            failuresByType,
            actionCounts,
            averageRecoveryTime,
            successRate,
            lastRecoveryTime
        );
    }
}
