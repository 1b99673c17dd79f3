package com.syncrecovery.recovery.manager;

import com.syncrecovery.core.model.FailureClassification;
import com.syncrecovery.core.model.SystemState;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time report on the recovery manager.
 */
public record RecoveryStatusReport(
    Instant timestamp,
    OverallStatus overallStatus,
    int activeRecoveries,
    RecoveryStatistics statistics,
    SystemState systemState,
    List<FailureClassification> recentFailures,
    List<String> recommendations
) {
    public enum OverallStatus {
        HEALTHY,
        DEGRADED,
        FAILED;

        public static OverallStatus fromSuccessRate(double successRate) {
            if (successRate > 0.9) {
                return HEALTHY;
            }
            if (successRate > 0.7) {
                return DEGRADED;
            }
            return FAILED;
        }
    }

    public RecoveryStatusReport {
        recentFailures = List.copyOf(recentFailures);
        recommendations = List.copyOf(recommendations);
    }
}
