package com.syncrecovery.engine.changelog;

import com.syncrecovery.core.model.EventSeverity;
import com.syncrecovery.engine.config.SyncRecoveryProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * How long events of each severity are kept, and the hard cap on the log size.
 */
public record RetentionPolicy(
    int defaultRetentionDays,
    int maxTotalEvents,
    Map<EventSeverity, Integer> severityDays
) {
    public RetentionPolicy {
        if (defaultRetentionDays < 1) {
            throw new IllegalArgumentException("Default retention must be at least one day");
        }
        if (maxTotalEvents < 1) {
            throw new IllegalArgumentException("Max total events must be positive");
        }
        severityDays = severityDays == null || severityDays.isEmpty()
            ? Map.of() : Map.copyOf(new EnumMap<>(severityDays));
    }

    public static RetentionPolicy from(SyncRecoveryProperties.Retention retention) {
        return new RetentionPolicy(
            retention.getDefaultRetentionDays(),
            retention.getMaxTotalEvents(),
            retention.getSeverityDays()
        );
    }

    /**
     * Retention window of a severity, falling back to the default.
     */
    public Duration retentionFor(EventSeverity severity) {
        return Duration.ofDays(severityDays.getOrDefault(severity, defaultRetentionDays));
    }
}
