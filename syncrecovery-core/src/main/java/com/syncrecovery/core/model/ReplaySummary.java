package com.syncrecovery.core.model;

import java.time.Duration;
import java.util.List;

/**
 * Final result attached to a finished replay session.
 */
public record ReplaySummary(
    boolean success,
    int totalEvents,
    int processedEvents,
    int succeededEvents,
    int failedEvents,
    int skippedEvents,
    Duration averageEventTime,
    double throughputPerSecond,
    Validation validation
) {
    /**
     * Post-run consistency check, null when validation is disabled.
     */
    public record Validation(
        boolean dataIntegrityPassed,
        boolean consistencyPassed,
        List<ValidationIssue> issues
    ) {
        public Validation {
            issues = issues == null ? List.of() : List.copyOf(issues);
        }

        public boolean passed() {
            return dataIntegrityPassed && consistencyPassed;
        }
    }
}
