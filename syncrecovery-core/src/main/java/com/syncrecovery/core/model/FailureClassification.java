package com.syncrecovery.core.model;

import java.time.Duration;
import java.util.Map;

/**
 * Derived judgment about a sync failure. Not stored on its own.
 *
 * Invariants:
 * - severity == CRITICAL implies recoverable == false
 */
public record FailureClassification(
    String operationId,
    FailureType failureType,
    FailureSeverity severity,
    boolean recoverable,
    RecoveryAction recommendedAction,
    Duration estimatedRecoveryTime,
    Map<String, Object> context
) {
    public FailureClassification {
        if (severity == FailureSeverity.CRITICAL && recoverable) {
            throw new IllegalArgumentException("Critical failures cannot be recoverable");
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public boolean isCritical() {
        return severity == FailureSeverity.CRITICAL;
    }
}
