package com.syncrecovery.core.model;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Outcome of one strategy execution.
 */
public record RecoveryResult(
    boolean success,
    RecoveryAction action,
    Duration duration,
    String message,
    RecoveryAction nextAction,
    SyncError error,
    Map<String, Object> metadata
) {
    public static final String STRATEGY_FAILED = "RECOVERY_STRATEGY_FAILED";

    public RecoveryResult {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static RecoveryResult success(RecoveryAction action, Duration duration, String message,
                                         Map<String, Object> metadata) {
        return new RecoveryResult(true, action, duration, message, null, null, metadata);
    }

    public static RecoveryResult failure(RecoveryAction action, Duration duration, SyncError error,
                                         RecoveryAction nextAction) {
        return new RecoveryResult(false, action, duration, error.message(), nextAction, error, Map.of());
    }

    public RecoveryResult withDuration(Duration newDuration) {
        return new RecoveryResult(success, action, newDuration, message, nextAction, error, metadata);
    }

    /**
     * Copy with extra metadata entries; existing keys are kept.
     */
    public RecoveryResult withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new HashMap<>(extra);
        merged.putAll(metadata);
        return new RecoveryResult(success, action, duration, message, nextAction, error, merged);
    }

    /**
     * Recovery failed and a human has to take over.
     */
    public boolean requiresManualIntervention() {
        return !success && (action.requiresHuman() || (nextAction != null && nextAction.requiresHuman()));
    }

    /**
     * Recovery failed but another automated attempt may succeed.
     */
    public boolean isRetryable() {
        return !success && !requiresManualIntervention() && error != null && error.recoverable();
    }
}
