package com.syncrecovery.engine.classification;

import com.syncrecovery.core.model.FailureClassification;
import com.syncrecovery.core.model.FailureSeverity;
import com.syncrecovery.core.model.FailureType;
import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.SyncError;
import com.syncrecovery.core.model.SyncOperation;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies sync failures into a type, severity, recoverability and recommended action.
 * 
 * Stateless and deterministic: the same operation and error always yield the
 * same classification.
 */
public class FailureClassifier {

    public static final int DEFAULT_FAILURE_THRESHOLD = 3;

    // Checked in order; the first matching rule wins
    private static final List<Rule> RULES = List.of(
        new Rule(FailureType.NETWORK_ERROR, List.of("network", "connection")),
        new Rule(FailureType.TIMEOUT_ERROR, List.of("timeout")),
        new Rule(FailureType.AUTHENTICATION_ERROR, List.of("auth", "unauthorized")),
        new Rule(FailureType.PERMISSION_ERROR, List.of("permission", "forbidden")),
        new Rule(FailureType.DATA_CORRUPTION, List.of("corrupt", "invalid data")),
        new Rule(FailureType.SCHEMA_MISMATCH, List.of("schema", "column")),
        new Rule(FailureType.CONFLICT_ERROR, List.of("conflict")),
        new Rule(FailureType.RESOURCE_EXHAUSTION, List.of("resource", "memory", "disk"))
    );

    private record Rule(FailureType type, List<String> keywords) {
        boolean matches(String text) {
            return keywords.stream().anyMatch(text::contains);
        }
    }

    private final int failureThreshold;

    public FailureClassifier() {
        this(DEFAULT_FAILURE_THRESHOLD);
    }

    /**
     * @param failureThreshold retry count at which severity is escalated one level
     */
    public FailureClassifier(int failureThreshold) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be >= 1");
        }
        this.failureThreshold = failureThreshold;
    }

    public FailureClassification classify(SyncOperation operation, SyncError error) {
        FailureType failureType = determineFailureType(error);
        FailureSeverity severity = assessSeverity(failureType, operation.retryCount());
        boolean recoverable = isRecoverable(failureType, severity, operation);
        RecoveryAction action = recommendAction(failureType, severity, operation.retryCount());
        Duration estimated = estimateRecoveryTime(failureType, severity);

        return new FailureClassification(
            operation.id(),
            failureType,
            severity,
            recoverable,
            action,
            estimated,
            buildContext(operation, error)
        );
    }

    /**
     * Case-insensitive keyword match over the error code and message.
     */
    public FailureType determineFailureType(SyncError error) {
        if (error == null) {
            return FailureType.UNKNOWN_ERROR;
        }
        String text = ((error.code() != null ? error.code() : "") + " "
            + (error.message() != null ? error.message() : "")).toLowerCase(Locale.ROOT);
        return RULES.stream()
            .filter(rule -> rule.matches(text))
            .map(Rule::type)
            .findFirst()
            .orElse(FailureType.UNKNOWN_ERROR);
    }

    FailureSeverity assessSeverity(FailureType failureType, int retryCount) {
        FailureSeverity severity = failureType.baseSeverity();
        if (retryCount >= failureThreshold) {
            severity = severity.escalate();
        }
        return severity;
    }

    boolean isRecoverable(FailureType failureType, FailureSeverity severity, SyncOperation operation) {
        if (severity == FailureSeverity.CRITICAL) {
            return false;
        }
        if (operation.retryCount() >= operation.maxRetries()) {
            return false;
        }
        return failureType.isAutoRecoverable();
    }

    RecoveryAction recommendAction(FailureType failureType, FailureSeverity severity, int retryCount) {
        if (severity == FailureSeverity.CRITICAL) {
            return RecoveryAction.MANUAL_INTERVENTION;
        }
        if (retryCount == 0) {
            return RecoveryAction.RETRY;
        } else if (retryCount < 2) {
            return RecoveryAction.BACKOFF_RETRY;
        } else if (retryCount < 4) {
            return RecoveryAction.FALLBACK_STRATEGY;
        }
        if (failureType.isDataIntegrityFailure()) {
            return RecoveryAction.RESTORE_FROM_BACKUP;
        }
        if (failureType.isConnectivityFailure()) {
            return RecoveryAction.RESET_AND_RESYNC;
        }
        return RecoveryAction.MANUAL_INTERVENTION;
    }

    Duration estimateRecoveryTime(FailureType failureType, FailureSeverity severity) {
        long millis = Math.round(failureType.baseRecoveryTime().toMillis() * severity.recoveryTimeMultiplier());
        return Duration.ofMillis(millis);
    }

    private static Map<String, Object> buildContext(SyncOperation operation, SyncError error) {
        // Map.copyOf in the classification rejects null values
        Map<String, Object> context = new LinkedHashMap<>();
        putIfPresent(context, "operationType", operation.type());
        putIfPresent(context, "tableName", operation.tableName());
        context.put("retryCount", operation.retryCount());
        if (error != null) {
            putIfPresent(context, "errorCode", error.code());
            putIfPresent(context, "errorMessage", error.message());
        }
        putIfPresent(context, "timestamp", operation.timestamp());
        return context;
    }

    private static void putIfPresent(Map<String, Object> context, String key, Object value) {
        if (value != null) {
            context.put(key, value);
        }
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }
}
