package com.syncrecovery.recovery.strategy;

import com.syncrecovery.core.model.FailureType;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Function;

/**
 * The built-in recovery strategies and their budgets.
 */
public enum BuiltInStrategy {

    NETWORK_RETRY("NetworkRetryStrategy",
        EnumSet.of(FailureType.NETWORK_ERROR, FailureType.TIMEOUT_ERROR), 5, 1, 2.0,
        NetworkRetryStrategy::new),

    AUTH_RECOVERY("AuthRecoveryStrategy",
        EnumSet.of(FailureType.AUTHENTICATION_ERROR), 3, 2, 1.0,
        AuthRecoveryStrategy::new),

    DATA_CORRUPTION_RECOVERY("DataCorruptionRecoveryStrategy",
        EnumSet.of(FailureType.DATA_CORRUPTION, FailureType.SCHEMA_MISMATCH), 2, 3, 1.0,
        DataCorruptionRecoveryStrategy::new),

    CONFLICT_RESOLUTION("ConflictResolutionStrategy",
        EnumSet.of(FailureType.CONFLICT_ERROR), 3, 2, 1.0,
        ConflictResolutionStrategy::new),

    RESOURCE_EXHAUSTION("ResourceExhaustionStrategy",
        EnumSet.of(FailureType.RESOURCE_EXHAUSTION), 2, 2, 1.0,
        ResourceExhaustionStrategy::new),

    DEFAULT_RETRY("DefaultRetryStrategy",
        EnumSet.of(FailureType.UNKNOWN_ERROR, FailureType.PERMISSION_ERROR), 3, 10, 2.0,
        DefaultRetryStrategy::new);

    private final String strategyName;
    private final Set<FailureType> failureTypes;
    private final int maxAttempts;
    private final int priority;
    private final double backoffMultiplier;
    private final Function<RecoveryCollaborators, RecoveryStrategy> constructor;

    BuiltInStrategy(String strategyName, Set<FailureType> failureTypes, int maxAttempts, int priority,
                    double backoffMultiplier, Function<RecoveryCollaborators, RecoveryStrategy> constructor) {
        this.strategyName = strategyName;
        this.failureTypes = failureTypes;
        this.maxAttempts = maxAttempts;
        this.priority = priority;
        this.backoffMultiplier = backoffMultiplier;
        this.constructor = constructor;
    }

    public String strategyName() {
        return strategyName;
    }

    public Set<FailureType> failureTypes() {
        return Set.copyOf(failureTypes);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public int priority() {
        return priority;
    }

    public double backoffMultiplier() {
        return backoffMultiplier;
    }

    public RecoveryStrategy create(RecoveryCollaborators collaborators) {
        return constructor.apply(collaborators);
    }
}
