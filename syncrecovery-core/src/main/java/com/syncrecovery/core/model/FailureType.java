package com.syncrecovery.core.model;

import java.time.Duration;

/**
 * Failure categories, each with its base severity and base recovery time.
 */
public enum FailureType {
    NETWORK_ERROR(FailureSeverity.MEDIUM, Duration.ofSeconds(5)),
    TIMEOUT_ERROR(FailureSeverity.MEDIUM, Duration.ofSeconds(10)),
    AUTHENTICATION_ERROR(FailureSeverity.HIGH, Duration.ofSeconds(3)),
    PERMISSION_ERROR(FailureSeverity.HIGH, Duration.ofSeconds(3)),
    DATA_CORRUPTION(FailureSeverity.CRITICAL, Duration.ofSeconds(60)),
    SCHEMA_MISMATCH(FailureSeverity.HIGH, Duration.ofSeconds(30)),
    CONFLICT_ERROR(FailureSeverity.MEDIUM, Duration.ofSeconds(15)),
    RESOURCE_EXHAUSTION(FailureSeverity.HIGH, Duration.ofSeconds(45)),
    UNKNOWN_ERROR(FailureSeverity.MEDIUM, Duration.ofSeconds(20));

    private final FailureSeverity baseSeverity;
    private final Duration baseRecoveryTime;

    FailureType(FailureSeverity baseSeverity, Duration baseRecoveryTime) {
        this.baseSeverity = baseSeverity;
        this.baseRecoveryTime = baseRecoveryTime;
    }

    public FailureSeverity baseSeverity() {
        return baseSeverity;
    }

    public Duration baseRecoveryTime() {
        return baseRecoveryTime;
    }

    /**
     * Types that may be retried automatically while budget remains.
     */
    public boolean isAutoRecoverable() {
        return this == NETWORK_ERROR || this == TIMEOUT_ERROR
            || this == CONFLICT_ERROR || this == RESOURCE_EXHAUSTION;
    }

    /**
     * Types whose terminal action is a restore from backup.
     */
    public boolean isDataIntegrityFailure() {
        return this == DATA_CORRUPTION || this == SCHEMA_MISMATCH;
    }

    /**
     * Types whose terminal action is a reset and resync.
     */
    public boolean isConnectivityFailure() {
        return this == NETWORK_ERROR || this == TIMEOUT_ERROR;
    }
}
