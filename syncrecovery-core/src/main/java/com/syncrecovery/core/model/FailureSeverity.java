package com.syncrecovery.core.model;

/**
 * Severity of a classified sync failure.
 */
public enum FailureSeverity {
    /**
     * Transient, recovers on its own.
     */
    LOW(0.5),

    /**
     * May need user involvement.
     */
    MEDIUM(1.0),

    /**
     * Needs prompt action.
     */
    HIGH(2.0),

    /**
     * Affects the whole system. Never auto-remediated.
     */
    CRITICAL(5.0);

    private final double recoveryTimeMultiplier;

    FailureSeverity(double recoveryTimeMultiplier) {
        this.recoveryTimeMultiplier = recoveryTimeMultiplier;
    }

    public double recoveryTimeMultiplier() {
        return recoveryTimeMultiplier;
    }

    /**
     * One level up; CRITICAL stays CRITICAL.
     */
    public FailureSeverity escalate() {
        return switch (this) {
            case LOW -> MEDIUM;
            case MEDIUM -> HIGH;
            case HIGH, CRITICAL -> CRITICAL;
        };
    }
}
