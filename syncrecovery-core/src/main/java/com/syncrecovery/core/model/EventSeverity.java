package com.syncrecovery.core.model;

/**
 * Severity of a change event, ordered from least to most severe.
 */
public enum EventSeverity {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * Check if this severity is the same as or above the given one.
     */
    public boolean isAtLeast(EventSeverity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Check if this severity counts towards the error rate.
     */
    public boolean isError() {
        return this == ERROR || this == CRITICAL;
    }
}
