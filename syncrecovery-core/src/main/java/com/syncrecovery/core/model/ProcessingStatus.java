package com.syncrecovery.core.model;

/**
 * Asynchronous processing status of a stored change event.
 * The payload never changes; only this marker moves forward.
 */
public enum ProcessingStatus {
    /**
     * Stored, not yet picked up.
     * Transitions: -> PROCESSING
     */
    PENDING,

    /**
     * Being indexed or replayed.
     * Transitions: -> COMPLETED, FAILED
     */
    PROCESSING,

    /**
     * Terminal state.
     */
    COMPLETED,

    /**
     * Processing failed. May be picked up again.
     * Transitions: -> PROCESSING
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED;
    }

    public boolean canTransitionTo(ProcessingStatus target) {
        return switch (this) {
            case PENDING -> target == PROCESSING;
            case PROCESSING -> target == COMPLETED || target == FAILED;
            case COMPLETED -> false;
            case FAILED -> target == PROCESSING;
        };
    }
}
