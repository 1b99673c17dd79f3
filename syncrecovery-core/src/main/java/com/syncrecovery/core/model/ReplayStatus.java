package com.syncrecovery.core.model;

/**
 * Lifecycle of a replay session. Pausing is a transition back to PENDING.
 */
public enum ReplayStatus {
    /**
     * Created or paused, waiting to run.
     * Transitions: -> RUNNING, CANCELLED
     */
    PENDING,

    /**
     * Replay loop active.
     * Transitions: -> PENDING (pause), COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(ReplayStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == PENDING || target == COMPLETED
                || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
