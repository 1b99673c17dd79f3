package com.syncrecovery.core.model;

/**
 * How each replayed event is executed.
 */
public enum ReplayMode {
    /** Simulate only, no handler is called. */
    DRY_RUN,
    /** Validate structure, then execute. */
    SAFE,
    /** Execute without validation. */
    FAST,
    /** Same as SAFE with per-step logging. */
    VERBOSE;

    public boolean validatesEvents() {
        return this == SAFE || this == VERBOSE;
    }
}
