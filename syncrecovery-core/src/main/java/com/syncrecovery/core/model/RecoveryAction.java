package com.syncrecovery.core.model;

/**
 * Actions a recovery can take or recommend.
 */
public enum RecoveryAction {
    RETRY,
    BACKOFF_RETRY,
    FALLBACK_STRATEGY,
    RESTORE_FROM_BACKUP,
    RESET_AND_RESYNC,
    MANUAL_INTERVENTION,
    ESCALATE,
    SKIP_AND_CONTINUE;

    /**
     * Check if this action hands the failure to a human.
     */
    public boolean requiresHuman() {
        return this == MANUAL_INTERVENTION || this == ESCALATE;
    }
}
