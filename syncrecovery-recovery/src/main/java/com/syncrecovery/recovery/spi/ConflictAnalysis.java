package com.syncrecovery.recovery.spi;

import com.syncrecovery.core.model.FailureClassification;
import com.syncrecovery.core.model.FailureSeverity;
import com.syncrecovery.core.model.SyncOperation;

import java.util.Locale;

/**
 * Shape of a sync conflict as seen by the conflict strategy.
 */
public record ConflictAnalysis(String conflictType, FailureSeverity severity) {

    public static final String UPDATE_CONFLICT = "UPDATE_CONFLICT";
    public static final String GENERIC_CONFLICT = "GENERIC_CONFLICT";

    /**
     * Analysis from the operation's error alone: an error mentioning an update
     * is a simple update conflict, anything else keeps the classified severity.
     */
    public static ConflictAnalysis infer(SyncOperation operation, FailureClassification classification) {
        String message = operation.error() != null ? operation.error().message() : null;
        if (message != null && message.toLowerCase(Locale.ROOT).contains("update")) {
            return new ConflictAnalysis(UPDATE_CONFLICT, FailureSeverity.MEDIUM);
        }
        return new ConflictAnalysis(GENERIC_CONFLICT, classification.severity());
    }

    public boolean isUpdateConflict() {
        return UPDATE_CONFLICT.equals(conflictType);
    }
}
