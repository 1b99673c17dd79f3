package com.syncrecovery.recovery.spi;

import com.syncrecovery.core.model.FailureSeverity;

/**
 * How a conflict gets resolved.
 */
public enum ResolutionPolicy {
    LAST_WRITE_WINS,
    AUTO_MERGE,
    MANUAL_REVIEW;

    public static ResolutionPolicy forAnalysis(ConflictAnalysis analysis) {
        if (analysis.isUpdateConflict()) {
            return LAST_WRITE_WINS;
        }
        if (analysis.severity() == FailureSeverity.LOW) {
            return AUTO_MERGE;
        }
        return MANUAL_REVIEW;
    }
}
