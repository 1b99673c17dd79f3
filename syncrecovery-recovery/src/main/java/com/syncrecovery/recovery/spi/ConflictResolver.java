package com.syncrecovery.recovery.spi;

import com.syncrecovery.core.model.FailureClassification;
import com.syncrecovery.core.model.SyncOperation;

/**
 * Applies conflict resolution policies to the records of a sync operation.
 */
public interface ConflictResolver {

    default ConflictAnalysis analyze(SyncOperation operation, FailureClassification classification) {
        return ConflictAnalysis.infer(operation, classification);
    }

    /**
     * @return Number of records resolved
     * @throws RecoveryStepException if the policy cannot be applied
     */
    int resolve(SyncOperation operation, ConflictAnalysis analysis, ResolutionPolicy policy)
        throws RecoveryStepException;
}
