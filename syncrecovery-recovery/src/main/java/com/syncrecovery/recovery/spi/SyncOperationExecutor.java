package com.syncrecovery.recovery.spi;

import com.syncrecovery.core.model.SyncOperation;

/**
 * Re-issues sync operations on behalf of recovery strategies.
 * Provided by the sync subsystem.
 */
public interface SyncOperationExecutor {

    /**
     * Run the operation again.
     *
     * @throws RecoveryStepException if the operation fails again
     */
    void reissue(SyncOperation operation) throws RecoveryStepException;

    /**
     * Check that the data the operation touches is consistent after a restore.
     * Accepts everything unless overridden.
     */
    default void validate(SyncOperation operation) throws RecoveryStepException {
    }
}
