package com.syncrecovery.recovery.spi;

/**
 * Frees host resources when a sync operation ran out of them.
 */
public interface ResourceReclaimer {

    /**
     * @return Bytes of memory freed
     */
    long reclaimMemory() throws RecoveryStepException;

    /**
     * @return Bytes of disk space freed
     */
    long reclaimDisk() throws RecoveryStepException;

    void throttleCpu() throws RecoveryStepException;
}
