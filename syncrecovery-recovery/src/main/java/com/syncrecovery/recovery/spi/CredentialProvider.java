package com.syncrecovery.recovery.spi;

import java.time.Instant;

/**
 * Refreshes the credentials used by the sync subsystem.
 */
@FunctionalInterface
public interface CredentialProvider {

    /**
     * @return Expiry of the refreshed credentials
     * @throws RecoveryStepException if the refresh is rejected
     */
    Instant refresh() throws RecoveryStepException;
}
