package com.syncrecovery.core.spi;

import com.syncrecovery.core.model.NetworkStatus;
import com.syncrecovery.core.model.SystemState;

/**
 * Source of host resource snapshots.
 */
public interface SystemStateProvider {

    /**
     * Take a fresh snapshot of network, disk, memory and CPU.
     */
    SystemState snapshot();

    /**
     * Re-check connectivity only.
     */
    default NetworkStatus probeNetwork() {
        return snapshot().networkStatus();
    }
}
