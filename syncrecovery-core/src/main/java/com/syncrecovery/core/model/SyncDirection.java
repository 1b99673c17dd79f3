package com.syncrecovery.core.model;

/**
 * Direction of a sync operation.
 */
public enum SyncDirection {
    LOCAL_TO_REMOTE,
    REMOTE_TO_LOCAL,
    BIDIRECTIONAL
}
