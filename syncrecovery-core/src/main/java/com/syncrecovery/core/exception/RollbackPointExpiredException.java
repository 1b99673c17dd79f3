package com.syncrecovery.core.exception;

import java.time.Instant;

/**
 * Thrown when restoring a rollback point whose expiry has passed.
 * Never recoverable: the referenced backup may already be gone.
 */
public class RollbackPointExpiredException extends SyncRecoveryException {

    public static final String ERROR_CODE = "ROLLBACK_POINT_EXPIRED";

    private final String rollbackPointId;

    public RollbackPointExpiredException(String rollbackPointId, Instant expiresAt) {
        super(ERROR_CODE, String.format(
            "Rollback point %s expired at %s",
            rollbackPointId, expiresAt
        ));
        this.rollbackPointId = rollbackPointId;
    }

    public String getRollbackPointId() {
        return rollbackPointId;
    }

    @Override
    public boolean isRecoverable() {
        return false;
    }
}
