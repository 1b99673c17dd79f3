package com.syncrecovery.engine.replay;

import com.syncrecovery.core.exception.SyncRecoveryException;

/**
 * Thrown when the events of a session cannot be put in a valid order.
 */
public class ReplayPlanningException extends SyncRecoveryException {

    public static final String ERROR_CODE = "REPLAY_PLANNING_FAILED";

    public ReplayPlanningException(String message) {
        super(ERROR_CODE, message);
    }

    @Override
    public boolean isRecoverable() {
        return false;
    }
}
