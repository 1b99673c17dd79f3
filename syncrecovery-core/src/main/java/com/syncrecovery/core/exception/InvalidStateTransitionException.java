package com.syncrecovery.core.exception;

/**
 * Thrown when an invalid state transition is attempted.
 */
public class InvalidStateTransitionException extends SyncRecoveryException {
    
    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";
    
    public InvalidStateTransitionException(String entityType, Enum<?> currentState, Enum<?> targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s from %s to %s",
            entityType, currentState, targetState
        ));
    }
}
