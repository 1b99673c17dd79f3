package com.syncrecovery.core.exception;

/**
 * Thrown when an event, replay session, rollback point or backup is not found.
 */
public class NotFoundException extends SyncRecoveryException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
