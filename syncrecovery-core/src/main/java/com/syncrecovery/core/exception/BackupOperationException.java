package com.syncrecovery.core.exception;

/**
 * Thrown when a backup cannot be created, verified or restored.
 */
public class BackupOperationException extends SyncRecoveryException {

    public static final String ERROR_CODE = "BACKUP_OPERATION_FAILED";

    public BackupOperationException(String message) {
        super(ERROR_CODE, message);
    }

    public BackupOperationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
