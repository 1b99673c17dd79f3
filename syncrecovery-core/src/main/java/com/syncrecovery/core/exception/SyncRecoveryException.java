package com.syncrecovery.core.exception;

/**
 * Base exception for all sync recovery errors.
 */
public class SyncRecoveryException extends RuntimeException {
    
    private final String errorCode;
    
    public SyncRecoveryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public SyncRecoveryException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether retrying the same call may succeed.
     */
    public boolean isRecoverable() {
        return true;
    }
}
