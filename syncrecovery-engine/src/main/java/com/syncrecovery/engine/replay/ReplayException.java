package com.syncrecovery.engine.replay;

/**
 * Exception thrown by replay handlers when an event cannot be re-applied.
 */
public class ReplayException extends Exception {

    private final String errorCode;

    public ReplayException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ReplayException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
