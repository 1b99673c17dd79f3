package com.syncrecovery.core.exception;

/**
 * Thrown synchronously for malformed input such as a missing filter or invalid options.
 * No event is recorded for these.
 */
public class InvalidRequestException extends SyncRecoveryException {

    public static final String ERROR_CODE = "INVALID_REQUEST";

    public InvalidRequestException(String message) {
        super(ERROR_CODE, message);
    }
}
