package com.syncrecovery.core.exception;

/**
 * Thrown when a change event payload cannot be serialized or deserialized.
 */
public class EventSerializationException extends SyncRecoveryException {

    public static final String ERROR_CODE = "EVENT_SERIALIZATION_FAILED";

    public EventSerializationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
