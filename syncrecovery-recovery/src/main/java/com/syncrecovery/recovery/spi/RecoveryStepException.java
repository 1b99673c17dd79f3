package com.syncrecovery.recovery.spi;

/**
 * Exception thrown by recovery collaborators when a step cannot be completed.
 */
public class RecoveryStepException extends Exception {

    private final String errorCode;

    public RecoveryStepException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RecoveryStepException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * A collaborator the step needs is not configured.
     */
    public static RecoveryStepException missingCollaborator(String collaborator) {
        return new RecoveryStepException("COLLABORATOR_MISSING", "No " + collaborator + " configured");
    }
}
