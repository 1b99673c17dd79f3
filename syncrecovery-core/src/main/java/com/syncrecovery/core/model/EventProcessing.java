package com.syncrecovery.core.model;

import com.syncrecovery.core.exception.InvalidStateTransitionException;

import java.time.Instant;

/**
 * Processing marker attached to a change event.
 */
public record EventProcessing(
    ProcessingStatus status,
    Instant processedAt,
    String error,
    int retryCount,
    int maxRetries
) {
    public static final int DEFAULT_MAX_RETRIES = 3;

    public static EventProcessing pending() {
        return new EventProcessing(ProcessingStatus.PENDING, null, null, 0, DEFAULT_MAX_RETRIES);
    }

    /**
     * Move to the target status, validating the transition.
     */
    public EventProcessing transitionTo(ProcessingStatus target, Instant at, String failure) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException("event processing", status, target);
        }
        int retries = status == ProcessingStatus.FAILED && target == ProcessingStatus.PROCESSING
            ? retryCount + 1 : retryCount;
        Instant processed = target == ProcessingStatus.COMPLETED || target == ProcessingStatus.FAILED
            ? at : processedAt;
        return new EventProcessing(target, processed, target == ProcessingStatus.FAILED ? failure : null,
            retries, maxRetries);
    }

    public boolean hasRetriesLeft() {
        return retryCount < maxRetries;
    }
}
