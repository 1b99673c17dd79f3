package com.syncrecovery.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of replaying one event. Append-only per session, ordered by order.
 */
public record ReplayEventResult(
    String sessionId,
    String eventId,
    int order,
    ReplayEventStatus status,
    Duration duration,
    String error,
    Instant timestamp
) {
    public boolean isFailure() {
        return status == ReplayEventStatus.FAILED;
    }
}
