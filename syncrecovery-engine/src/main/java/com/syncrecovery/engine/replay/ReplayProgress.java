package com.syncrecovery.engine.replay;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Live progress of a replay session.
 */
public record ReplayProgress(
    String sessionId,
    int totalEvents,
    int processedEvents,
    String currentEvent,
    Duration estimatedTimeRemaining,
    List<EventError> errors
) {
    public ReplayProgress {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public record EventError(String eventId, String error, Instant timestamp) {}
}
