package com.syncrecovery.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Error raised alongside a sync operation. Never persisted directly;
 * always wrapped in a classification first.
 */
public record SyncError(
    String code,
    String message,
    Map<String, Object> details,
    Instant timestamp,
    boolean recoverable
) {
    public SyncError {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static SyncError of(String code, String message) {
        return new SyncError(code, message, Map.of(), Instant.now(), true);
    }

    public static SyncError of(String code, String message, Instant timestamp, boolean recoverable) {
        return new SyncError(code, message, Map.of(), timestamp, recoverable);
    }
}
