package com.syncrecovery.engine.changelog;

import com.syncrecovery.core.model.ChangeEventType;

import java.time.Instant;
import java.util.Map;

/**
 * Number of events in one hour, by type.
 */
public record TimelineBucket(
    Instant bucketStart,
    long count,
    Map<ChangeEventType, Long> types
) {
    public TimelineBucket {
        types = types == null ? Map.of() : Map.copyOf(types);
    }
}
