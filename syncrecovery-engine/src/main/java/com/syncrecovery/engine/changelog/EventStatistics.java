package com.syncrecovery.engine.changelog;

import com.syncrecovery.core.model.ChangeEventType;
import com.syncrecovery.core.model.EventSeverity;
import com.syncrecovery.core.model.EventSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregates over the events matching a filter.
 *
 * @param errorRate share of ERROR and CRITICAL events, 0 when there are none
 * @param storageSize bytes of the serialized events
 */
public record EventStatistics(
    long totalEvents,
    Map<ChangeEventType, Long> eventsByType,
    Map<EventSeverity, Long> eventsBySeverity,
    Map<EventSource, Long> eventsBySource,
    List<TimelineBucket> timeline,
    Instant earliest,
    Instant latest,
    double errorRate,
    long storageSize
) {
    public EventStatistics {
        eventsByType = eventsByType == null ? Map.of() : Map.copyOf(eventsByType);
        eventsBySeverity = eventsBySeverity == null ? Map.of() : Map.copyOf(eventsBySeverity);
        eventsBySource = eventsBySource == null ? Map.of() : Map.copyOf(eventsBySource);
        timeline = timeline == null ? List.of() : List.copyOf(timeline);
    }
}
