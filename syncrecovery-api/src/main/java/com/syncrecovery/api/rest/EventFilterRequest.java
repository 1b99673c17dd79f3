package com.syncrecovery.api.rest;

import com.syncrecovery.core.model.ChangeEventType;
import com.syncrecovery.core.model.EventFilter;
import com.syncrecovery.core.model.EventSeverity;
import com.syncrecovery.core.model.EventSource;
import com.syncrecovery.core.model.EventSort;
import com.syncrecovery.core.model.Pagination;
import com.syncrecovery.core.model.TimeRange;

import java.time.Instant;
import java.util.Set;

/**
 * Wire form of an event filter, shared by event queries and replay sessions.
 */
public record EventFilterRequest(
    Set<ChangeEventType> types,
    Set<EventSeverity> severities,
    Set<EventSource> sources,
    Set<String> projectIds,
    Set<String> changeIds,
    Set<String> correlationIds,
    Set<String> userIds,
    Set<String> sessionIds,
    Instant from,
    Instant to,
    Integer offset,
    Integer limit,
    EventSort.Field sortBy,
    EventSort.Direction direction
) {
    public EventFilter toFilter() {
        EventFilter.Builder builder = EventFilter.builder()
            .eventTypes(types)
            .severities(severities)
            .sources(sources)
            .projectIds(projectIds)
            .changeIds(changeIds)
            .correlationIds(correlationIds)
            .userIds(userIds)
            .sessionIds(sessionIds);

        if (from != null || to != null) {
            builder.timeRange(TimeRange.between(from, to));
        }
        if (offset != null || limit != null) {
            builder.pagination(Pagination.of(offset != null ? offset : 0, limit != null ? limit : 100));
        }
        if (sortBy != null || direction != null) {
            builder.sort(new EventSort(
                sortBy != null ? sortBy : EventSort.Field.TIMESTAMP,
                direction != null ? direction : EventSort.Direction.DESC));
        }
        return builder.build();
    }
}
