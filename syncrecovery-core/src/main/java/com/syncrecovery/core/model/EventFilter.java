package com.syncrecovery.core.model;

import java.util.Set;

/**
 * Query over the change log. Empty sets match everything.
 */
public record EventFilter(
    Set<ChangeEventType> eventTypes,
    Set<EventSeverity> severities,
    Set<EventSource> sources,
    Set<String> projectIds,
    Set<String> changeIds,
    Set<String> correlationIds,
    Set<String> userIds,
    Set<String> sessionIds,
    TimeRange timeRange,
    Pagination pagination,
    EventSort sort
) {
    public EventFilter {
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
        severities = severities == null ? Set.of() : Set.copyOf(severities);
        sources = sources == null ? Set.of() : Set.copyOf(sources);
        projectIds = projectIds == null ? Set.of() : Set.copyOf(projectIds);
        changeIds = changeIds == null ? Set.of() : Set.copyOf(changeIds);
        correlationIds = correlationIds == null ? Set.of() : Set.copyOf(correlationIds);
        userIds = userIds == null ? Set.of() : Set.copyOf(userIds);
        sessionIds = sessionIds == null ? Set.of() : Set.copyOf(sessionIds);
        sort = sort == null ? EventSort.newestFirst() : sort;
    }

    /**
     * Filter matching every event, newest first.
     */
    public static EventFilter all() {
        return builder().build();
    }

    /**
     * Check whether an event satisfies every criterion except pagination.
     */
    public boolean matches(ChangeEvent event) {
        return (eventTypes.isEmpty() || eventTypes.contains(event.type()))
            && (severities.isEmpty() || severities.contains(event.severity()))
            && (sources.isEmpty() || sources.contains(event.source()))
            && matchesAny(projectIds, event.projectId())
            && matchesAny(changeIds, event.changeId())
            && matchesAny(correlationIds, event.correlationId())
            && matchesAny(userIds, event.userId())
            && matchesAny(sessionIds, event.sessionId())
            && (timeRange == null || timeRange.contains(event.timestamp()));
    }

    // Immutable sets reject contains(null)
    private static boolean matchesAny(Set<String> values, String value) {
        return values.isEmpty() || (value != null && values.contains(value));
    }

    public EventFilter withSort(EventSort newSort) {
        return toBuilder().sort(newSort).build();
    }

    public EventFilter withoutPagination() {
        return toBuilder().pagination(null).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .eventTypes(eventTypes)
            .severities(severities)
            .sources(sources)
            .projectIds(projectIds)
            .changeIds(changeIds)
            .correlationIds(correlationIds)
            .userIds(userIds)
            .sessionIds(sessionIds)
            .timeRange(timeRange)
            .pagination(pagination)
            .sort(sort);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Set<ChangeEventType> eventTypes;
        private Set<EventSeverity> severities;
        private Set<EventSource> sources;
        private Set<String> projectIds;
        private Set<String> changeIds;
        private Set<String> correlationIds;
        private Set<String> userIds;
        private Set<String> sessionIds;
        private TimeRange timeRange;
        private Pagination pagination;
        private EventSort sort;

        public Builder eventTypes(Set<ChangeEventType> eventTypes) { this.eventTypes = eventTypes; return this; }
        public Builder severities(Set<EventSeverity> severities) { this.severities = severities; return this; }
        public Builder sources(Set<EventSource> sources) { this.sources = sources; return this; }
        public Builder projectIds(Set<String> projectIds) { this.projectIds = projectIds; return this; }
        public Builder changeIds(Set<String> changeIds) { this.changeIds = changeIds; return this; }
        public Builder correlationIds(Set<String> correlationIds) { this.correlationIds = correlationIds; return this; }
        public Builder userIds(Set<String> userIds) { this.userIds = userIds; return this; }
        public Builder sessionIds(Set<String> sessionIds) { this.sessionIds = sessionIds; return this; }
        public Builder timeRange(TimeRange timeRange) { this.timeRange = timeRange; return this; }
        public Builder pagination(Pagination pagination) { this.pagination = pagination; return this; }
        public Builder sort(EventSort sort) { this.sort = sort; return this; }

        public Builder eventTypes(ChangeEventType... types) {
            this.eventTypes = Set.of(types);
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectIds = Set.of(projectId);
            return this;
        }

        public EventFilter build() {
            return new EventFilter(eventTypes, severities, sources, projectIds, changeIds,
                correlationIds, userIds, sessionIds, timeRange, pagination, sort);
        }
    }
}
