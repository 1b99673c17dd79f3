package com.syncrecovery.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Named replay of a filtered slice of the change log.
 * Mutated only by the replay engine that owns it.
 */
public record ReplaySession(
    String id,
    String name,
    String description,
    EventFilter filter,
    ReplayOptions options,
    ReplayStatus status,

    // Counters
    int totalEvents,
    int processedEvents,
    int succeededEvents,
    int failedEvents,
    int skippedEvents,

    String currentEventId,

    // Timestamps
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Duration duration,

    String error,
    ReplaySummary result
) {
    /**
     * Create a new session in PENDING with zeroed counters.
     */
    public static ReplaySession create(String name, String description, EventFilter filter,
                                       ReplayOptions options, int totalEvents, Instant now) {
        return new ReplaySession(
            "replay_" + now.toEpochMilli() + "_" + UUID.randomUUID().toString().substring(0, 8),
            name, description, filter, options, ReplayStatus.PENDING,
            totalEvents, 0, 0, 0, 0, null,
            now, null, null, null, null, null
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public int remainingEvents() {
        return Math.max(0, totalEvents - processedEvents);
    }

    /**
     * Check if this session can transition to the target status.
     */
    public boolean canTransitionTo(ReplayStatus target) {
        return status.canTransitionTo(target);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private EventFilter filter;
        private ReplayOptions options;
        private ReplayStatus status;
        private int totalEvents;
        private int processedEvents;
        private int succeededEvents;
        private int failedEvents;
        private int skippedEvents;
        private String currentEventId;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private Duration duration;
        private String error;
        private ReplaySummary result;

        private Builder(ReplaySession session) {
            this.id = session.id;
            this.name = session.name;
            this.description = session.description;
            this.filter = session.filter;
            this.options = session.options;
            this.status = session.status;
            this.totalEvents = session.totalEvents;
            this.processedEvents = session.processedEvents;
            this.succeededEvents = session.succeededEvents;
            this.failedEvents = session.failedEvents;
            this.skippedEvents = session.skippedEvents;
            this.currentEventId = session.currentEventId;
            this.createdAt = session.createdAt;
            this.startedAt = session.startedAt;
            this.completedAt = session.completedAt;
            this.duration = session.duration;
            this.error = session.error;
            this.result = session.result;
        }

        public Builder status(ReplayStatus status) { this.status = status; return this; }
        public Builder totalEvents(int totalEvents) { this.totalEvents = totalEvents; return this; }
        public Builder processedEvents(int processedEvents) { this.processedEvents = processedEvents; return this; }
        public Builder succeededEvents(int succeededEvents) { this.succeededEvents = succeededEvents; return this; }
        public Builder failedEvents(int failedEvents) { this.failedEvents = failedEvents; return this; }
        public Builder skippedEvents(int skippedEvents) { this.skippedEvents = skippedEvents; return this; }
        public Builder currentEventId(String currentEventId) { this.currentEventId = currentEventId; return this; }
        public Builder startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
        public Builder completedAt(Instant completedAt) { this.completedAt = completedAt; return this; }
        public Builder duration(Duration duration) { this.duration = duration; return this; }
        public Builder error(String error) { this.error = error; return this; }
        public Builder result(ReplaySummary result) { this.result = result; return this; }

        /**
         * Count one more processed event with the given outcome.
         */
        public Builder recordOutcome(ReplayEventStatus outcome) {
            this.processedEvents++;
            switch (outcome) {
                case SUCCESS -> this.succeededEvents++;
                case FAILED -> this.failedEvents++;
                case SKIPPED -> this.skippedEvents++;
            }
            return this;
        }

        public ReplaySession build() {
            return new ReplaySession(
                id, name, description, filter, options, status,
                totalEvents, processedEvents, succeededEvents, failedEvents, skippedEvents,
                currentEventId, createdAt, startedAt, completedAt, duration, error, result
            );
        }
    }
}
