package com.syncrecovery.core.model;

import java.time.Instant;

/**
 * Time window; either bound may be open (null). Start inclusive, end inclusive.
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("Time range end must not be before start");
        }
    }

    public static TimeRange between(Instant start, Instant end) {
        return new TimeRange(start, end);
    }

    public static TimeRange since(Instant start) {
        return new TimeRange(start, null);
    }

    public boolean contains(Instant instant) {
        return (start == null || !instant.isBefore(start))
            && (end == null || !instant.isAfter(end));
    }
}
