package com.syncrecovery.core.model;

import java.util.Comparator;

/**
 * Sort key for event queries. Ties are always broken by append sequence
 * in the same direction, so equal timestamps keep append order.
 */
public record EventSort(Field field, Direction direction) {

    public enum Field { TIMESTAMP, SEVERITY, TYPE }

    public enum Direction { ASC, DESC }

    /**
     * Newest first, for listings.
     */
    public static EventSort newestFirst() {
        return new EventSort(Field.TIMESTAMP, Direction.DESC);
    }

    /**
     * Oldest first, for replay.
     */
    public static EventSort oldestFirst() {
        return new EventSort(Field.TIMESTAMP, Direction.ASC);
    }

    public Comparator<ChangeEvent> comparator() {
        Comparator<ChangeEvent> primary = switch (field) {
            case TIMESTAMP -> Comparator.comparing(ChangeEvent::timestamp);
            case SEVERITY -> Comparator.comparing(ChangeEvent::severity);
            case TYPE -> Comparator.comparing(e -> e.type().name());
        };
        Comparator<ChangeEvent> full = primary.thenComparingLong(ChangeEvent::sequence);
        return direction == Direction.ASC ? full : full.reversed();
    }
}
