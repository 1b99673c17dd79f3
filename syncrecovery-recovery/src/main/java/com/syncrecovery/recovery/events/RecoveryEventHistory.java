package com.syncrecovery.recovery.events;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-memory history of recovery events, oldest evicted first.
 */
public class RecoveryEventHistory {

    private final int capacity;
    private final Deque<RecoveryEvent> events;

    public RecoveryEventHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be >= 1");
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void record(RecoveryEvent event) {
        if (events.size() == capacity) {
            events.removeFirst();
        }
        events.addLast(event);
    }

    /**
     * Events matching every non-null criterion, oldest first.
     */
    public synchronized List<RecoveryEvent> query(RecoveryEventType type, String operationId, Instant since) {
        List<RecoveryEvent> matches = new ArrayList<>();
        for (RecoveryEvent event : events) {
            if ((type == null || event.type() == type)
                && (operationId == null || operationId.equals(event.operationId()))
                && (since == null || !event.timestamp().isBefore(since))) {
                matches.add(event);
            }
        }
        return matches;
    }

    /**
     * Up to {@code limit} most recent events of a type, newest first.
     */
    public synchronized List<RecoveryEvent> recent(RecoveryEventType type, int limit) {
        List<RecoveryEvent> matches = new ArrayList<>();
        Iterator<RecoveryEvent> it = events.descendingIterator();
        while (it.hasNext() && matches.size() < limit) {
            RecoveryEvent event = it.next();
            if (type == null || event.type() == type) {
                matches.add(event);
            }
        }
        return matches;
    }

    public synchronized int size() {
        return events.size();
    }
}
