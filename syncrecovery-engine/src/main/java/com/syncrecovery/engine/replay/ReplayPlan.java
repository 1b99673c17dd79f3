package com.syncrecovery.engine.replay;

import com.syncrecovery.core.model.ChangeEvent;

import java.util.List;

/**
 * Ordered events of a replay run.
 *
 * @param events every event to replay, in result order
 * @param lanes groups that may run concurrently; each lane keeps its own order
 * @param excludedEvents events removed by skip, include or selector rules
 */
public record ReplayPlan(List<Step> events, List<List<Step>> lanes, int excludedEvents) {

    public ReplayPlan {
        events = List.copyOf(events);
        lanes = lanes.stream().map(List::copyOf).toList();
    }

    /**
     * One event with its position in the result order.
     */
    public record Step(ChangeEvent event, int order) {}

    public int size() {
        return events.size();
    }

    public boolean isConcurrent() {
        return lanes.size() > 1;
    }
}
