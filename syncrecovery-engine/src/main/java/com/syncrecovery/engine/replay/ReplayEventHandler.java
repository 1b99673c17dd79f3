package com.syncrecovery.engine.replay;

import com.syncrecovery.core.model.ChangeEvent;

/**
 * Re-applies one kind of change event during replay.
 * Hosts register one handler per event type on the replay engine.
 */
@FunctionalInterface
public interface ReplayEventHandler {

    /**
     * Apply the event again.
     * 
     * @param event The stored event being replayed
     * @throws ReplayException if the event cannot be applied
     */
    void apply(ChangeEvent event) throws ReplayException;
}
