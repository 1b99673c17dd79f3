package com.syncrecovery.core.repository;

import com.syncrecovery.core.model.ChangeEvent;
import com.syncrecovery.core.model.EventFilter;
import com.syncrecovery.core.model.EventProcessing;
import com.syncrecovery.core.model.EventSeverity;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for change event persistence.
 * Events are append-only; only the processing marker may be updated.
 */
public interface ChangeEventRepository {

    /**
     * Append a new event to the log.
     * 
     * @param event The event to append
     * @return The stored event with its append sequence assigned
     */
    ChangeEvent append(ChangeEvent event);

    /**
     * Find an event by ID.
     * 
     * @param eventId The event ID
     * @return The event if found
     */
    Optional<ChangeEvent> findById(String eventId);

    /**
     * Find events matching a filter, sorted and paginated as the filter requests.
     * 
     * @param filter The query
     * @return Matching events
     */
    List<ChangeEvent> find(EventFilter filter);

    /**
     * Count events matching a filter, ignoring pagination.
     */
    long count(EventFilter filter);

    /**
     * Case-insensitive substring search over id, type, source, data and metadata.
     * 
     * @param text Text to look for
     * @param filter Additional criteria, sort and pagination
     * @return Matching events
     */
    List<ChangeEvent> search(String text, EventFilter filter);

    /**
     * Replace the processing marker of an event.
     * 
     * @return true if the event exists
     */
    boolean updateProcessing(String eventId, EventProcessing processing);

    /**
     * Delete events of a severity with a timestamp before the cutoff.
     * 
     * @return Number of events deleted
     */
    int deleteBySeverityOlderThan(EventSeverity severity, Instant cutoff);

    /**
     * Delete the oldest events (by timestamp, then sequence).
     * 
     * @param count Number of events to delete
     * @return Number of events deleted
     */
    int deleteOldest(int count);

    /**
     * Total number of stored events.
     */
    long countAll();
}
