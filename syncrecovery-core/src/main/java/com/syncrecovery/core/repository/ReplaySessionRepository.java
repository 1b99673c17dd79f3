package com.syncrecovery.core.repository;

import com.syncrecovery.core.model.ReplayEventResult;
import com.syncrecovery.core.model.ReplaySession;
import com.syncrecovery.core.model.ReplayStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository for replay sessions and their per-event results.
 */
public interface ReplaySessionRepository {

    /**
     * Insert or replace a session.
     */
    void save(ReplaySession session);

    Optional<ReplaySession> findById(String sessionId);

    /**
     * All sessions, newest first.
     */
    List<ReplaySession> findAll();

    List<ReplaySession> findByStatus(ReplayStatus status);

    /**
     * Delete a session together with its results.
     * 
     * @return true if the session existed
     */
    boolean delete(String sessionId);

    /**
     * Append one per-event result.
     */
    void appendResult(ReplayEventResult result);

    /**
     * Results of a session ordered by order.
     */
    List<ReplayEventResult> findResults(String sessionId);
}
