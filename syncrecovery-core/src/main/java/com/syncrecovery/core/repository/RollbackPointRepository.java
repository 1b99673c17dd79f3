package com.syncrecovery.core.repository;

import com.syncrecovery.core.model.RollbackPoint;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for rollback points.
 */
public interface RollbackPointRepository {

    void save(RollbackPoint rollbackPoint);

    Optional<RollbackPoint> findById(String rollbackPointId);

    /**
     * Rollback points created by a replay session, oldest first.
     */
    List<RollbackPoint> findByOwner(String sessionId);

    /**
     * All rollback points, oldest first.
     */
    List<RollbackPoint> findAll();

    /**
     * Rollback points whose expiry is at or before the given time.
     */
    List<RollbackPoint> findExpired(Instant now, int limit);

    /**
     * @return true if the rollback point existed
     */
    boolean delete(String rollbackPointId);
}
