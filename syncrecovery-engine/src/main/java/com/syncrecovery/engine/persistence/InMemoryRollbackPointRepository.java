package com.syncrecovery.engine.persistence;

import com.syncrecovery.core.model.RollbackPoint;
import com.syncrecovery.core.repository.RollbackPointRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of RollbackPointRepository.
 */
@Repository
@ConditionalOnProperty(name = "syncrecovery.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryRollbackPointRepository implements RollbackPointRepository {

    private static final Comparator<RollbackPoint> OLDEST_FIRST =
        Comparator.comparing(RollbackPoint::createdAt).thenComparing(RollbackPoint::id);

    private final Map<String, RollbackPoint> points = new ConcurrentHashMap<>();

    @Override
    public void save(RollbackPoint rollbackPoint) {
        points.put(rollbackPoint.id(), rollbackPoint);
    }

    @Override
    public Optional<RollbackPoint> findById(String rollbackPointId) {
        return Optional.ofNullable(points.get(rollbackPointId));
    }

    @Override
    public List<RollbackPoint> findByOwner(String sessionId) {
        return points.values().stream()
            .filter(p -> p.isOwnedBy(sessionId))
            .sorted(OLDEST_FIRST)
            .collect(Collectors.toList());
    }

    @Override
    public List<RollbackPoint> findAll() {
        return points.values().stream()
            .sorted(OLDEST_FIRST)
            .collect(Collectors.toList());
    }

    @Override
    public List<RollbackPoint> findExpired(Instant now, int limit) {
        return points.values().stream()
            .filter(p -> p.isExpired(now))
            .sorted(Comparator.comparing(RollbackPoint::expiresAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String rollbackPointId) {
        return points.remove(rollbackPointId) != null;
    }
}
