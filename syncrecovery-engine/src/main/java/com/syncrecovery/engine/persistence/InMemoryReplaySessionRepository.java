package com.syncrecovery.engine.persistence;

import com.syncrecovery.core.model.ReplayEventResult;
import com.syncrecovery.core.model.ReplaySession;
import com.syncrecovery.core.model.ReplayStatus;
import com.syncrecovery.core.repository.ReplaySessionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ReplaySessionRepository.
 */
@Repository
@ConditionalOnProperty(name = "syncrecovery.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryReplaySessionRepository implements ReplaySessionRepository {

    private static final Comparator<ReplaySession> NEWEST_FIRST =
        Comparator.comparing(ReplaySession::createdAt).thenComparing(ReplaySession::id).reversed();

    private final Map<String, ReplaySession> sessions = new ConcurrentHashMap<>();
    private final Map<String, List<ReplayEventResult>> results = new ConcurrentHashMap<>();

    @Override
    public void save(ReplaySession session) {
        sessions.put(session.id(), session);
    }

    @Override
    public Optional<ReplaySession> findById(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public List<ReplaySession> findAll() {
        return sessions.values().stream()
            .sorted(NEWEST_FIRST)
            .collect(Collectors.toList());
    }

    @Override
    public List<ReplaySession> findByStatus(ReplayStatus status) {
        return sessions.values().stream()
            .filter(s -> s.status() == status)
            .sorted(NEWEST_FIRST)
            .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String sessionId) {
        results.remove(sessionId);
        return sessions.remove(sessionId) != null;
    }

    @Override
    public void appendResult(ReplayEventResult result) {
        List<ReplayEventResult> list = results.computeIfAbsent(result.sessionId(), k -> new ArrayList<>());
        synchronized (list) {
            list.add(result);
        }
    }

    @Override
    public List<ReplayEventResult> findResults(String sessionId) {
        List<ReplayEventResult> list = results.get(sessionId);
        if (list == null) {
            return List.of();
        }
        synchronized (list) {
            return list.stream()
                .sorted(Comparator.comparingInt(ReplayEventResult::order))
                .collect(Collectors.toList());
        }
    }
}
