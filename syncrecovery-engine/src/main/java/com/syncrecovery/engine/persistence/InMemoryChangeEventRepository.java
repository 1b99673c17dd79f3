package com.syncrecovery.engine.persistence;

import com.syncrecovery.core.exception.InvalidRequestException;
import com.syncrecovery.core.model.ChangeEvent;
import com.syncrecovery.core.model.EventFilter;
import com.syncrecovery.core.model.EventProcessing;
import com.syncrecovery.core.model.EventSeverity;
import com.syncrecovery.core.repository.ChangeEventRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of ChangeEventRepository.
 * Default store for development and tests.
 */
@Repository
@ConditionalOnProperty(name = "syncrecovery.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryChangeEventRepository implements ChangeEventRepository {

    private final Map<String, ChangeEvent> events = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);

    @Override
    public ChangeEvent append(ChangeEvent event) {
        ChangeEvent stored = event.withSequence(sequence.incrementAndGet());
        if (events.putIfAbsent(stored.id(), stored) != null) {
            throw new InvalidRequestException("Duplicate change event id: " + event.id());
        }
        return stored;
    }

    @Override
    public Optional<ChangeEvent> findById(String eventId) {
        return Optional.ofNullable(events.get(eventId));
    }

    @Override
    public List<ChangeEvent> find(EventFilter filter) {
        return page(events.values().stream().filter(filter::matches), filter);
    }

    @Override
    public long count(EventFilter filter) {
        return events.values().stream().filter(filter::matches).count();
    }

    @Override
    public List<ChangeEvent> search(String text, EventFilter filter) {
        String needle = text == null ? "" : text.toLowerCase(Locale.ROOT);
        return page(events.values().stream()
            .filter(filter::matches)
            .filter(e -> searchableText(e).contains(needle)), filter);
    }

    @Override
    public boolean updateProcessing(String eventId, EventProcessing processing) {
        return events.computeIfPresent(eventId, (id, e) -> e.withProcessing(processing)) != null;
    }

    @Override
    public int deleteBySeverityOlderThan(EventSeverity severity, Instant cutoff) {
        List<String> expired = events.values().stream()
            .filter(e -> e.severity() == severity && e.timestamp().isBefore(cutoff))
            .map(ChangeEvent::id)
            .collect(Collectors.toList());
        int deleted = 0;
        for (String id : expired) {
            if (events.remove(id) != null) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public int deleteOldest(int count) {
        if (count <= 0) {
            return 0;
        }
        List<String> oldest = events.values().stream()
            .sorted(ChangeEvent.CHRONOLOGICAL)
            .limit(count)
            .map(ChangeEvent::id)
            .collect(Collectors.toList());
        int deleted = 0;
        for (String id : oldest) {
            if (events.remove(id) != null) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public long countAll() {
        return events.size();
    }

    private List<ChangeEvent> page(Stream<ChangeEvent> matching, EventFilter filter) {
        Stream<ChangeEvent> sorted = matching.sorted(filter.sort().comparator());
        if (filter.pagination() != null) {
            sorted = sorted.skip(filter.pagination().offset()).limit(filter.pagination().limit());
        }
        return sorted.collect(Collectors.toList());
    }

    private static String searchableText(ChangeEvent event) {
        return String.join("|",
            event.id(),
            event.type().name(),
            event.source().name(),
            String.valueOf(event.data()),
            String.valueOf(event.metadata())
        ).toLowerCase(Locale.ROOT);
    }
}
