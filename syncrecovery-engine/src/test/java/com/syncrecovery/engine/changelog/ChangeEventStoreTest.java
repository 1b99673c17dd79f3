package com.syncrecovery.engine.changelog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncrecovery.core.exception.NotFoundException;
import com.syncrecovery.core.model.ChangeEvent;
import com.syncrecovery.core.model.ChangeEventType;
import com.syncrecovery.core.model.EventFilter;
import com.syncrecovery.core.model.EventSeverity;
import com.syncrecovery.core.model.EventSort;
import com.syncrecovery.core.model.EventSource;
import com.syncrecovery.core.model.Pagination;
import com.syncrecovery.core.test.TimeController;
import com.syncrecovery.engine.metrics.SyncRecoveryMetrics;
import com.syncrecovery.engine.persistence.InMemoryChangeEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Change Event Store")
class ChangeEventStoreTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private TimeController clock;
    private SyncRecoveryMetrics metrics;
    private ChangeEventStore store;

    @BeforeEach
    void setUp() {
        clock = new TimeController(START);
        metrics = new SyncRecoveryMetrics();
        store = newStore(10_000);
    }

    private ChangeEventStore newStore(int maxTotalEvents) {
        RetentionPolicy policy = new RetentionPolicy(30, maxTotalEvents, Map.of(
            EventSeverity.DEBUG, 7,
            EventSeverity.INFO, 30,
            EventSeverity.WARNING, 90,
            EventSeverity.ERROR, 180,
            EventSeverity.CRITICAL, 365));
        return new ChangeEventStore(new InMemoryChangeEventRepository(), objectMapper, clock, metrics, policy);
    }

    private ChangeEvent event(ChangeEventType type, EventSeverity severity, Instant timestamp, Object data) {
        return ChangeEvent.builder()
            .type(type)
            .severity(severity)
            .source(EventSource.SYNC_MANAGER)
            .timestamp(timestamp)
            .projectId("proj-1")
            .data(objectMapper.valueToTree(data))
            .build();
    }

    // ========== Append ==========

    @Test
    @DisplayName("Append stamps version, tags and checksum")
    void testAppendStampsMetadata() {
        String id = store.append(event(ChangeEventType.FILE_CHANGE, EventSeverity.INFO, START, Map.of("path", "a.txt")));

        ChangeEvent stored = store.getEvent(id);
        assertThat(stored.metadataText(ChangeEvent.METADATA_VERSION)).isEqualTo(ChangeEvent.SCHEMA_VERSION);
        assertThat(stored.metadata().get(ChangeEvent.METADATA_TAGS).isArray()).isTrue();
        assertThat(stored.checksum()).hasSize(64);
        assertThat(stored.verifyChecksum()).isTrue();
        assertThat(stored.sequence()).isPositive();
        assertThat(metrics.counterValue(SyncRecoveryMetrics.EVENTS_APPENDED, "type", "FILE_CHANGE")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Events without a timestamp get the store clock")
    void testAppendFillsTimestamp() {
        ChangeEvent event = new ChangeEvent(null, 0, ChangeEventType.SYSTEM_EVENT, EventSeverity.INFO,
            EventSource.SYSTEM, null, null, null, null, null, null,
            objectMapper.createObjectNode(), null, null);

        String id = store.append(event);

        assertThat(id).startsWith("evt_" + START.toEpochMilli());
        assertThat(store.getEvent(id).timestamp()).isEqualTo(START);
    }

    @Test
    @DisplayName("Unknown event id raises NotFoundException")
    void testGetUnknownEvent() {
        assertThatThrownBy(() -> store.getEvent("evt_missing"))
            .isInstanceOf(NotFoundException.class);
    }

    // ========== Queries ==========

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Equal timestamps keep append order in both directions")
        void testStableOrderForEqualTimestamps() {
            List<String> ids = store.appendAll(List.of(
                event(ChangeEventType.DB_CHANGE, EventSeverity.INFO, START, Map.of("n", 1)),
                event(ChangeEventType.DB_CHANGE, EventSeverity.INFO, START, Map.of("n", 2)),
                event(ChangeEventType.DB_CHANGE, EventSeverity.INFO, START, Map.of("n", 3))));

            List<String> ascending = store.query(EventFilter.all().withSort(EventSort.oldestFirst()))
                .stream().map(ChangeEvent::id).toList();
            List<String> descending = store.query(EventFilter.all())
                .stream().map(ChangeEvent::id).toList();

            assertThat(ascending).containsExactlyElementsOf(ids);
            assertThat(descending).containsExactly(ids.get(2), ids.get(1), ids.get(0));
        }

        @Test
        @DisplayName("Filters and pagination are applied together")
        void testFilterAndPagination() {
            for (int i = 0; i < 5; i++) {
                store.append(event(ChangeEventType.FILE_CHANGE, EventSeverity.INFO, START.plusSeconds(i), Map.of("i", i)));
            }
            store.append(event(ChangeEventType.DB_CHANGE, EventSeverity.ERROR, START.plusSeconds(10), Map.of()));

            EventFilter fileEvents = EventFilter.builder()
                .eventTypes(ChangeEventType.FILE_CHANGE)
                .sort(EventSort.oldestFirst())
                .pagination(new Pagination(1, 2))
                .build();

            List<ChangeEvent> page = store.query(fileEvents);
            assertThat(page).hasSize(2);
            assertThat(page).extracting(e -> e.data().get("i").asInt()).containsExactly(1, 2);
            assertThat(store.count(fileEvents.withoutPagination())).isEqualTo(5);
        }

        @Test
        @DisplayName("Search matches payload text case-insensitively")
        void testSearch() {
            store.append(event(ChangeEventType.FILE_CHANGE, EventSeverity.INFO, START, Map.of("path", "Docs/Readme.MD")));
            store.append(event(ChangeEventType.FILE_CHANGE, EventSeverity.INFO, START, Map.of("path", "src/main.java")));

            assertThat(store.search("readme", null)).hasSize(1);
            assertThat(store.search("  ", null)).hasSize(2);
        }
    }

    // ========== Statistics ==========

    @Test
    @DisplayName("Statistics group by type, severity and hour")
    void testStatistics() {
        store.append(event(ChangeEventType.FILE_CHANGE, EventSeverity.INFO, START, Map.of()));
        store.append(event(ChangeEventType.FILE_CHANGE, EventSeverity.ERROR, START.plusSeconds(60), Map.of()));
        store.append(event(ChangeEventType.DB_CHANGE, EventSeverity.INFO, START.plus(Duration.ofHours(2)), Map.of()));

        EventStatistics stats = store.statistics(null);

        assertThat(stats.totalEvents()).isEqualTo(3);
        assertThat(stats.eventsByType()).containsEntry(ChangeEventType.FILE_CHANGE, 2L)
            .containsEntry(ChangeEventType.DB_CHANGE, 1L);
        assertThat(stats.eventsBySeverity()).containsEntry(EventSeverity.ERROR, 1L);
        assertThat(stats.timeline()).extracting(TimelineBucket::count).containsExactly(2L, 1L);
        assertThat(stats.timeline().get(0).bucketStart()).isEqualTo(START);
        assertThat(stats.earliest()).isEqualTo(START);
        assertThat(stats.latest()).isEqualTo(START.plus(Duration.ofHours(2)));
    }

    // ========== Export ==========

    @Nested
    @DisplayName("Export")
    class Export {

        @Test
        @DisplayName("CSV quotes fields containing separators")
        void testCsvExport() {
            ChangeEvent event = event(ChangeEventType.FILE_CHANGE, EventSeverity.INFO, START, Map.of())
                .toBuilder().projectId("proj,\"x\"").build();
            store.append(event);

            String csv = store.export(null, ExportFormat.CSV);

            String[] lines = csv.split("\n");
            assertThat(lines[0]).isEqualTo("id,type,severity,source,timestamp,projectId");
            assertThat(lines[1]).endsWith(",FILE_CHANGE,INFO,SYNC_MANAGER,2024-03-01T10:00:00Z,\"proj,\"\"x\"\"\"");
        }

        @Test
        @DisplayName("SQL export emits one escaped INSERT per event")
        void testSqlExport() {
            store.append(event(ChangeEventType.DB_CHANGE, EventSeverity.INFO, START, Map.of("name", "O'Brien")));
            store.append(event(ChangeEventType.DB_CHANGE, EventSeverity.INFO, START, Map.of("name", "plain")));

            String sql = store.export(null, ExportFormat.SQL);

            assertThat(sql.lines()).hasSize(2).allMatch(line -> line.startsWith("INSERT INTO change_events"));
            assertThat(sql).contains("O''Brien");
        }

        @Test
        @DisplayName("JSON export can be read back")
        void testJsonExport() throws Exception {
            store.append(event(ChangeEventType.SYSTEM_EVENT, EventSeverity.INFO, START, Map.of("k", "v")));

            String json = store.export(null, ExportFormat.JSON);

            var tree = objectMapper.readTree(json);
            assertThat(tree.isArray()).isTrue();
            assertThat(tree.get(0).get("type").asText()).isEqualTo("SYSTEM_EVENT");
        }
    }

    // ========== Retention ==========

    @Nested
    @DisplayName("Retention")
    class Retention {

        @Test
        @DisplayName("Cleanup removes only events outside their severity window")
        void testSeverityWindows() {
            String oldDebug = store.append(event(ChangeEventType.SYSTEM_EVENT, EventSeverity.DEBUG, START, Map.of()));
            String oldInfo = store.append(event(ChangeEventType.SYSTEM_EVENT, EventSeverity.INFO, START, Map.of()));
            String oldError = store.append(event(ChangeEventType.SYSTEM_EVENT, EventSeverity.ERROR, START, Map.of()));

            clock.advanceDays(10);
            assertThat(store.cleanup()).isEqualTo(1);
            assertThat(store.findEvent(oldDebug)).isEmpty();
            assertThat(store.findEvent(oldInfo)).isPresent();

            clock.advanceDays(25);
            assertThat(store.cleanup()).isEqualTo(1);
            assertThat(store.findEvent(oldInfo)).isEmpty();
            assertThat(store.findEvent(oldError)).isPresent();
        }

        @Test
        @DisplayName("Cap evicts the oldest events first")
        void testTotalCap() {
            ChangeEventStore capped = newStore(3);
            List<String> ids = capped.appendAll(List.of(
                event(ChangeEventType.DB_CHANGE, EventSeverity.CRITICAL, START, Map.of()),
                event(ChangeEventType.DB_CHANGE, EventSeverity.CRITICAL, START.plusSeconds(1), Map.of()),
                event(ChangeEventType.DB_CHANGE, EventSeverity.CRITICAL, START.plusSeconds(2), Map.of()),
                event(ChangeEventType.DB_CHANGE, EventSeverity.CRITICAL, START.plusSeconds(3), Map.of()),
                event(ChangeEventType.DB_CHANGE, EventSeverity.CRITICAL, START.plusSeconds(4), Map.of())));

            assertThat(capped.cleanup()).isEqualTo(2);
            assertThat(capped.countAll()).isEqualTo(3);
            assertThat(capped.findEvent(ids.get(0))).isEmpty();
            assertThat(capped.findEvent(ids.get(1))).isEmpty();
            assertThat(capped.findEvent(ids.get(2))).isPresent();
            assertThat(metrics.counterValue(SyncRecoveryMetrics.EVENTS_CLEANED)).isEqualTo(2.0);
        }
    }
}
