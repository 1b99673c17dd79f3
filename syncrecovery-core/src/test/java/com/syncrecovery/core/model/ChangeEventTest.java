package com.syncrecovery.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncrecovery.core.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ChangeEventTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Generated ids carry the timestamp and a random suffix")
    void testIdFormat() {
        Instant ts = Instant.ofEpochMilli(1_700_000_000_000L);
        ChangeEvent event = ChangeEvent.builder()
            .type(ChangeEventType.FILE_CHANGE)
            .timestamp(ts)
            .build();

        assertThat(event.id()).matches("evt_1700000000000_[0-9a-f]{8}");
        assertThat(event.processing().status()).isEqualTo(ProcessingStatus.PENDING);
    }

    @Test
    @DisplayName("Checksum detects payload changes")
    void testChecksum() {
        Instant ts = Instant.parse("2024-03-01T10:00:00Z");
        var data = objectMapper.valueToTree(Map.of("path", "a.txt"));
        String checksum = ChangeEvent.computeChecksum(ChangeEventType.FILE_CHANGE, data, ts);

        assertThat(checksum).hasSize(64);
        assertThat(ChangeEvent.computeChecksum(ChangeEventType.FILE_CHANGE, data, ts)).isEqualTo(checksum);
        assertThat(ChangeEvent.computeChecksum(ChangeEventType.DB_CHANGE, data, ts)).isNotEqualTo(checksum);
    }

    @Test
    @DisplayName("Declared dependencies are read back from metadata")
    void testDependsOn() {
        ChangeEvent event = ChangeEvent.builder()
            .type(ChangeEventType.DB_CHANGE)
            .dependsOn("evt_1", "evt_2")
            .build();

        assertThat(event.dependsOn()).containsExactly("evt_1", "evt_2");
    }

    @Test
    @DisplayName("Filter ignores null references instead of failing")
    void testFilterWithNullReferences() {
        ChangeEvent event = ChangeEvent.builder().type(ChangeEventType.SYSTEM_EVENT).build();

        assertThat(EventFilter.builder().projectIds(Set.of("p1")).build().matches(event)).isFalse();
        assertThat(EventFilter.all().matches(event)).isTrue();
    }

    @Test
    @DisplayName("Processing marker rejects backwards transitions")
    void testProcessingTransitions() {
        EventProcessing pending = EventProcessing.pending();
        EventProcessing processing = pending.transitionTo(ProcessingStatus.PROCESSING, Instant.now(), null);
        EventProcessing failed = processing.transitionTo(ProcessingStatus.FAILED, Instant.now(), "boom");
        EventProcessing retried = failed.transitionTo(ProcessingStatus.PROCESSING, Instant.now(), null);

        assertThat(failed.error()).isEqualTo("boom");
        assertThat(retried.retryCount()).isEqualTo(1);
        assertThatThrownBy(() -> pending.transitionTo(ProcessingStatus.COMPLETED, Instant.now(), null))
            .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("Critical classifications cannot be recoverable")
    void testCriticalClassificationInvariant() {
        assertThatThrownBy(() -> new FailureClassification("op-1", FailureType.DATA_CORRUPTION,
                FailureSeverity.CRITICAL, true, RecoveryAction.RETRY, null, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
