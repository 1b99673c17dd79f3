package com.syncrecovery.recovery.events;

import com.syncrecovery.core.model.FailureClassification;
import com.syncrecovery.core.model.FailureSeverity;
import com.syncrecovery.core.model.FailureType;
import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.engine.metrics.SyncRecoveryMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Recovery event bus")
class RecoveryEventBusTest {

    private final SyncRecoveryMetrics metrics = new SyncRecoveryMetrics();
    private RecoveryEventBus bus;

    @AfterEach
    void tearDown() {
        if (bus != null) {
            bus.stop();
        }
    }

    private static FailureClassification classification(String operationId) {
        return new FailureClassification(operationId, FailureType.NETWORK_ERROR, FailureSeverity.MEDIUM, true,
            RecoveryAction.RETRY, Duration.ofSeconds(5), Map.of());
    }

    @Test
    @DisplayName("Notifications are delivered on the dispatcher thread")
    void testDelivery() throws InterruptedException {
        bus = new RecoveryEventBus(16, metrics);
        CountDownLatch delivered = new CountDownLatch(1);
        List<String> threads = new CopyOnWriteArrayList<>();
        bus.addObserver(new RecoveryObserver() {
            @Override
            public void onFailureDetected(FailureClassification classification) {
                threads.add(Thread.currentThread().getName());
                delivered.countDown();
            }
        });
        bus.start();

        assertThat(bus.failureDetected(classification("op-1"))).isTrue();

        assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(threads).containsExactly("recovery-event-bus");
    }

    @Test
    @DisplayName("A full queue drops and counts notifications")
    void testDropWhenFull() {
        bus = new RecoveryEventBus(1, metrics);
        bus.addObserver(new RecoveryObserver() {});

        assertThat(bus.failureDetected(classification("op-1"))).isTrue();
        assertThat(bus.failureDetected(classification("op-2"))).isFalse();
        assertThat(bus.failureDetected(classification("op-3"))).isFalse();

        assertThat(bus.droppedCount()).isEqualTo(2);
        assertThat(bus.pendingCount()).isEqualTo(1);
        assertThat(metrics.counterValue(SyncRecoveryMetrics.EVENTBUS_DROPPED, "event_type", "FAILURE_DETECTED"))
            .isEqualTo(2.0);
    }

    @Test
    @DisplayName("A failing observer does not keep others from being notified")
    void testObserverIsolation() throws InterruptedException {
        bus = new RecoveryEventBus(16, metrics);
        CountDownLatch delivered = new CountDownLatch(2);
        bus.addObserver(new RecoveryObserver() {
            @Override
            public void onRecoveryCompleted(RecoveryResult result) {
                throw new IllegalStateException("chat-ops webhook down");
            }
        });
        bus.addObserver(new RecoveryObserver() {
            @Override
            public void onRecoveryCompleted(RecoveryResult result) {
                delivered.countDown();
            }
        });
        bus.start();

        RecoveryResult result = RecoveryResult.success(RecoveryAction.RETRY, Duration.ZERO, "ok", Map.of());
        bus.recoveryCompleted(result);
        bus.recoveryCompleted(result);

        assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Stopping delivers what is already queued")
    void testStopDrains() {
        bus = new RecoveryEventBus(16, metrics);
        List<String> received = new CopyOnWriteArrayList<>();
        bus.addObserver(new RecoveryObserver() {
            @Override
            public void onFailureDetected(FailureClassification classification) {
                received.add(classification.operationId());
            }
        });
        bus.failureDetected(classification("op-1"));
        bus.failureDetected(classification("op-2"));

        bus.start();
        bus.stop();

        assertThat(received).containsExactly("op-1", "op-2");
        assertThat(bus.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Without observers nothing is queued")
    void testNoObservers() {
        bus = new RecoveryEventBus(1, metrics);

        bus.failureDetected(classification("op-1"));
        bus.failureDetected(classification("op-2"));

        assertThat(bus.pendingCount()).isZero();
        assertThat(bus.droppedCount()).isZero();
    }
}
