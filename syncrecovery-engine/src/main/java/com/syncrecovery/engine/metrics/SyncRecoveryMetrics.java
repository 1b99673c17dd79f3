package com.syncrecovery.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for the change log, replay engine and recovery manager.
 *
 * Metrics exposed:
 * - Failures detected by type and severity
 * - Recovery attempts, outcomes and durations per strategy
 * - Change events appended and cleaned up
 * - Replay sessions by status and replayed events by outcome
 * - Observer notifications dropped by the event bus
 */
public class SyncRecoveryMetrics implements MeterBinder {

    // Metric names
    public static final String FAILURES_DETECTED = "syncrecovery.failures.detected";
    public static final String RECOVERY_ATTEMPTS = "syncrecovery.recovery.attempts";
    public static final String RECOVERY_COMPLETED = "syncrecovery.recovery.completed";
    public static final String RECOVERY_DURATION = "syncrecovery.recovery.duration";
    public static final String MANUAL_INTERVENTIONS = "syncrecovery.manual_interventions";

    public static final String EVENTS_APPENDED = "syncrecovery.events.appended";
    public static final String EVENTS_CLEANED = "syncrecovery.events.cleaned";

    public static final String REPLAY_SESSIONS = "syncrecovery.replay.sessions";
    public static final String REPLAY_EVENTS = "syncrecovery.replay.events";

    public static final String EVENTBUS_DROPPED = "syncrecovery.eventbus.dropped";

    // Replaced when bound to the application registry
    private MeterRegistry registry = new SimpleMeterRegistry();

    private final ConcurrentHashMap<String, AtomicInteger> replayStatusGauges = new ConcurrentHashMap<>();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        for (String status : new String[]{"PENDING", "RUNNING", "COMPLETED", "FAILED", "CANCELLED"}) {
            AtomicInteger gauge = replayStatusGauges.computeIfAbsent(status, s -> new AtomicInteger(0));
            Gauge.builder(REPLAY_SESSIONS, gauge, AtomicInteger::get)
                .tag("status", status)
                .description("Number of replay sessions in " + status + " status")
                .register(registry);
        }
    }

    // ========== Failure & Recovery Metrics ==========

    public void failureDetected(String failureType, String severity) {
        Counter.builder(FAILURES_DETECTED)
            .tag("failure_type", failureType)
            .tag("severity", severity)
            .description("Total sync failures classified")
            .register(registry)
            .increment();
    }

    public void recoveryAttempted(String strategy) {
        Counter.builder(RECOVERY_ATTEMPTS)
            .tag("strategy", strategy)
            .description("Total recovery strategy executions")
            .register(registry)
            .increment();
    }

    public void recoveryCompleted(String strategy, boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        Counter.builder(RECOVERY_COMPLETED)
            .tag("strategy", strategy)
            .tag("outcome", outcome)
            .description("Total recovery strategy executions finished")
            .register(registry)
            .increment();

        Timer.builder(RECOVERY_DURATION)
            .tag("strategy", strategy)
            .tag("outcome", outcome)
            .description("Recovery strategy execution duration")
            .register(registry)
            .record(duration);
    }

    public void manualInterventionRequired(String failureType) {
        Counter.builder(MANUAL_INTERVENTIONS)
            .tag("failure_type", failureType)
            .description("Total failures handed over to an operator")
            .register(registry)
            .increment();
    }

    // ========== Change Log Metrics ==========

    public void eventAppended(String type) {
        Counter.builder(EVENTS_APPENDED)
            .tag("type", type)
            .description("Total change events appended")
            .register(registry)
            .increment();
    }

    public void eventsCleaned(int count) {
        Counter.builder(EVENTS_CLEANED)
            .description("Total change events removed by retention")
            .register(registry)
            .increment(count);
    }

    // ========== Replay Metrics ==========

    public void replayEvent(String status) {
        Counter.builder(REPLAY_EVENTS)
            .tag("status", status)
            .description("Total replayed events by outcome")
            .register(registry)
            .increment();
    }

    public void replayStatusChanged(String from, String to) {
        if (from != null) {
            replayStatusGauges.computeIfAbsent(from, s -> new AtomicInteger(0))
                .updateAndGet(v -> Math.max(0, v - 1));
        }
        if (to != null) {
            replayStatusGauges.computeIfAbsent(to, s -> new AtomicInteger(0)).incrementAndGet();
        }
    }

    // ========== Event Bus Metrics ==========

    public void eventBusDropped(String eventType) {
        Counter.builder(EVENTBUS_DROPPED)
            .tag("event_type", eventType)
            .description("Observer notifications dropped because the queue was full")
            .register(registry)
            .increment();
    }

    /**
     * Current value of a counter, 0 when it was never incremented.
     */
    public double counterValue(String name, String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0.0;
    }
}
