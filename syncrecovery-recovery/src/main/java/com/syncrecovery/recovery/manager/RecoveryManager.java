package com.syncrecovery.recovery.manager;

import com.syncrecovery.core.model.BackupFilter;
import com.syncrecovery.core.model.BackupInfo;
import com.syncrecovery.core.model.BackupType;
import com.syncrecovery.core.model.EventSeverity;
import com.syncrecovery.core.model.FailureClassification;
import com.syncrecovery.core.model.FailureType;
import com.syncrecovery.core.model.NetworkStatus;
import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.RecoveryContext;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.core.model.RollbackPoint;
import com.syncrecovery.core.model.SyncError;
import com.syncrecovery.core.model.SyncOperation;
import com.syncrecovery.core.model.SystemState;
import com.syncrecovery.core.spi.BackupManager;
import com.syncrecovery.core.spi.SystemStateProvider;
import com.syncrecovery.engine.changelog.ChangeLogger;
import com.syncrecovery.engine.classification.FailureClassifier;
import com.syncrecovery.engine.concurrent.InFlightRegistry;
import com.syncrecovery.engine.logging.LoggingContext;
import com.syncrecovery.engine.metrics.SyncRecoveryMetrics;
import com.syncrecovery.engine.rollback.RollbackPointService;
import com.syncrecovery.recovery.events.RecoveryEvent;
import com.syncrecovery.recovery.events.RecoveryEventBus;
import com.syncrecovery.recovery.events.RecoveryEventHistory;
import com.syncrecovery.recovery.events.RecoveryEventType;
import com.syncrecovery.recovery.events.RecoveryObserver;
import com.syncrecovery.recovery.strategy.RecoveryStrategy;
import com.syncrecovery.recovery.strategy.RecoveryStrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrates recovery of failed sync operations.
 *
 * Responsibilities:
 * - Classify reported failures and record them
 * - Run the selected strategy behind a rollback point, at most once per operation at a time
 * - Escalate critical failures to manual intervention after an emergency backup
 * - Keep statistics, an event history and a status report
 * - Run the backup, health check and cleanup loops
 */
public class RecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(RecoveryManager.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final int RECENT_FAILURES = 10;
    private static final Duration FULL_BACKUP_MAX_AGE = Duration.ofDays(7);

    static final long LOW_DISK_BYTES = 10 * SystemState.GIGABYTE;
    static final double HIGH_USAGE = 0.9;

    private final FailureClassifier classifier;
    private final RecoveryStrategyFactory strategyFactory;
    private final RollbackPointService rollbackPoints;
    private final BackupManager backupManager;
    private final SystemStateProvider systemStateProvider;
    private final ChangeLogger changeLogger;
    private final RecoveryEventBus eventBus;
    private final SyncRecoveryMetrics metrics;
    private final Clock clock;
    private final RecoverySettings settings;

    private final InFlightRegistry<String, RecoveryResult> inFlight = new InFlightRegistry<>("recovery");
    private final RecoveryStatisticsTracker statistics = new RecoveryStatisticsTracker();
    private final RecoveryEventHistory history;

    private ScheduledExecutorService scheduler;
    private ExecutorService workers;
    private volatile boolean running = false;

    public RecoveryManager(
            FailureClassifier classifier,
            RecoveryStrategyFactory strategyFactory,
            RollbackPointService rollbackPoints,
            BackupManager backupManager,
            SystemStateProvider systemStateProvider,
            ChangeLogger changeLogger,
            RecoveryEventBus eventBus,
            SyncRecoveryMetrics metrics,
            Clock clock,
            RecoverySettings settings) {
        this.classifier = classifier;
        this.strategyFactory = strategyFactory;
        this.rollbackPoints = rollbackPoints;
        this.backupManager = backupManager;
        this.systemStateProvider = systemStateProvider;
        this.changeLogger = changeLogger;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = settings;
        this.history = new RecoveryEventHistory(settings.eventHistorySize());
    }

    // ========== Lifecycle ==========

    /**
     * Start the event bus, the recovery workers and the background loops.
     */
    public synchronized void initialize() {
        if (running) {
            log.warn("Recovery manager already initialized");
            return;
        }

        eventBus.start();
        workers = Executors.newFixedThreadPool(Math.max(1, settings.workerThreads()), daemonThreads("recovery-worker-"));
        scheduler = Executors.newScheduledThreadPool(3, daemonThreads("recovery-loop-"));
        running = true;

        if (settings.autoBackup()) {
            schedule(this::backupLoop, settings.backupInterval());
        }
        schedule(this::healthCheckLoop, settings.healthCheckInterval());
        schedule(this::cleanupLoop, settings.cleanupInterval());

        cleanupLoop();
        log.info("Recovery manager initialized (autoRecovery={}, autoBackup={}, workers={})",
            settings.enableAutoRecovery(), settings.autoBackup(), settings.workerThreads());
    }

    /**
     * Stop the loops, wait for in-flight recoveries and drain the event bus.
     */
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        running = false;

        awaitTermination(scheduler);
        awaitTermination(workers);
        eventBus.stop();
        log.info("Recovery manager stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void schedule(Runnable loop, Duration interval) {
        long millis = Math.max(1, interval.toMillis());
        scheduler.scheduleWithFixedDelay(loop, millis, millis, TimeUnit.MILLISECONDS);
    }

    private void awaitTermination(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void ensureRunning() {
        if (!running) {
            throw new IllegalStateException("Recovery manager not initialized");
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ========== Failure Handling ==========

    /**
     * Entry point for the sync subsystem when an operation fails.
     *
     * Recoverable failures start an asynchronous recovery when auto-recovery
     * is enabled; critical ones go straight to manual intervention.
     *
     * @return The classification the decision was based on
     */
    public FailureClassification handleSyncFailure(SyncOperation operation, SyncError error) {
        ensureRunning();
        SyncOperation failed = operation.withError(error);
        FailureClassification classification = classifier.classify(failed, error);

        try (LoggingContext ctx = LoggingContext.forOperation(operation.id(), classification.failureType().name())) {
            log.warn("Sync failure on {} classified as {} ({}), recommended {}",
                operation.tableName(), classification.failureType(), classification.severity(),
                classification.recommendedAction());

            statistics.failureDetected(classification.failureType());
            metrics.failureDetected(classification.failureType().name(), classification.severity().name());
            history.record(RecoveryEvent.failureDetected(classification, error, clock.instant()));
            logDetection(failed, classification, error);
            eventBus.failureDetected(classification);

            if (classification.isCritical()) {
                handleCriticalFailure(failed, classification);
            } else if (settings.enableAutoRecovery() && classification.recoverable()) {
                attemptRecovery(failed, classification).whenComplete((result, e) -> {
                    if (e != null) {
                        log.error("Recovery of operation {} did not complete", operation.id(), e);
                    }
                });
            } else {
                log.info("No automatic recovery for operation {} (recoverable={}, autoRecovery={})",
                    operation.id(), classification.recoverable(), settings.enableAutoRecovery());
            }
        }
        return classification;
    }

    /**
     * Run one recovery attempt. A caller arriving while a recovery of the same
     * operation is in flight gets that recovery's future.
     */
    public CompletableFuture<RecoveryResult> attemptRecovery(SyncOperation operation,
                                                             FailureClassification classification) {
        ensureRunning();
        return inFlight.runExclusive(operation.id(),
            () -> CompletableFuture.supplyAsync(() -> runRecovery(operation, classification), workers));
    }

    private RecoveryResult runRecovery(SyncOperation operation, FailureClassification classification) {
        try (LoggingContext ctx = LoggingContext.forOperation(operation.id(), classification.failureType().name())) {
            Instant started = clock.instant();
            int previousAttempts = operation.retryCount();
            SyncOperation attempt = operation.withRetry();

            RollbackPoint point = createRollbackPoint(attempt);
            String strategyName = "none";
            RecoveryResult result;
            try {
                SystemState state = systemStateProvider.snapshot().withQueueSize(inFlight.size());
                RecoveryContext context = new RecoveryContext(attempt, classification, previousAttempts,
                    latestBackup(attempt.tableName()), state);

                RecoveryStrategy strategy = strategyFactory.select(classification.failureType(), context);
                strategyName = strategy.name();
                log.info("Attempt {} with {}", attempt.retryCount(), strategyName);

                history.record(RecoveryEvent.recoveryStarted(classification, strategyName, clock.instant()));
                metrics.recoveryAttempted(strategyName);
                eventBus.recoveryStarted(context);

                result = strategy.execute(context);
            } catch (RuntimeException e) {
                log.error("Recovery attempt raised an unexpected error, rolling back", e);
                rollBack(point);
                result = unexpectedFailure(classification, e);
            }

            Instant finished = clock.instant();
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("strategy", strategyName);
            extra.put("attempt", attempt.retryCount());
            if (point != null) {
                extra.put("rollbackPointId", point.id());
            }
            result = result.withDuration(Duration.between(started, finished)).withMetadata(extra);

            if (result.success() && point != null) {
                rollbackPoints.discard(point.id());
            }
            recordOutcome(attempt, classification, strategyName, result, finished);
            return result;
        }
    }

    /**
     * Best effort: without a rollback point the attempt runs without rollback-on-failure.
     */
    private RollbackPoint createRollbackPoint(SyncOperation operation) {
        try {
            RollbackPoint point = rollbackPoints.create(
                "Rollback point for " + operation.id() + " on " + operation.tableName(),
                List.of(operation.id()),
                BackupType.INCREMENTAL,
                operation.tableName() != null ? List.of(operation.tableName()) : List.of(),
                settings.rollbackPointTtl(),
                null
            );
            eventBus.rollbackPointCreated(point);
            return point;
        } catch (RuntimeException e) {
            log.warn("Could not create rollback point, continuing without one: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Most recent backup of the table that no rollback point or replay
     * checkpoint holds, including this attempt's own.
     */
    private BackupInfo latestBackup(String table) {
        try {
            BackupFilter filter = table != null ? BackupFilter.forTable(table) : BackupFilter.all();
            for (BackupInfo backup : backupManager.listBackups(filter)) {
                if (!rollbackPoints.isRollbackBackup(backup.id())) {
                    return backup;
                }
            }
        } catch (RuntimeException e) {
            log.warn("Could not list backups for {}: {}", table, e.getMessage());
        }
        return null;
    }

    private void rollBack(RollbackPoint point) {
        if (point == null) {
            log.warn("No rollback point to restore");
            return;
        }
        try {
            rollbackPoints.restore(point.id());
            log.info("Rolled back to {}", point.id());
        } catch (RuntimeException e) {
            log.error("Rollback to {} failed", point.id(), e);
        }
    }

    private RecoveryResult unexpectedFailure(FailureClassification classification, RuntimeException e) {
        SyncError error = SyncError.of("RECOVERY_FAILED", String.valueOf(e.getMessage()), clock.instant(), false);
        return RecoveryResult.failure(classification.recommendedAction(), Duration.ZERO, error,
            RecoveryAction.MANUAL_INTERVENTION);
    }

    private void recordOutcome(SyncOperation operation, FailureClassification classification, String strategyName,
                               RecoveryResult result, Instant finished) {
        statistics.recoveryFinished(result, finished);
        metrics.recoveryCompleted(strategyName, result.success(), result.duration());
        history.record(RecoveryEvent.recoveryFinished(classification, result, finished));

        if (result.success()) {
            log.info("Recovery succeeded with {} in {}ms", result.action(), result.duration().toMillis());
        } else if (result.requiresManualIntervention()) {
            statistics.manualIntervention();
            metrics.manualInterventionRequired(classification.failureType().name());
            log.error("Recovery failed, manual intervention required: {}", result.message());
        } else {
            log.warn("Recovery failed with {}: {}", result.action(), result.message());
        }

        logOutcome(operation, classification, strategyName, result, finished);
        if (result.success()) {
            eventBus.recoveryCompleted(result);
        }
    }

    private void logOutcome(SyncOperation operation, FailureClassification classification, String strategyName,
                            RecoveryResult result, Instant finished) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recoveryId", "recovery_" + finished.toEpochMilli() + "_" + operation.id());
        payload.put("operationId", operation.id());
        payload.put("failureType", classification.failureType().name());
        payload.put("recoveryAction", result.action().name());
        payload.put("strategy", strategyName);
        payload.put("result", result.success() ? ChangeLogger.RESULT_SUCCESS : "FAILURE");
        payload.put("duration", result.duration().toMillis());
        payload.put("attempt", operation.retryCount());
        if (result.error() != null) {
            payload.put("error", Map.of("code", result.error().code(), "message", result.error().message()));
        }
        logChange(() -> changeLogger.logRecovery(payload, result.success() ? EventSeverity.INFO : EventSeverity.ERROR));
    }

    private void logDetection(SyncOperation operation, FailureClassification classification, SyncError error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recoveryId", "recovery_" + clock.millis() + "_" + operation.id());
        payload.put("operationId", operation.id());
        payload.put("failureType", classification.failureType().name());
        payload.put("recoveryAction", classification.recommendedAction().name());
        payload.put("strategy", "AUTO_DETECTION");
        payload.put("result", "PARTIAL");
        payload.put("duration", 0);
        payload.put("error", Map.of("code", String.valueOf(error.code()), "message", String.valueOf(error.message())));
        logChange(() -> changeLogger.logRecovery(payload, EventSeverity.WARNING));
    }

    /**
     * Change log writes never fail a recovery.
     */
    private void logChange(Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.error("Failed to write recovery change event", e);
        }
    }

    // ========== Critical Failures ==========

    /**
     * Escalate a critical failure: take an emergency full backup and record
     * it for manual action. No automated repair is attempted.
     */
    public void handleCriticalFailure(SyncOperation operation, FailureClassification classification) {
        statistics.manualIntervention();
        metrics.manualInterventionRequired(classification.failureType().name());
        log.error("Critical {} on operation {}, manual intervention required",
            classification.failureType(), operation.id());

        BackupInfo backup = null;
        try {
            backup = backupManager.createBackup(BackupType.FULL, List.of());
            history.record(RecoveryEvent.backupCreated(backup.id(), "critical_failure", clock.instant()));
            eventBus.backupCreated(backup);
        } catch (RuntimeException e) {
            log.error("Emergency backup for operation {} failed", operation.id(), e);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", "CREATE");
        payload.put("backupType", BackupType.FULL.name());
        payload.put("backupId", backup != null ? backup.id() : null);
        payload.put("restorePoint", "critical_failure_" + operation.id());
        payload.put("operationId", operation.id());
        payload.put("failureType", classification.failureType().name());
        payload.put("success", backup != null);
        logChange(() -> changeLogger.logBackup(payload, EventSeverity.CRITICAL));
    }

    // ========== Background Loops ==========

    private void backupLoop() {
        if (!running) return;

        try {
            createScheduledBackup();
        } catch (Exception e) {
            log.error("Scheduled backup failed", e);
        }
    }

    private void healthCheckLoop() {
        if (!running) return;

        try {
            checkSystemHealth();
        } catch (Exception e) {
            log.error("Health check failed", e);
        }
    }

    private void cleanupLoop() {
        if (!running) return;

        try {
            cleanupExpired();
        } catch (Exception e) {
            log.error("Backup cleanup failed", e);
        }
    }

    /**
     * Take the periodic backup: FULL when none was taken in the last week,
     * INCREMENTAL otherwise.
     */
    public BackupInfo createScheduledBackup() {
        Instant now = clock.instant();
        boolean fullDue = backupManager
            .listBackups(new BackupFilter(BackupType.FULL, null, now.minus(FULL_BACKUP_MAX_AGE)))
            .isEmpty();
        BackupType type = fullDue ? BackupType.FULL : BackupType.INCREMENTAL;

        BackupInfo backup = backupManager.createBackup(type, List.of());
        history.record(RecoveryEvent.backupCreated(backup.id(), "scheduled", now));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", "CREATE");
        payload.put("backupType", type.name());
        payload.put("backupId", backup.id());
        payload.put("size", backup.size());
        payload.put("tables", backup.tables());
        logChange(() -> changeLogger.logBackup(payload, EventSeverity.INFO));
        eventBus.backupCreated(backup);

        log.info("Created scheduled {} backup {}", type, backup.id());
        return backup;
    }

    /**
     * Snapshot host resources and warn about pressure.
     */
    public SystemState checkSystemHealth() {
        SystemState state = currentSystemState();
        if (state.memoryUsage() > HIGH_USAGE) {
            log.warn("High memory usage: {}%", Math.round(state.memoryUsage() * 100));
        }
        if (state.cpuUsage() > HIGH_USAGE) {
            log.warn("High CPU usage: {}%", Math.round(state.cpuUsage() * 100));
        }
        if (state.queueSize() > settings.alertThreshold()) {
            log.warn("Recovery queue depth {} exceeds alert threshold {}", state.queueSize(), settings.alertThreshold());
        }
        if (state.networkStatus() != NetworkStatus.ONLINE) {
            log.warn("Network is {}", state.networkStatus());
        }
        return state;
    }

    /**
     * Delete expired backups and rollback points.
     *
     * @return Number of items removed
     */
    public int cleanupExpired() {
        int backups = backupManager.cleanup();
        int points = rollbackPoints.cleanupExpired();
        if (backups + points > 0) {
            log.info("Cleaned up {} expired backups and {} expired rollback points", backups, points);
        }
        return backups + points;
    }

    // ========== Reporting ==========

    public RecoveryStatistics getStatistics() {
        return statistics.snapshot();
    }

    /**
     * Recorded events matching every non-null criterion, oldest first.
     */
    public List<RecoveryEvent> getEventHistory(RecoveryEventType type, String operationId, Instant since) {
        return history.query(type, operationId, since);
    }

    public SystemState currentSystemState() {
        return systemStateProvider.snapshot().withQueueSize(inFlight.size());
    }

    public int activeRecoveryCount() {
        return inFlight.size();
    }

    public boolean isRecoveryInFlight(String operationId) {
        return inFlight.isInFlight(operationId);
    }

    public RecoveryStatusReport generateStatusReport() {
        RecoveryStatistics stats = statistics.snapshot();
        SystemState state = currentSystemState();
        List<FailureClassification> recentFailures = history.recent(RecoveryEventType.FAILURE_DETECTED, RECENT_FAILURES)
            .stream()
            .map(RecoveryEvent::classification)
            .toList();

        return new RecoveryStatusReport(
            clock.instant(),
            RecoveryStatusReport.OverallStatus.fromSuccessRate(stats.successRate()),
            inFlight.size(),
            stats,
            state,
            recentFailures,
            recommendations(stats, state)
        );
    }

    static List<String> recommendations(RecoveryStatistics stats, SystemState state) {
        List<String> recommendations = new ArrayList<>();
        if (state.diskSpace() < LOW_DISK_BYTES) {
            recommendations.add("Free up disk space: less than 10 GB available");
        }
        if (state.memoryUsage() > HIGH_USAGE) {
            recommendations.add("Memory usage is above 90%, consider restarting the sync service");
        }
        if (state.networkStatus() != NetworkStatus.ONLINE) {
            recommendations.add("Check network connectivity: network is " + state.networkStatus());
        }
        if (stats.failuresOf(FailureType.NETWORK_ERROR) > 2) {
            recommendations.add("Repeated network errors: check connectivity to the sync server");
        }
        if (stats.failuresOf(FailureType.DATA_CORRUPTION) > 0) {
            recommendations.add("Data corruption detected: restore from the latest verified backup");
        }
        if (stats.successRate() < 0.8) {
            recommendations.add("Recovery success rate is below 80%, review the sync configuration");
        }
        return recommendations;
    }

    // ========== Extension ==========

    public RecoveryStrategyFactory getStrategyFactory() {
        return strategyFactory;
    }

    public void addObserver(RecoveryObserver observer) {
        eventBus.addObserver(observer);
    }

    public boolean removeObserver(RecoveryObserver observer) {
        return eventBus.removeObserver(observer);
    }
}
