package com.syncrecovery.engine.replay;

import com.syncrecovery.core.exception.InvalidRequestException;
import com.syncrecovery.core.exception.InvalidStateTransitionException;
import com.syncrecovery.core.exception.NotFoundException;
import com.syncrecovery.core.model.BackupType;
import com.syncrecovery.core.model.ChangeEvent;
import com.syncrecovery.core.model.ChangeEventType;
import com.syncrecovery.core.model.EventFilter;
import com.syncrecovery.core.model.EventSort;
import com.syncrecovery.core.model.ReplayEventResult;
import com.syncrecovery.core.model.ReplayEventStatus;
import com.syncrecovery.core.model.ReplayMode;
import com.syncrecovery.core.model.ReplayOptions;
import com.syncrecovery.core.model.ReplaySession;
import com.syncrecovery.core.model.ReplayStatus;
import com.syncrecovery.core.model.ReplayStrategy;
import com.syncrecovery.core.model.ReplaySummary;
import com.syncrecovery.core.model.RollbackPoint;
import com.syncrecovery.core.model.ValidationIssue;
import com.syncrecovery.core.repository.ReplaySessionRepository;
import com.syncrecovery.engine.changelog.ChangeEventStore;
import com.syncrecovery.engine.concurrent.InFlightRegistry;
import com.syncrecovery.engine.concurrent.Sleeper;
import com.syncrecovery.engine.logging.LoggingContext;
import com.syncrecovery.engine.metrics.SyncRecoveryMetrics;
import com.syncrecovery.engine.rollback.RollbackPointService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Re-executes filtered slices of the change log.
 *
 * Sessions move PENDING -> RUNNING -> COMPLETED | FAILED | CANCELLED. Pausing
 * moves a running session back to PENDING; starting it again resumes after
 * the events that already have a result.
 *
 * Runs are asynchronous. At most one run per session is active at a time.
 */
public class ReplayEngine {

    private static final Logger log = LoggerFactory.getLogger(ReplayEngine.class);

    public static final int DEFAULT_MAX_SAFE_CONCURRENCY = 10;
    private static final Duration MAX_PACING_GAP = Duration.ofSeconds(1);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    public static final String ISSUE_MISSING_FILTER = "MISSING_FILTER";
    public static final String ISSUE_MISSING_OPTIONS = "MISSING_OPTIONS";
    public static final String ISSUE_NO_EVENTS = "NO_EVENTS";
    public static final String ISSUE_HIGH_CONCURRENCY = "HIGH_CONCURRENCY";
    public static final String ISSUE_EVENT_MISSING = "EVENT_MISSING";
    public static final String ISSUE_CHECKSUM_MISMATCH = "CHECKSUM_MISMATCH";
    public static final String ISSUE_COUNTER_MISMATCH = "COUNTER_MISMATCH";

    private final ChangeEventStore eventStore;
    private final ReplaySessionRepository sessionRepository;
    private final RollbackPointService rollbackPoints;
    private final SyncRecoveryMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;
    private final int workerThreads;
    private final int maxSafeConcurrency;

    private final ReplayPlanner planner = new ReplayPlanner();
    private final Map<ChangeEventType, ReplayEventHandler> handlers = new ConcurrentHashMap<>();
    private final InFlightRegistry<String, ReplaySession> activeRuns = new InFlightRegistry<>("replay");
    private final Map<String, ReplayRun> runs = new ConcurrentHashMap<>();

    private ExecutorService sessionExecutor;
    private ExecutorService laneExecutor;
    private volatile boolean running = false;

    public ReplayEngine(
            ChangeEventStore eventStore,
            ReplaySessionRepository sessionRepository,
            RollbackPointService rollbackPoints,
            SyncRecoveryMetrics metrics,
            Clock clock,
            Sleeper sleeper,
            int workerThreads,
            int maxSafeConcurrency) {
        this.eventStore = eventStore;
        this.sessionRepository = sessionRepository;
        this.rollbackPoints = rollbackPoints;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
        this.workerThreads = Math.max(1, workerThreads);
        this.maxSafeConcurrency = maxSafeConcurrency > 0 ? maxSafeConcurrency : DEFAULT_MAX_SAFE_CONCURRENCY;
    }

    // ========== Lifecycle ==========

    /**
     * Start the worker pools and put sessions interrupted by a crash back to PENDING.
     */
    public synchronized void initialize() {
        if (running) {
            log.warn("Replay engine already initialized");
            return;
        }

        sessionExecutor = Executors.newFixedThreadPool(workerThreads, daemonThreads("replay-session-"));
        laneExecutor = Executors.newCachedThreadPool(daemonThreads("replay-lane-"));
        restoreInterruptedSessions();
        running = true;
        log.info("Replay engine initialized (workers={})", workerThreads);
    }

    /**
     * Pause active runs and wait for the workers to stop. Paused sessions
     * can be resumed after the next initialize.
     */
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        running = false;

        runs.values().forEach(ReplayRun::requestPause);

        awaitTermination(sessionExecutor);
        awaitTermination(laneExecutor);
        log.info("Replay engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void restoreInterruptedSessions() {
        for (ReplaySession session : sessionRepository.findByStatus(ReplayStatus.RUNNING)) {
            sessionRepository.save(session.toBuilder().status(ReplayStatus.PENDING).currentEventId(null).build());
            log.warn("Replay session {} was interrupted after {} events, reset to PENDING",
                session.id(), session.processedEvents());
        }
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
            throw new IllegalStateException("Replay engine not initialized");
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

    // ========== Registration ==========

    public void registerHandler(ChangeEventType type, ReplayEventHandler handler) {
        handlers.put(type, handler);
    }

    public void registerSelector(ReplaySelector selector) {
        planner.registerSelector(selector);
    }

    // ========== Sessions ==========

    /**
     * Create a PENDING session over the events matched by the filter.
     *
     * @return The new session id
     * @throws InvalidRequestException if name, filter or options are missing or invalid
     */
    public String createSession(String name, EventFilter filter, ReplayOptions options, String description) {
        ensureRunning();
        if (name == null || name.isBlank()) {
            throw new InvalidRequestException("Replay session name is required");
        }
        if (filter == null) {
            throw new InvalidRequestException("Replay filter is required");
        }
        if (options == null) {
            throw new InvalidRequestException("Replay options are required");
        }
        if (options.strategy() == ReplayStrategy.SELECTIVE) {
            planner.checkSelectors(options);
        }

        int totalEvents = (int) eventStore.count(filter);
        ReplaySession session = ReplaySession.create(name, description, filter, options, totalEvents, clock.instant());
        sessionRepository.save(session);
        metrics.replayStatusChanged(null, ReplayStatus.PENDING.name());

        log.info("Created replay session {} '{}' over {} events ({}, {})",
            session.id(), name, totalEvents, options.mode(), options.strategy());
        return session.id();
    }

    public ReplaySession getSession(String sessionId) {
        ReplayRun run = runs.get(sessionId);
        if (run != null) {
            return run.current();
        }
        return sessionRepository.findById(sessionId)
            .orElseThrow(() -> new NotFoundException("ReplaySession", sessionId));
    }

    /**
     * @param status Only sessions in this status, null for all
     */
    public List<ReplaySession> listSessions(ReplayStatus status) {
        return status != null ? sessionRepository.findByStatus(status) : sessionRepository.findAll();
    }

    public List<ReplayEventResult> getResults(String sessionId) {
        getSession(sessionId);
        return sessionRepository.findResults(sessionId);
    }

    /**
     * Delete a session that is not running, with its results and checkpoints.
     */
    public synchronized void deleteSession(String sessionId) {
        ReplaySession session = getSession(sessionId);
        if (session.status() == ReplayStatus.RUNNING || activeRuns.isInFlight(sessionId)) {
            throw new InvalidRequestException("Cannot delete running replay session " + sessionId);
        }

        for (RollbackPoint checkpoint : rollbackPoints.list(sessionId)) {
            rollbackPoints.discard(checkpoint.id());
        }
        sessionRepository.delete(sessionId);
        if (!session.isTerminal()) {
            metrics.replayStatusChanged(session.status().name(), null);
        }
        log.info("Deleted replay session {}", sessionId);
    }

    // ========== Control ==========

    /**
     * Start or resume a PENDING session. Returns immediately; the returned
     * future completes with the session once the run stops. A failure inside
     * the run is recorded as status FAILED, never thrown to the caller.
     */
    public synchronized CompletableFuture<ReplaySession> startReplay(String sessionId) {
        ensureRunning();
        ReplaySession session = getSession(sessionId);
        if (session.status() != ReplayStatus.PENDING) {
            throw new InvalidStateTransitionException("ReplaySession", session.status(), ReplayStatus.RUNNING);
        }
        if (activeRuns.isInFlight(sessionId)) {
            // Previous run has not reached its stop point yet
            throw new InvalidStateTransitionException("ReplaySession", ReplayStatus.RUNNING, ReplayStatus.RUNNING);
        }

        Instant now = clock.instant();
        ReplaySession started = session.toBuilder()
            .status(ReplayStatus.RUNNING)
            .startedAt(session.startedAt() != null ? session.startedAt() : now)
            .completedAt(null)
            .error(null)
            .build();
        sessionRepository.save(started);
        metrics.replayStatusChanged(ReplayStatus.PENDING.name(), ReplayStatus.RUNNING.name());

        ReplayRun run = new ReplayRun(started, sessionRepository, metrics, now, previousErrors(sessionId));
        runs.put(sessionId, run);

        log.info("{} replay session {}", session.processedEvents() > 0 ? "Resuming" : "Starting", sessionId);
        return activeRuns.runExclusive(sessionId,
            () -> CompletableFuture.supplyAsync(() -> execute(run), sessionExecutor));
    }

    public CompletableFuture<ReplaySession> resumeReplay(String sessionId) {
        return startReplay(sessionId);
    }

    /**
     * Pause a running session between events.
     */
    public synchronized ReplaySession pauseReplay(String sessionId) {
        ReplaySession session = getSession(sessionId);
        ReplayRun run = runs.get(sessionId);
        if (session.status() != ReplayStatus.RUNNING || run == null
                || !run.requestPause()) {
            throw new InvalidStateTransitionException("ReplaySession", session.status(), ReplayStatus.PENDING);
        }
        log.info("Paused replay session {} after {} events", sessionId, run.current().processedEvents());
        return run.current();
    }

    /**
     * Cancel a pending or running session. Already applied events are not rolled back.
     */
    public synchronized ReplaySession cancelReplay(String sessionId) {
        Instant now = clock.instant();
        ReplayRun run = runs.get(sessionId);
        if (run != null && run.cancel(now)) {
            log.info("Cancelled running replay session {}", sessionId);
            return run.current();
        }

        ReplaySession session = getSession(sessionId);
        if (!session.canTransitionTo(ReplayStatus.CANCELLED)) {
            throw new InvalidStateTransitionException("ReplaySession", session.status(), ReplayStatus.CANCELLED);
        }
        ReplaySession cancelled = session.toBuilder()
            .status(ReplayStatus.CANCELLED)
            .completedAt(now)
            .build();
        sessionRepository.save(cancelled);
        metrics.replayStatusChanged(session.status().name(), ReplayStatus.CANCELLED.name());
        log.info("Cancelled replay session {}", sessionId);
        return cancelled;
    }

    // ========== Progress & Validation ==========

    public ReplayProgress getReplayProgress(String sessionId) {
        ReplayRun run = runs.get(sessionId);
        if (run == null) {
            ReplaySession session = getSession(sessionId);
            return new ReplayProgress(sessionId, session.totalEvents(), session.processedEvents(),
                session.currentEventId(), Duration.ZERO, previousErrors(sessionId));
        }

        ReplaySession session = run.current();
        int processedThisRun = session.processedEvents() - run.processedAtStart();
        long elapsedMillis = Duration.between(run.startedAt(), clock.instant()).toMillis();
        Duration remaining = Duration.ZERO;
        if (processedThisRun > 0 && elapsedMillis > 0) {
            double millisPerEvent = (double) elapsedMillis / processedThisRun;
            remaining = Duration.ofMillis(Math.round(session.remainingEvents() * millisPerEvent));
        }
        return new ReplayProgress(sessionId, session.totalEvents(), session.processedEvents(),
            session.currentEventId(), remaining, run.errors());
    }

    /**
     * Pre-flight check of a session without executing it.
     */
    public ReplayValidation validateReplay(String sessionId) {
        ReplaySession session = getSession(sessionId);
        List<ValidationIssue> issues = new ArrayList<>();

        if (session.filter() == null) {
            issues.add(ValidationIssue.error(ISSUE_MISSING_FILTER, "Session filter is not defined"));
        }
        if (session.options() == null) {
            issues.add(ValidationIssue.error(ISSUE_MISSING_OPTIONS, "Session options are not defined"));
        }

        if (session.filter() != null && eventStore.count(session.filter()) == 0) {
            issues.add(ValidationIssue.warning(ISSUE_NO_EVENTS, "No events found matching the filter criteria"));
        }
        if (session.options() != null && session.options().maxConcurrency() > maxSafeConcurrency) {
            issues.add(ValidationIssue.warning(ISSUE_HIGH_CONCURRENCY,
                "Concurrency " + session.options().maxConcurrency() + " exceeds the safe limit of " + maxSafeConcurrency));
        }
        return new ReplayValidation(issues);
    }

    /**
     * Restore one of the session's checkpoints.
     *
     * @throws InvalidRequestException if the point belongs to another session
     */
    public RollbackPoint restoreCheckpoint(String sessionId, String rollbackPointId) {
        ReplaySession session = getSession(sessionId);
        if (session.status() == ReplayStatus.RUNNING) {
            throw new InvalidRequestException("Pause or cancel replay session " + sessionId + " before restoring");
        }
        RollbackPoint point = rollbackPoints.get(rollbackPointId);
        if (!point.isOwnedBy(sessionId)) {
            throw new InvalidRequestException(
                "Rollback point " + rollbackPointId + " does not belong to session " + sessionId);
        }
        RollbackPoint restored = rollbackPoints.restore(rollbackPointId);
        log.info("Rolled back replay session {} to checkpoint {}", sessionId, rollbackPointId);
        return restored;
    }

    public int activeRunCount() {
        return activeRuns.size();
    }

    // ========== Execution ==========

    private ReplaySession execute(ReplayRun run) {
        String sessionId = run.sessionId();
        try (LoggingContext ctx = LoggingContext.forReplaySession(sessionId)) {
            try {
                ReplaySession session = run.current();
                List<ChangeEvent> matched = eventStore.query(session.filter().withSort(EventSort.oldestFirst()));
                ReplayPlan plan = planner.plan(matched, session.options());

                List<ReplayEventResult> previous = sessionRepository.findResults(sessionId);
                Set<String> done = previous.stream().map(ReplayEventResult::eventId).collect(Collectors.toSet());
                Set<String> notApplied = previous.stream()
                    .filter(result -> result.status() != ReplayEventStatus.SUCCESS)
                    .map(ReplayEventResult::eventId)
                    .collect(Collectors.toSet());
                run.planned(plan.size(), notApplied);

                if (plan.excludedEvents() > 0) {
                    log.debug("Excluded {} events from replay", plan.excludedEvents());
                }

                if (plan.isConcurrent() && run.options().maxConcurrency() > 1) {
                    runLanes(run, plan, done);
                } else {
                    runLane(run, plan.events(), done);
                }
                return complete(run);
            } catch (RuntimeException e) {
                log.error("Replay of session {} failed", sessionId, e);
                return run.finish(ReplayStatus.FAILED, e.getMessage(), null, clock.instant());
            } finally {
                runs.remove(sessionId, run);
            }
        }
    }

    private void runLanes(ReplayRun run, ReplayPlan plan, Set<String> done) {
        int workers = Math.min(run.options().maxConcurrency(), plan.lanes().size());
        ConcurrentLinkedQueue<List<ReplayPlan.Step>> queue = new ConcurrentLinkedQueue<>(plan.lanes());
        log.debug("Replaying {} lanes on {} workers", plan.lanes().size(), workers);

        List<CompletableFuture<Void>> futures = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            futures.add(CompletableFuture.runAsync(() -> {
                try (LoggingContext ctx = LoggingContext.forReplaySession(run.sessionId())) {
                    List<ReplayPlan.Step> lane;
                    while ((lane = queue.poll()) != null && !run.shouldStop()) {
                        runLane(run, lane, done);
                    }
                }
            }, laneExecutor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private void runLane(ReplayRun run, List<ReplayPlan.Step> steps, Set<String> done) {
        ChangeEvent previous = null;
        for (ReplayPlan.Step step : steps) {
            if (run.shouldStop()) {
                return;
            }
            ChangeEvent event = step.event();
            if (done.contains(event.id())) {
                previous = event;
                continue;
            }

            if (!pace(run, previous, event)) {
                return;
            }
            if (replayStep(run, step)) {
                checkpoint(run);
            }
            previous = event;
        }
    }

    /**
     * Replay one event and record its result.
     *
     * @return true if a checkpoint is due
     */
    private boolean replayStep(ReplayRun run, ReplayPlan.Step step) {
        ChangeEvent event = step.event();
        ReplayOptions options = run.options();
        run.currentEvent(event.id());

        Instant started = clock.instant();
        ReplayEventStatus status;
        String error = null;

        String blocker = options.strategy() == ReplayStrategy.DEPENDENCY_AWARE
            ? run.unappliedDependency(event) : null;
        if (blocker != null) {
            status = ReplayEventStatus.SKIPPED;
            error = "Dependency " + blocker + " was not applied";
            log.debug("Skipping event {}: {}", event.id(), error);
        } else {
            try (LoggingContext ctx = LoggingContext.forEvent(event.id(), event.correlationId())) {
                apply(event, options.mode());
                status = ReplayEventStatus.SUCCESS;
            } catch (ReplayException e) {
                status = ReplayEventStatus.FAILED;
                error = e.getMessage();
                log.warn("Replay of event {} failed [{}]: {}", event.id(), e.getErrorCode(), e.getMessage());
            } catch (RuntimeException e) {
                status = ReplayEventStatus.FAILED;
                error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("Replay of event {} failed", event.id(), e);
            }
        }

        Instant finished = clock.instant();
        return run.record(new ReplayEventResult(
            run.sessionId(),
            event.id(),
            step.order(),
            status,
            Duration.between(started, finished),
            error,
            finished
        ));
    }

    private void apply(ChangeEvent event, ReplayMode mode) throws ReplayException {
        switch (mode) {
            case DRY_RUN -> log.debug("Dry run of event {} ({})", event.id(), event.type());
            case FAST -> dispatch(event);
            case SAFE -> {
                checkStructure(event);
                dispatch(event);
            }
            case VERBOSE -> {
                log.info("Replaying event {} (type={}, source={}, timestamp={})",
                    event.id(), event.type(), event.source(), event.timestamp());
                checkStructure(event);
                log.info("Event {} passed structure checks", event.id());
                dispatch(event);
                log.info("Replayed event {}", event.id());
            }
        }
    }

    private void checkStructure(ChangeEvent event) throws ReplayException {
        if (event.id() == null || event.id().isBlank() || event.type() == null || event.timestamp() == null) {
            throw new ReplayException("INVALID_EVENT", "Invalid event structure");
        }
    }

    private void dispatch(ChangeEvent event) throws ReplayException {
        ReplayEventHandler handler = handlers.get(event.type());
        if (handler == null) {
            log.debug("No replay handler for {}, event {} accepted as is", event.type(), event.id());
            return;
        }
        handler.apply(event);
    }

    /**
     * Wait the original gap between two events, scaled by the speed multiplier.
     *
     * @return false if the wait was interrupted and the run paused
     */
    private boolean pace(ReplayRun run, ChangeEvent previous, ChangeEvent next) {
        ReplayOptions options = run.options();
        if (previous == null || options.speedMultiplier() <= 0 || !options.mode().validatesEvents()) {
            return true;
        }
        Duration gap = Duration.between(previous.timestamp(), next.timestamp());
        if (gap.isNegative() || gap.isZero()) {
            return true;
        }

        Duration wait = Duration.ofMillis((long) (gap.toMillis() / options.speedMultiplier()));
        if (wait.compareTo(MAX_PACING_GAP) > 0) {
            wait = MAX_PACING_GAP;
        }
        try {
            sleeper.sleep(wait);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.requestPause();
            log.warn("Replay of session {} interrupted, paused", run.sessionId());
            return false;
        }
    }

    private void checkpoint(ReplayRun run) {
        ReplaySession session = run.current();
        List<String> replayed = sessionRepository.findResults(session.id()).stream()
            .map(ReplayEventResult::eventId)
            .toList();
        RollbackPoint point = rollbackPoints.create(
            "Checkpoint at event " + session.processedEvents() + " of replay " + session.id(),
            replayed,
            BackupType.INCREMENTAL,
            List.of(),
            null,
            session.id()
        );
        log.info("Replay session {} checkpoint {} after {} events",
            session.id(), point.id(), session.processedEvents());
    }

    // ========== Completion ==========

    private ReplaySession complete(ReplayRun run) {
        if (run.isStopRequested()) {
            run.markFinished();
            ReplaySession stopped = run.current();
            log.info("Replay session {} stopped as {} after {} events",
                stopped.id(), stopped.status(), stopped.processedEvents());
            return stopped;
        }

        Instant now = clock.instant();
        ReplaySession session = run.current();
        Duration duration = Duration.between(session.startedAt(), now);
        ReplaySummary.Validation validation = session.options().enableValidation()
            ? validateResults(session)
            : null;
        ReplayStatus status = run.isAborted() ? ReplayStatus.FAILED : ReplayStatus.COMPLETED;
        ReplaySummary summary = summarize(session, status, duration, validation);

        ReplaySession finished = run.finish(status, run.abortError(), summary, now);
        log.info("Replay session {} {}: processed={}, succeeded={}, failed={}, skipped={}",
            finished.id(), finished.status(), finished.processedEvents(), finished.succeededEvents(),
            finished.failedEvents(), finished.skippedEvents());
        return finished;
    }

    private ReplaySummary summarize(ReplaySession session, ReplayStatus status, Duration duration,
                                    ReplaySummary.Validation validation) {
        int processed = session.processedEvents();
        double seconds = duration.toMillis() / 1000.0;
        return new ReplaySummary(
            status == ReplayStatus.COMPLETED
                && session.failedEvents() == 0
                && (validation == null || validation.passed()),
            session.totalEvents(),
            processed,
            session.succeededEvents(),
            session.failedEvents(),
            session.skippedEvents(),
            processed > 0 ? duration.dividedBy(processed) : Duration.ZERO,
            seconds > 0 ? processed / seconds : 0.0,
            validation
        );
    }

    /**
     * Post-run check: replayed events are still stored unchanged and the
     * session counters agree with the recorded results.
     */
    private ReplaySummary.Validation validateResults(ReplaySession session) {
        List<ReplayEventResult> results = sessionRepository.findResults(session.id());
        List<ValidationIssue> issues = new ArrayList<>();

        boolean integrity = true;
        for (ReplayEventResult result : results) {
            if (result.status() != ReplayEventStatus.SUCCESS) {
                continue;
            }
            var stored = eventStore.findEvent(result.eventId());
            if (stored.isEmpty()) {
                integrity = false;
                issues.add(ValidationIssue.error(ISSUE_EVENT_MISSING,
                    "Replayed event " + result.eventId() + " is no longer stored"));
            } else if (!stored.get().verifyChecksum()) {
                integrity = false;
                issues.add(ValidationIssue.error(ISSUE_CHECKSUM_MISMATCH,
                    "Checksum of event " + result.eventId() + " does not match its content"));
            }
        }

        Map<ReplayEventStatus, Long> byStatus = results.stream()
            .collect(Collectors.groupingBy(ReplayEventResult::status, Collectors.counting()));
        boolean consistent = results.size() == session.processedEvents()
            && byStatus.getOrDefault(ReplayEventStatus.SUCCESS, 0L) == session.succeededEvents()
            && byStatus.getOrDefault(ReplayEventStatus.FAILED, 0L) == session.failedEvents()
            && byStatus.getOrDefault(ReplayEventStatus.SKIPPED, 0L) == session.skippedEvents();
        if (!consistent) {
            issues.add(ValidationIssue.error(ISSUE_COUNTER_MISMATCH, String.format(
                "Session counters (processed=%d) disagree with %d recorded results",
                session.processedEvents(), results.size())));
        }

        return new ReplaySummary.Validation(integrity, consistent, issues);
    }

    private List<ReplayProgress.EventError> previousErrors(String sessionId) {
        return sessionRepository.findResults(sessionId).stream()
            .filter(ReplayEventResult::isFailure)
            .map(result -> new ReplayProgress.EventError(result.eventId(), result.error(), result.timestamp()))
            .toList();
    }
}
