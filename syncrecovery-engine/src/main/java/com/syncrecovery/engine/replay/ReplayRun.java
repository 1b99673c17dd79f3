package com.syncrecovery.engine.replay;

import com.syncrecovery.core.model.ChangeEvent;
import com.syncrecovery.core.model.ReplayEventResult;
import com.syncrecovery.core.model.ReplayEventStatus;
import com.syncrecovery.core.model.ReplayOptions;
import com.syncrecovery.core.model.ReplaySession;
import com.syncrecovery.core.model.ReplayStatus;
import com.syncrecovery.core.model.ReplaySummary;
import com.syncrecovery.core.repository.ReplaySessionRepository;
import com.syncrecovery.engine.metrics.SyncRecoveryMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of one active replay run.
 *
 * While a run is active every write of its session goes through this object,
 * so counters recorded by workers never overwrite a pause or cancel.
 */
class ReplayRun {

    private final ReplaySessionRepository repository;
    private final SyncRecoveryMetrics metrics;
    private final Instant startedAt;
    private final int processedAtStart;

    private ReplaySession session;
    private final Set<String> unapplied = new HashSet<>();
    private final List<ReplayProgress.EventError> errors = new ArrayList<>();

    private boolean stopRequested = false;
    private boolean aborted = false;
    private boolean finished = false;
    private String abortError;

    ReplayRun(ReplaySession session, ReplaySessionRepository repository, SyncRecoveryMetrics metrics,
              Instant startedAt, List<ReplayProgress.EventError> previousErrors) {
        this.session = session;
        this.repository = repository;
        this.metrics = metrics;
        this.startedAt = startedAt;
        this.processedAtStart = session.processedEvents();
        this.errors.addAll(previousErrors);
    }

    String sessionId() {
        return session.id();
    }

    ReplayOptions options() {
        return session.options();
    }

    Instant startedAt() {
        return startedAt;
    }

    int processedAtStart() {
        return processedAtStart;
    }

    synchronized ReplaySession current() {
        return session;
    }

    synchronized List<ReplayProgress.EventError> errors() {
        return List.copyOf(errors);
    }

    synchronized boolean shouldStop() {
        return stopRequested || aborted;
    }

    synchronized boolean isStopRequested() {
        return stopRequested;
    }

    synchronized boolean isAborted() {
        return aborted;
    }

    synchronized String abortError() {
        return abortError;
    }

    // ========== Progress ==========

    synchronized void planned(int totalEvents, Set<String> alreadyUnapplied) {
        session = session.toBuilder().totalEvents(totalEvents).build();
        unapplied.addAll(alreadyUnapplied);
        repository.save(session);
    }

    synchronized void currentEvent(String eventId) {
        session = session.toBuilder().currentEventId(eventId).build();
    }

    /**
     * First dependency of the event that was not applied in this session, or null.
     */
    synchronized String unappliedDependency(ChangeEvent event) {
        for (String dependency : event.dependsOn()) {
            if (unapplied.contains(dependency)) {
                return dependency;
            }
        }
        return null;
    }

    /**
     * Persist one per-event result and the updated counters.
     *
     * @return true if a checkpoint is due after this event
     */
    synchronized boolean record(ReplayEventResult result) {
        repository.appendResult(result);
        session = session.toBuilder()
            .recordOutcome(result.status())
            .currentEventId(result.eventId())
            .build();
        repository.save(session);
        metrics.replayEvent(result.status().name());

        if (result.status() != ReplayEventStatus.SUCCESS) {
            unapplied.add(result.eventId());
        }
        if (result.isFailure()) {
            errors.add(new ReplayProgress.EventError(result.eventId(), result.error(), result.timestamp()));
            if (options().stopOnError()) {
                abort("Replay stopped due to error at event " + result.eventId() + ": " + result.error());
            }
        }

        ReplayOptions options = options();
        return options.enableRollback()
            && session.processedEvents() % options.checkpointInterval() == 0;
    }

    synchronized void abort(String error) {
        if (!aborted) {
            aborted = true;
            abortError = error;
        }
    }

    // ========== Transitions ==========

    /**
     * Pause the run back to PENDING. Takes effect between events.
     *
     * @return false if the run already finished or is stopping
     */
    synchronized boolean requestPause() {
        if (finished || stopRequested) {
            return false;
        }
        ReplayStatus from = session.status();
        session = session.toBuilder().status(ReplayStatus.PENDING).build();
        repository.save(session);
        metrics.replayStatusChanged(from.name(), ReplayStatus.PENDING.name());
        stopRequested = true;
        return true;
    }

    /**
     * Cancel the run. Overrides a pause that has not reached its stop point yet.
     *
     * @return false if the run already finished or was cancelled
     */
    synchronized boolean cancel(Instant now) {
        if (finished || session.status() == ReplayStatus.CANCELLED) {
            return false;
        }
        ReplayStatus from = session.status();
        session = session.toBuilder()
            .status(ReplayStatus.CANCELLED)
            .completedAt(now)
            .duration(Duration.between(session.startedAt(), now))
            .build();
        repository.save(session);
        metrics.replayStatusChanged(from.name(), ReplayStatus.CANCELLED.name());
        stopRequested = true;
        return true;
    }

    /**
     * Close the run with a terminal status unless a pause or cancel already took over.
     */
    synchronized ReplaySession finish(ReplayStatus status, String error, ReplaySummary summary, Instant now) {
        finished = true;
        if (stopRequested) {
            return session;
        }
        ReplayStatus from = session.status();
        session = session.toBuilder()
            .status(status)
            .error(error)
            .result(summary)
            .currentEventId(null)
            .completedAt(now)
            .duration(Duration.between(session.startedAt(), now))
            .build();
        repository.save(session);
        metrics.replayStatusChanged(from.name(), status.name());
        return session;
    }

    synchronized void markFinished() {
        finished = true;
    }
}
