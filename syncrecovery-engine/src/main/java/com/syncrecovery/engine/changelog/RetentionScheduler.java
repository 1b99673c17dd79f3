package com.syncrecovery.engine.changelog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs change log retention cleanup on a fixed interval.
 */
public class RetentionScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetentionScheduler.class);

    private final ChangeEventStore store;
    private final Duration interval;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public RetentionScheduler(ChangeEventStore store, Duration interval) {
        this.store = store;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "changelog-retention");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start the retention loop.
     */
    public void start() {
        if (running) {
            log.warn("Retention scheduler already running");
            return;
        }

        running = true;
        scheduler.scheduleWithFixedDelay(
            this::runCleanup,
            interval.toMillis(),
            interval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        log.info("Retention scheduler started (interval={})", interval);
    }

    /**
     * Stop the retention loop.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Retention scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    void runCleanup() {
        if (!running) return;

        try {
            int deleted = store.cleanup();
            if (deleted > 0) {
                log.info("Retention cleanup removed {} events", deleted);
            }
        } catch (Exception e) {
            log.error("Error in change log retention cleanup", e);
        }
    }
}
