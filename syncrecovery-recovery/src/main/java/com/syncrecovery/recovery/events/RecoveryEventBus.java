package com.syncrecovery.recovery.events;

import com.syncrecovery.core.model.BackupInfo;
import com.syncrecovery.core.model.FailureClassification;
import com.syncrecovery.core.model.RecoveryContext;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.core.model.RollbackPoint;
import com.syncrecovery.engine.metrics.SyncRecoveryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Delivers observer notifications from a bounded queue on a dedicated thread.
 *
 * Publishing never blocks: when the queue is full the notification is
 * dropped and counted. An observer that throws does not affect the others.
 */
public class RecoveryEventBus {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEventBus.class);

    private static final long POLL_MILLIS = 100;

    private final BlockingQueue<Notification> queue;
    private final List<RecoveryObserver> observers = new CopyOnWriteArrayList<>();
    private final SyncRecoveryMetrics metrics;
    private final AtomicLong dropped = new AtomicLong();

    private volatile boolean running = false;
    private Thread dispatcher;

    private record Notification(String eventType, Consumer<RecoveryObserver> call) {}

    public RecoveryEventBus(int capacity, SyncRecoveryMetrics metrics) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.metrics = metrics;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        dispatcher = new Thread(this::dispatchLoop, "recovery-event-bus");
        dispatcher.setDaemon(true);
        dispatcher.start();
        log.info("Recovery event bus started (capacity={})", queue.remainingCapacity() + queue.size());
    }

    /**
     * Stop the dispatcher after delivering what is already queued.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            dispatcher.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (dispatcher.isAlive()) {
            log.warn("Recovery event bus did not drain in time, {} notifications pending", queue.size());
            dispatcher.interrupt();
        }
        log.info("Recovery event bus stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public void addObserver(RecoveryObserver observer) {
        observers.add(observer);
    }

    public boolean removeObserver(RecoveryObserver observer) {
        return observers.remove(observer);
    }

    // ========== Publishing ==========

    public boolean failureDetected(FailureClassification classification) {
        return publish("FAILURE_DETECTED", observer -> observer.onFailureDetected(classification));
    }

    public boolean recoveryStarted(RecoveryContext context) {
        return publish("RECOVERY_STARTED", observer -> observer.onRecoveryStarted(context));
    }

    public boolean recoveryCompleted(RecoveryResult result) {
        return publish("RECOVERY_COMPLETED", observer -> observer.onRecoveryCompleted(result));
    }

    public boolean rollbackPointCreated(RollbackPoint point) {
        return publish("ROLLBACK_POINT_CREATED", observer -> observer.onRollbackPointCreated(point));
    }

    public boolean backupCreated(BackupInfo backup) {
        return publish("BACKUP_CREATED", observer -> observer.onBackupCreated(backup));
    }

    /**
     * @return false if the notification was dropped
     */
    boolean publish(String eventType, Consumer<RecoveryObserver> call) {
        if (observers.isEmpty()) {
            return true;
        }
        if (!queue.offer(new Notification(eventType, call))) {
            long total = dropped.incrementAndGet();
            metrics.eventBusDropped(eventType);
            log.warn("Event bus full, dropped {} notification ({} dropped so far)", eventType, total);
            return false;
        }
        return true;
    }

    public long droppedCount() {
        return dropped.get();
    }

    public int pendingCount() {
        return queue.size();
    }

    // ========== Dispatch ==========

    private void dispatchLoop() {
        while (running || !queue.isEmpty()) {
            try {
                Notification notification = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (notification != null) {
                    deliver(notification);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void deliver(Notification notification) {
        for (RecoveryObserver observer : observers) {
            try {
                notification.call().accept(observer);
            } catch (RuntimeException e) {
                log.warn("Observer {} failed on {}", observer.getClass().getSimpleName(),
                    notification.eventType(), e);
            }
        }
    }
}
