package com.syncrecovery.recovery.health;

import com.syncrecovery.core.model.SystemState;
import com.syncrecovery.engine.changelog.ChangeEventStore;
import com.syncrecovery.engine.replay.ReplayEngine;
import com.syncrecovery.recovery.manager.RecoveryManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Health of the sync recovery core.
 * Reports health status based on:
 * - Change event store reachability
 * - Host resources
 * - In-flight recoveries and running replays
 */
@Component
public class SyncRecoveryHealthIndicator implements HealthIndicator {

    private final ChangeEventStore eventStore;
    private final RecoveryManager recoveryManager;
    private final ReplayEngine replayEngine;

    public SyncRecoveryHealthIndicator(
            ChangeEventStore eventStore,
            RecoveryManager recoveryManager,
            ReplayEngine replayEngine) {
        this.eventStore = eventStore;
        this.recoveryManager = recoveryManager;
        this.replayEngine = replayEngine;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            if (!checkStore(details)) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            checkSystemState(details);

            details.put("recoveryManager", recoveryManager.isRunning() ? "running" : "stopped");
            details.put("inFlightRecoveries", recoveryManager.activeRecoveryCount());
            details.put("replayEngine", replayEngine.isRunning() ? "running" : "stopped");
            details.put("runningReplays", replayEngine.activeRunCount());

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private boolean checkStore(Map<String, Object> details) {
        try {
            long count = eventStore.countAll();
            details.put("eventStore", "reachable");
            details.put("events", count);
            return true;
        } catch (Exception e) {
            details.put("eventStore", "unreachable");
            details.put("eventStoreError", e.getMessage());
            return false;
        }
    }

    private void checkSystemState(Map<String, Object> details) {
        SystemState state = recoveryManager.currentSystemState();
        details.put("network", state.networkStatus().name());
        details.put("freeDiskBytes", state.diskSpace());
        details.put("memoryUsage", state.memoryUsage());
        details.put("cpuUsage", state.cpuUsage());
        if (!state.isHealthy()) {
            details.put("resourceWarning", "System resources below the automated-retry threshold");
        }
    }
}
