package com.syncrecovery.recovery.strategy;

import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.RecoveryContext;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.core.model.SystemState;
import com.syncrecovery.recovery.spi.RecoveryStepException;
import com.syncrecovery.recovery.spi.ResourceReclaimer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Frees whatever resource is under pressure, then retries the operation once.
 */
public class ResourceExhaustionStrategy extends AbstractRecoveryStrategy {

    public static final double MEMORY_PRESSURE = 0.8;
    public static final double CPU_PRESSURE = 0.8;
    public static final long DISK_FLOOR = 5 * SystemState.GIGABYTE;

    public ResourceExhaustionStrategy(RecoveryCollaborators collaborators) {
        super(BuiltInStrategy.RESOURCE_EXHAUSTION, collaborators);
    }

    @Override
    protected RecoveryResult attempt(RecoveryContext context) throws RecoveryStepException {
        SystemState state = context.systemState();
        List<String> optimizations = new ArrayList<>();
        long memoryFreed = 0;
        long diskFreed = 0;

        if (state != null && state.memoryUsage() > MEMORY_PRESSURE) {
            memoryFreed = reclaimer().reclaimMemory();
            optimizations.add("memory_cleanup");
        }
        if (state != null && state.diskSpace() < DISK_FLOOR) {
            diskFreed = reclaimer().reclaimDisk();
            optimizations.add("disk_cleanup");
        }
        if (state != null && state.cpuUsage() > CPU_PRESSURE) {
            reclaimer().throttleCpu();
            optimizations.add("cpu_throttling");
        }

        require(collaborators.executor(), "SyncOperationExecutor").reissue(context.operation());

        return success(RecoveryAction.FALLBACK_STRATEGY, Map.of(
            "resourceOptimizations", List.copyOf(optimizations),
            "memoryFreed", memoryFreed,
            "diskSpaceFreed", diskFreed
        ));
    }

    private ResourceReclaimer reclaimer() throws RecoveryStepException {
        return require(collaborators.reclaimer(), "ResourceReclaimer");
    }

    @Override
    protected RecoveryAction failedAction() {
        return RecoveryAction.RESET_AND_RESYNC;
    }

    @Override
    protected RecoveryAction nextActionOnFailure(RecoveryContext context) {
        return RecoveryAction.MANUAL_INTERVENTION;
    }
}
