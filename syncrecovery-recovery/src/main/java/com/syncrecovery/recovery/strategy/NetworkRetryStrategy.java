package com.syncrecovery.recovery.strategy;

import com.syncrecovery.core.model.NetworkStatus;
import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.RecoveryContext;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.recovery.spi.RecoveryStepException;

import java.time.Duration;
import java.util.Map;

/**
 * Backs off, re-checks connectivity and re-issues the operation.
 */
public class NetworkRetryStrategy extends AbstractRecoveryStrategy {

    public NetworkRetryStrategy(RecoveryCollaborators collaborators) {
        super(BuiltInStrategy.NETWORK_RETRY, collaborators);
    }

    @Override
    protected RecoveryResult attempt(RecoveryContext context) throws RecoveryStepException, InterruptedException {
        if (!canRetry(context)) {
            return retryRefused(context);
        }

        Duration delay = backoff(context);

        NetworkStatus network = collaborators.systemState().probeNetwork();
        if (network == NetworkStatus.OFFLINE) {
            throw new RecoveryStepException("NETWORK_UNAVAILABLE", "Network connection still unhealthy");
        }

        require(collaborators.executor(), "SyncOperationExecutor").reissue(context.operation());

        return success(RecoveryAction.BACKOFF_RETRY, Map.of(
            "attempt", context.previousAttempts() + 1,
            "delay", delay.toMillis(),
            "networkHealth", network.name()
        ));
    }

    @Override
    protected RecoveryAction failedAction() {
        return RecoveryAction.BACKOFF_RETRY;
    }

    /**
     * The last allowed attempt escalates.
     */
    @Override
    protected RecoveryAction nextActionOnFailure(RecoveryContext context) {
        return context.previousAttempts() + 1 >= maxAttempts() ? RecoveryAction.ESCALATE : null;
    }
}
