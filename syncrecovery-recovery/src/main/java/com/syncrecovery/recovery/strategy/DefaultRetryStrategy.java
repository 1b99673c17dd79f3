package com.syncrecovery.recovery.strategy;

import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.RecoveryContext;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.recovery.spi.RecoveryStepException;

import java.time.Duration;
import java.util.Map;

/**
 * Type-agnostic fallback: back off and re-issue.
 */
public class DefaultRetryStrategy extends AbstractRecoveryStrategy {

    public DefaultRetryStrategy(RecoveryCollaborators collaborators) {
        super(BuiltInStrategy.DEFAULT_RETRY, collaborators);
    }

    @Override
    protected RecoveryResult attempt(RecoveryContext context) throws RecoveryStepException, InterruptedException {
        if (!canRetry(context)) {
            return retryRefused(context);
        }

        Duration delay = backoff(context);
        require(collaborators.executor(), "SyncOperationExecutor").reissue(context.operation());

        return success(RecoveryAction.RETRY, Map.of(
            "attempt", context.previousAttempts() + 1,
            "delay", delay.toMillis()
        ));
    }

    @Override
    protected RecoveryAction failedAction() {
        return RecoveryAction.RETRY;
    }
}
