package com.syncrecovery.recovery.strategy;

import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.RecoveryContext;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.recovery.spi.RecoveryStepException;

import java.time.Instant;
import java.util.Map;

/**
 * Refreshes credentials, then retries the operation once.
 */
public class AuthRecoveryStrategy extends AbstractRecoveryStrategy {

    public AuthRecoveryStrategy(RecoveryCollaborators collaborators) {
        super(BuiltInStrategy.AUTH_RECOVERY, collaborators);
    }

    @Override
    protected RecoveryResult attempt(RecoveryContext context) throws RecoveryStepException {
        if (!canRetry(context)) {
            return retryRefused(context);
        }

        Instant expiry = require(collaborators.credentials(), "CredentialProvider").refresh();
        require(collaborators.executor(), "SyncOperationExecutor").reissue(context.operation());

        return success(RecoveryAction.RETRY, Map.of(
            "tokenRefreshed", true,
            "newTokenExpiry", String.valueOf(expiry)
        ));
    }

    @Override
    protected RecoveryAction failedAction() {
        return RecoveryAction.RETRY;
    }

    @Override
    protected RecoveryAction nextActionOnFailure(RecoveryContext context) {
        return RecoveryAction.ESCALATE;
    }
}
