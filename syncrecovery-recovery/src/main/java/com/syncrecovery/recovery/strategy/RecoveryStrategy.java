package com.syncrecovery.recovery.strategy;

import com.syncrecovery.core.model.FailureType;
import com.syncrecovery.core.model.RecoveryContext;
import com.syncrecovery.core.model.RecoveryResult;

import java.util.Set;

/**
 * A bounded procedure for resolving one class of sync failure.
 * Host applications register their own implementations with the
 * {@link RecoveryStrategyFactory}.
 */
public interface RecoveryStrategy {

    /**
     * Unique strategy name.
     */
    String name();

    /**
     * Failure types this strategy is indexed under.
     */
    Set<FailureType> failureTypes();

    /**
     * Number of attempts after which the strategy is no longer selected.
     */
    int maxAttempts();

    double backoffMultiplier();

    /**
     * Lower values are preferred when several strategies handle a type.
     */
    int priority();

    /**
     * Run the strategy. Implementations return a failed result instead of throwing.
     */
    RecoveryResult execute(RecoveryContext context);
}
