package com.syncrecovery.recovery.strategy;

import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.RecoveryContext;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.recovery.spi.ConflictAnalysis;
import com.syncrecovery.recovery.spi.ConflictResolver;
import com.syncrecovery.recovery.spi.RecoveryStepException;
import com.syncrecovery.recovery.spi.ResolutionPolicy;

import java.util.Map;

/**
 * Analyzes the conflict, picks a resolution policy and applies it.
 */
public class ConflictResolutionStrategy extends AbstractRecoveryStrategy {

    public ConflictResolutionStrategy(RecoveryCollaborators collaborators) {
        super(BuiltInStrategy.CONFLICT_RESOLUTION, collaborators);
    }

    @Override
    protected RecoveryResult attempt(RecoveryContext context) throws RecoveryStepException {
        ConflictResolver resolver = require(collaborators.conflictResolver(), "ConflictResolver");

        ConflictAnalysis analysis = resolver.analyze(context.operation(), context.classification());
        ResolutionPolicy policy = ResolutionPolicy.forAnalysis(analysis);
        int resolved = resolver.resolve(context.operation(), analysis, policy);

        return success(RecoveryAction.FALLBACK_STRATEGY, Map.of(
            "conflictType", analysis.conflictType(),
            "resolutionStrategy", policy.name(),
            "recordsResolved", resolved
        ));
    }

    @Override
    protected RecoveryAction failedAction() {
        return RecoveryAction.FALLBACK_STRATEGY;
    }

    @Override
    protected RecoveryAction nextActionOnFailure(RecoveryContext context) {
        return RecoveryAction.MANUAL_INTERVENTION;
    }
}
