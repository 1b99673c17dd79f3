package com.syncrecovery.recovery.strategy;

import com.syncrecovery.core.model.BackoffPolicy;
import com.syncrecovery.core.model.FailureType;
import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.RecoveryContext;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.core.model.SyncError;
import com.syncrecovery.core.model.SystemState;
import com.syncrecovery.recovery.spi.RecoveryStepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Base for strategies that run a sequence of collaborator steps.
 *
 * Subclasses implement {@link #attempt(RecoveryContext)} and throw
 * {@link RecoveryStepException} when a step fails; the failure is turned
 * into a failed {@link RecoveryResult} here, so nothing escapes execute().
 */
public abstract class AbstractRecoveryStrategy implements RecoveryStrategy {

    private static final Logger log = LoggerFactory.getLogger(AbstractRecoveryStrategy.class);

    protected final RecoveryCollaborators collaborators;

    private final String name;
    private final Set<FailureType> failureTypes;
    private final int maxAttempts;
    private final double backoffMultiplier;
    private final int priority;

    protected AbstractRecoveryStrategy(String name, Set<FailureType> failureTypes, int maxAttempts,
                                       double backoffMultiplier, int priority,
                                       RecoveryCollaborators collaborators) {
        this.name = name;
        this.failureTypes = Set.copyOf(failureTypes);
        this.maxAttempts = maxAttempts;
        this.backoffMultiplier = backoffMultiplier;
        this.priority = priority;
        this.collaborators = collaborators;
    }

    protected AbstractRecoveryStrategy(BuiltInStrategy descriptor, RecoveryCollaborators collaborators) {
        this(descriptor.strategyName(), descriptor.failureTypes(), descriptor.maxAttempts(),
            descriptor.backoffMultiplier(), descriptor.priority(), collaborators);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<FailureType> failureTypes() {
        return failureTypes;
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public double backoffMultiplier() {
        return backoffMultiplier;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public final RecoveryResult execute(RecoveryContext context) {
        Instant started = collaborators.clock().instant();
        RecoveryResult result;
        try {
            result = attempt(context);
        } catch (RecoveryStepException e) {
            log.warn("{} failed for operation {}: {}", name, context.operation().id(), e.getMessage());
            result = failure(context, failedAction(), e.getMessage(), nextActionOnFailure(context));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = failure(context, failedAction(), "Interrupted while recovering", nextActionOnFailure(context));
        } catch (RuntimeException e) {
            log.error("{} raised an unexpected error for operation {}", name, context.operation().id(), e);
            result = failure(context, failedAction(), e.getMessage(), nextActionOnFailure(context));
        }
        return result.withDuration(Duration.between(started, collaborators.clock().instant()));
    }

    /**
     * Run the recovery steps.
     *
     * @return A success result, or a failure the strategy decided on itself
     */
    protected abstract RecoveryResult attempt(RecoveryContext context)
        throws RecoveryStepException, InterruptedException;

    /**
     * Action reported when a step throws.
     */
    protected abstract RecoveryAction failedAction();

    /**
     * Escalation hint attached when a step throws.
     */
    protected RecoveryAction nextActionOnFailure(RecoveryContext context) {
        return null;
    }

    // ========== Helpers ==========

    public static boolean isSystemHealthy(SystemState state) {
        return state != null && state.isHealthy();
    }

    /**
     * Budget left and the host healthy enough for another automated attempt.
     */
    protected boolean canRetry(RecoveryContext context) {
        return context.previousAttempts() < maxAttempts && isSystemHealthy(context.systemState());
    }

    protected RecoveryResult retryRefused(RecoveryContext context) {
        return failure(context, RecoveryAction.MANUAL_INTERVENTION,
            "Max retry attempts exceeded or system unhealthy", RecoveryAction.ESCALATE);
    }

    /**
     * Wait the backoff delay for the current attempt.
     *
     * @return The delay waited
     */
    protected Duration backoff(RecoveryContext context) throws InterruptedException {
        BackoffPolicy policy = collaborators.backoff().withMultiplier(backoffMultiplier);
        Duration delay = policy.computeDelay(context.previousAttempts());
        log.debug("{} backing off {}ms before attempt {}", name, delay.toMillis(), context.previousAttempts() + 1);
        collaborators.sleeper().sleep(delay);
        return delay;
    }

    protected <T> T require(T collaborator, String description) throws RecoveryStepException {
        if (collaborator == null) {
            throw RecoveryStepException.missingCollaborator(description);
        }
        return collaborator;
    }

    protected RecoveryResult success(RecoveryAction action, Map<String, Object> metadata) {
        return RecoveryResult.success(action, Duration.ZERO, name + " executed successfully", metadata);
    }

    protected RecoveryResult failure(RecoveryContext context, RecoveryAction action, String message,
                                     RecoveryAction nextAction) {
        SyncError error = new SyncError(
            RecoveryResult.STRATEGY_FAILED,
            name + " failed: " + message,
            Map.of("strategy", name, "previousAttempts", context.previousAttempts()),
            collaborators.clock().instant(),
            canRetry(context)
        );
        return RecoveryResult.failure(action, Duration.ZERO, error, nextAction);
    }
}
