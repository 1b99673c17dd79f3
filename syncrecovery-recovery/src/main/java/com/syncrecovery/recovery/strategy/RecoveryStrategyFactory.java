package com.syncrecovery.recovery.strategy;

import com.syncrecovery.core.model.FailureType;
import com.syncrecovery.core.model.RecoveryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the recovery strategy for a failure.
 *
 * Strategies registered for the failure type are tried in priority order;
 * the first one with budget left for the context's attempt count wins.
 * When none qualifies the default retry strategy is returned.
 */
public class RecoveryStrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(RecoveryStrategyFactory.class);

    private static final Comparator<RecoveryStrategy> BY_PRIORITY =
        Comparator.comparingInt(RecoveryStrategy::priority);

    private final Map<String, RecoveryStrategy> byName = new LinkedHashMap<>();
    private final Map<FailureType, List<RecoveryStrategy>> byType = new EnumMap<>(FailureType.class);
    private final RecoveryStrategy builtInFallback;

    public RecoveryStrategyFactory(RecoveryCollaborators collaborators) {
        for (BuiltInStrategy builtIn : BuiltInStrategy.values()) {
            register(builtIn.create(collaborators));
        }
        this.builtInFallback = byName.get(BuiltInStrategy.DEFAULT_RETRY.strategyName());
    }

    /**
     * Select the strategy for a failure type and attempt count.
     */
    public synchronized RecoveryStrategy select(FailureType failureType, RecoveryContext context) {
        for (RecoveryStrategy candidate : byType.getOrDefault(failureType, List.of())) {
            if (candidate.maxAttempts() > context.previousAttempts()) {
                return candidate;
            }
        }
        RecoveryStrategy fallback = byName.getOrDefault(BuiltInStrategy.DEFAULT_RETRY.strategyName(), builtInFallback);
        log.debug("No strategy with budget left for {} after {} attempts, using {}",
            failureType, context.previousAttempts(), fallback.name());
        return fallback;
    }

    /**
     * Register a strategy under every failure type it declares.
     * A strategy with the same name is replaced.
     */
    public synchronized void register(RecoveryStrategy strategy) {
        if (byName.containsKey(strategy.name())) {
            unregister(strategy.name());
        }
        byName.put(strategy.name(), strategy);
        for (FailureType type : strategy.failureTypes()) {
            List<RecoveryStrategy> candidates = byType.computeIfAbsent(type, t -> new ArrayList<>());
            candidates.add(strategy);
            // Stable sort keeps registration order among equal priorities
            candidates.sort(BY_PRIORITY);
        }
        log.info("Registered recovery strategy {} for {}", strategy.name(), strategy.failureTypes());
    }

    /**
     * Remove a strategy from every index. The built-in default retry stays
     * available to select() even when unregistered; a strategy registered
     * under its name replaces it as the fallback.
     *
     * @return true if the strategy was registered
     */
    public synchronized boolean unregister(String name) {
        RecoveryStrategy removed = byName.remove(name);
        if (removed == null) {
            return false;
        }
        byType.values().forEach(candidates -> candidates.remove(removed));
        log.info("Unregistered recovery strategy {}", name);
        return true;
    }

    public synchronized Optional<RecoveryStrategy> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * All registered strategies, by priority then name.
     */
    public synchronized List<RecoveryStrategy> listStrategies() {
        List<RecoveryStrategy> strategies = new ArrayList<>(byName.values());
        strategies.sort(BY_PRIORITY.thenComparing(RecoveryStrategy::name));
        return strategies;
    }
}
