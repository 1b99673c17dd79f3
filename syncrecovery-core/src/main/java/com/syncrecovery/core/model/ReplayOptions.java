package com.syncrecovery.core.model;

import java.util.List;

/**
 * Execution options of a replay session.
 *
 * @param selectors names of registered selectors applied by the SELECTIVE strategy
 * @param speedMultiplier 0 replays unpaced; otherwise original gaps are divided by it
 */
public record ReplayOptions(
    ReplayMode mode,
    ReplayStrategy strategy,
    int maxConcurrency,
    boolean stopOnError,
    List<String> skipEvents,
    List<String> includeEvents,
    List<String> selectors,
    double speedMultiplier,
    boolean enableValidation,
    boolean enableRollback,
    int checkpointInterval
) {
    public static final int DEFAULT_CHECKPOINT_INTERVAL = 100;

    public ReplayOptions {
        mode = mode == null ? ReplayMode.SAFE : mode;
        strategy = strategy == null ? ReplayStrategy.SEQUENTIAL : strategy;
        maxConcurrency = maxConcurrency < 1 ? 1 : maxConcurrency;
        skipEvents = skipEvents == null ? List.of() : List.copyOf(skipEvents);
        includeEvents = includeEvents == null ? List.of() : List.copyOf(includeEvents);
        selectors = selectors == null ? List.of() : List.copyOf(selectors);
        checkpointInterval = checkpointInterval < 1 ? DEFAULT_CHECKPOINT_INTERVAL : checkpointInterval;
        if (speedMultiplier < 0) {
            throw new IllegalArgumentException("Speed multiplier must be >= 0");
        }
    }

    public static ReplayOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReplayMode mode = ReplayMode.SAFE;
        private ReplayStrategy strategy = ReplayStrategy.SEQUENTIAL;
        private int maxConcurrency = 1;
        private boolean stopOnError = false;
        private List<String> skipEvents = List.of();
        private List<String> includeEvents = List.of();
        private List<String> selectors = List.of();
        private double speedMultiplier = 0;
        private boolean enableValidation = true;
        private boolean enableRollback = false;
        private int checkpointInterval = DEFAULT_CHECKPOINT_INTERVAL;

        public Builder mode(ReplayMode mode) { this.mode = mode; return this; }
        public Builder strategy(ReplayStrategy strategy) { this.strategy = strategy; return this; }
        public Builder maxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; return this; }
        public Builder stopOnError(boolean stopOnError) { this.stopOnError = stopOnError; return this; }
        public Builder skipEvents(List<String> skipEvents) { this.skipEvents = skipEvents; return this; }
        public Builder includeEvents(List<String> includeEvents) { this.includeEvents = includeEvents; return this; }
        public Builder selectors(List<String> selectors) { this.selectors = selectors; return this; }
        public Builder speedMultiplier(double speedMultiplier) { this.speedMultiplier = speedMultiplier; return this; }
        public Builder enableValidation(boolean enableValidation) { this.enableValidation = enableValidation; return this; }
        public Builder enableRollback(boolean enableRollback) { this.enableRollback = enableRollback; return this; }
        public Builder checkpointInterval(int checkpointInterval) { this.checkpointInterval = checkpointInterval; return this; }

        public ReplayOptions build() {
            return new ReplayOptions(mode, strategy, maxConcurrency, stopOnError, skipEvents,
                includeEvents, selectors, speedMultiplier, enableValidation, enableRollback,
                checkpointInterval);
        }
    }
}
