package com.syncrecovery.core.model;

import java.time.Duration;

/**
 * Exponential backoff used by recovery strategies.
 * Immutable and shared across strategies.
 * 
 * Invariants:
 * - initialDelay >= 0
 * - maxDelay >= initialDelay
 * - multiplier >= 1.0
 */
public record BackoffPolicy(
    Duration initialDelay,
    Duration maxDelay,
    double multiplier
) {
    public BackoffPolicy {
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("Initial delay must be >= 0");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("Max delay must be >= initial delay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be >= 1.0");
        }
    }

    /**
     * Default policy: 1s doubling, capped at 30s.
     */
    public static BackoffPolicy defaultPolicy() {
        return new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);
    }

    /**
     * Fixed delay on every attempt.
     */
    public static BackoffPolicy fixed(Duration delay) {
        return new BackoffPolicy(delay, delay, 1.0);
    }

    /**
     * No waiting at all.
     */
    public static BackoffPolicy none() {
        return fixed(Duration.ZERO);
    }

    /**
     * Compute the delay before an attempt.
     * 
     * @param attempt 0-indexed number of attempts already made
     * @return min(initialDelay * multiplier^attempt, maxDelay)
     */
    public Duration computeDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt must be >= 0");
        }
        double delayMs = initialDelay.toMillis() * Math.pow(multiplier, attempt);
        double cappedMs = Math.min(delayMs, maxDelay.toMillis());
        return Duration.ofMillis((long) cappedMs);
    }

    public BackoffPolicy withMultiplier(double newMultiplier) {
        return new BackoffPolicy(initialDelay, maxDelay, newMultiplier);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public BackoffPolicy build() {
            return new BackoffPolicy(initialDelay, maxDelay, multiplier);
        }
    }
}
