package com.syncrecovery.engine.concurrent;

import java.time.Duration;

/**
 * Blocking delay used between retries and paced replay steps.
 * Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
