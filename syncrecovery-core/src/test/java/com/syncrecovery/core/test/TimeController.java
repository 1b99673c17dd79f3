package com.syncrecovery.core.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link Clock} that only moves when a test advances it.
 * Retention windows, rollback point expiry and backup ages are checked
 * against it without waiting.
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> current;
    private final ZoneId zone;

    public TimeController(Instant start) {
        this(new AtomicReference<>(start), ZoneOffset.UTC);
    }

    private TimeController(AtomicReference<Instant> current, ZoneId zone) {
        this.current = current;
        this.zone = zone;
    }

    @Override
    public Instant instant() {
        return current.get();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId newZone) {
        return new TimeController(current, newZone);
    }

    public void advance(Duration duration) {
        current.updateAndGet(t -> t.plus(duration));
    }

    public void advanceDays(long days) {
        advance(Duration.ofDays(days));
    }
}
