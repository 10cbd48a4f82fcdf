package com.schemaops.core.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Manually advanced clock for time-dependent assertions such as lock hold
 * durations, without real waiting.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = TimeController.frozenAt(Instant.parse("2024-01-01T00:00:00Z"));
 * manager = new AdvisoryLockManager(connection, settings, listener, time);
 * manager.acquireExclusiveLock("users");
 * time.advanceSeconds(5);
 * assertThat(manager.releaseLock("users").heldFor()).isEqualTo(Duration.ofSeconds(5));
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;

    private TimeController(AtomicReference<Instant> currentTime) {
        this.currentTime = currentTime;
    }

    public static TimeController frozenAt(Instant time) {
        return new TimeController(new AtomicReference<>(time));
    }

    public static TimeController frozen() {
        return frozenAt(Instant.now());
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    public void advance(Duration duration) {
        currentTime.updateAndGet(t -> t.plus(duration));
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }
}
