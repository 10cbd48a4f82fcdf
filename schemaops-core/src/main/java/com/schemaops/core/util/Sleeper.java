package com.schemaops.core.util;

import java.time.Duration;

/**
 * Pause used for backoff delays. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
