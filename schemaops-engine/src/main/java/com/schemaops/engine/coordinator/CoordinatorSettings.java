package com.schemaops.engine.coordinator;

import com.schemaops.core.model.BackoffPolicy;

import java.time.Duration;

/**
 * Task graph coordinator configuration.
 *
 * @param maxConcurrentTasks tasks allowed to run at once
 * @param shutdownGracePeriod how long shutdown waits for running tasks
 * @param retryBackoff delay before each task retry
 */
public record CoordinatorSettings(
    int maxConcurrentTasks,
    Duration shutdownGracePeriod,
    BackoffPolicy retryBackoff
) {
    public static final int DEFAULT_MAX_CONCURRENT_TASKS = 3;
    public static final Duration DEFAULT_SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(30);

    public CoordinatorSettings {
        if (maxConcurrentTasks < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be >= 1");
        }
        if (shutdownGracePeriod == null || shutdownGracePeriod.isNegative()) {
            throw new IllegalArgumentException("shutdownGracePeriod must not be negative");
        }
        if (retryBackoff == null) {
            retryBackoff = BackoffPolicy.exponential();
        }
    }

    public static CoordinatorSettings defaults() {
        return new CoordinatorSettings(DEFAULT_MAX_CONCURRENT_TASKS, DEFAULT_SHUTDOWN_GRACE_PERIOD,
            BackoffPolicy.exponential());
    }

    public CoordinatorSettings withMaxConcurrentTasks(int maxConcurrentTasks) {
        return new CoordinatorSettings(maxConcurrentTasks, shutdownGracePeriod, retryBackoff);
    }
}
