package com.schemaops.executor;

import com.schemaops.core.model.BackoffPolicy;

import java.time.Duration;

/**
 * Lock-aware executor configuration.
 *
 * @param maxConcurrency worker threads running statements
 * @param lockTimeout server-side lock_timeout per statement, and the longest
 *                    an operation may wait in the executor queue
 * @param deadlockRetries retries after the database reports a deadlock
 * @param backpressureThreshold pool utilisation above which new work is queued
 * @param deadlockBackoff delay before each deadlock retry
 */
public record ExecutorSettings(
    int maxConcurrency,
    Duration lockTimeout,
    int deadlockRetries,
    double backpressureThreshold,
    BackoffPolicy deadlockBackoff
) {
    public static final int DEFAULT_MAX_CONCURRENCY = 4;
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_DEADLOCK_RETRIES = 3;
    public static final double DEFAULT_BACKPRESSURE_THRESHOLD = 0.8;

    public ExecutorSettings {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1");
        }
        if (lockTimeout == null || lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive");
        }
        if (deadlockRetries < 0) {
            throw new IllegalArgumentException("deadlockRetries must be >= 0");
        }
        if (backpressureThreshold <= 0.0 || backpressureThreshold > 1.0) {
            throw new IllegalArgumentException("backpressureThreshold must be in (0.0, 1.0]");
        }
        if (deadlockBackoff == null) {
            deadlockBackoff = BackoffPolicy.exponential();
        }
    }

    public static ExecutorSettings defaults() {
        return new ExecutorSettings(DEFAULT_MAX_CONCURRENCY, DEFAULT_LOCK_TIMEOUT,
            DEFAULT_DEADLOCK_RETRIES, DEFAULT_BACKPRESSURE_THRESHOLD, BackoffPolicy.exponential());
    }

    public ExecutorSettings withLockTimeout(Duration lockTimeout) {
        return new ExecutorSettings(maxConcurrency, lockTimeout, deadlockRetries, backpressureThreshold, deadlockBackoff);
    }

    public ExecutorSettings withBackpressureThreshold(double threshold) {
        return new ExecutorSettings(maxConcurrency, lockTimeout, deadlockRetries, threshold, deadlockBackoff);
    }
}
