package com.schemaops.core.model;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff between attempts.
 * Immutable and shared by the executor (deadlock retries) and the
 * coordinator (task retries).
 *
 * Invariants:
 * - initialBackoff >= 0
 * - maxBackoff >= initialBackoff
 * - multiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record BackoffPolicy(
    Duration initialBackoff,
    Duration maxBackoff,
    double multiplier,
    double jitterFactor
) {
    /**
     * Default policy: 1s, 2s, 4s, ... capped at 5 minutes, no jitter.
     */
    public static BackoffPolicy exponential() {
        return new BackoffPolicy(Duration.ofSeconds(1), Duration.ofMinutes(5), 2.0, 0.0);
    }

    /**
     * Same doubling shape starting from a custom delay.
     */
    public static BackoffPolicy exponential(Duration initialBackoff) {
        return new BackoffPolicy(initialBackoff, Duration.ofMinutes(5), 2.0, 0.0);
    }

    /**
     * No waiting between attempts.
     */
    public static BackoffPolicy none() {
        return new BackoffPolicy(Duration.ZERO, Duration.ZERO, 1.0, 0.0);
    }

    public BackoffPolicy {
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
    }

    /**
     * Delay before the given retry. Callers pass the number of failed attempts
     * so far, so the exponential default gives 1s, 2s, then 4s.
     *
     * @param retryNumber 1 for the first retry, 2 for the second, ...
     * @return initialBackoff * multiplier^(retryNumber - 1), capped and jittered
     */
    public Duration computeBackoff(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("Retry number must be >= 1");
        }

        double baseMs = initialBackoff.toMillis() * Math.pow(multiplier, retryNumber - 1);
        double cappedMs = Math.min(baseMs, maxBackoff.toMillis());

        double jitterRange = cappedMs * jitterFactor;
        double jitteredMs = cappedMs - jitterRange
            + ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;

        return Duration.ofMillis((long) jitteredMs);
    }
}
