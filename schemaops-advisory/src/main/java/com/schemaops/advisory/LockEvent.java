package com.schemaops.advisory;

import java.time.Duration;
import java.time.Instant;

/**
 * Lifecycle notification for an advisory lock.
 *
 * @param duration held duration for RELEASED, wait bound for TIMEOUT, otherwise zero
 */
public record LockEvent(
    Type type,
    int lockKey,
    String identifier,
    String sessionId,
    LockType lockType,
    Duration duration,
    Instant timestamp
) {
    public enum Type {
        ATTEMPT,
        ACQUIRED,
        RELEASED,
        TIMEOUT
    }
}
