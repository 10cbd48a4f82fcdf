package com.schemaops.advisory;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached lock with its current held duration.
 */
public record LockDetail(
    int lockKey,
    String identifier,
    LockType lockType,
    String sessionId,
    Instant acquiredAt,
    Duration heldFor,
    int holdCount
) {
}
