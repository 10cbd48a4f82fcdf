package com.schemaops.advisory;

import java.time.Instant;

/**
 * Cached view of a lock this process acquired. The database session owns
 * the lock itself; this record can go stale if a connection is recycled
 * without an explicit release.
 *
 * @param holdCount number of times the session acquired the lock without releasing it
 */
public record LockRecord(
    int lockKey,
    TwoPartKey twoPartKey,
    String identifier,
    LockType lockType,
    String sessionId,
    Instant acquiredAt,
    int holdCount
) {
    LockRecord reacquired() {
        return new LockRecord(lockKey, twoPartKey, identifier, lockType, sessionId, acquiredAt, holdCount + 1);
    }

    LockRecord released() {
        return new LockRecord(lockKey, twoPartKey, identifier, lockType, sessionId, acquiredAt, holdCount - 1);
    }
}
