package com.schemaops.advisory;

import java.time.Duration;

/**
 * Outcome of a release call.
 *
 * @param released false when the session did not hold the lock
 * @param heldFor time since acquisition, zero when unknown or not released
 */
public record LockRelease(int lockKey, boolean released, String sessionId, Duration heldFor) {
}
