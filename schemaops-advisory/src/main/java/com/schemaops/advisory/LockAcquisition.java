package com.schemaops.advisory;

/**
 * Outcome of an acquire call. Blocking acquisitions either return
 * {@code acquired = true} or throw.
 */
public record LockAcquisition(int lockKey, TwoPartKey twoPartKey, boolean acquired, String sessionId) {
}
