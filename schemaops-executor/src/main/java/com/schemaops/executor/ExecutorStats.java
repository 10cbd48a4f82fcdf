package com.schemaops.executor;

/**
 * Executor snapshot for observability consumers.
 *
 * @param activeLocks resource keys with at least one running operation
 * @param activeOperations running operations across all keys
 * @param queuedOperations operations waiting for admission
 * @param recentOperations attempts finished in the last minute
 * @param successRate share of recent attempts that succeeded, 1.0 when none
 * @param averageDurationMillis mean duration of recent attempts
 */
public record ExecutorStats(
    int activeLocks,
    int activeOperations,
    int queuedOperations,
    int recentOperations,
    double successRate,
    double averageDurationMillis
) {
}
