package com.schemaops.executor;

import com.schemaops.core.model.LockAnalysis;
import com.schemaops.core.model.SqlOperation;

import java.time.Duration;

/**
 * Hook for executor telemetry. All methods default to no-ops.
 */
public interface ExecutionListener {

    ExecutionListener NONE = new ExecutionListener() { };

    default void onQueued(SqlOperation operation, String resourceKey, LockAnalysis analysis) {
    }

    default void onCompleted(SqlOperation operation, LockAnalysis analysis, Duration duration, boolean success) {
    }

    default void onDeadlockRetry(SqlOperation operation, int retryNumber, Duration backoff) {
    }

    default void onQueueTimeout(SqlOperation operation, String resourceKey) {
    }
}
