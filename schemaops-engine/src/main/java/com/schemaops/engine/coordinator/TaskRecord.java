package com.schemaops.engine.coordinator;

import com.schemaops.core.model.TaskState;

import java.time.Duration;
import java.time.Instant;

/**
 * One finished task attempt, kept for statistics.
 *
 * @param state COMPLETED, FAILED or TIMED_OUT
 */
public record TaskRecord(
    String taskId,
    String taskType,
    TaskState state,
    Duration duration,
    Instant timestamp,
    String error,
    int retryCount
) {
    public boolean succeeded() {
        return state == TaskState.COMPLETED;
    }
}
