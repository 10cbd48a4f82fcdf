package com.schemaops.executor;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one execution attempt, kept in the rolling history.
 */
public record OperationRecord(
    String operation,
    Status status,
    Duration duration,
    Instant timestamp,
    String error
) {
    public enum Status {
        SUCCESS,
        ERROR
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }
}
