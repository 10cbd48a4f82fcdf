package com.schemaops.executor;

import com.schemaops.core.model.LockAnalysis;

import java.time.Instant;

/**
 * An operation cleared to run on a resource key. Exists from reservation
 * until the operation's cleanup, whatever its outcome. Compared by identity.
 */
public final class ActiveOperation {

    private final String operationId;
    private final LockAnalysis analysis;
    private final Instant startTime;
    private final String resourceKey;

    ActiveOperation(String operationId, LockAnalysis analysis, Instant startTime, String resourceKey) {
        this.operationId = operationId;
        this.analysis = analysis;
        this.startTime = startTime;
        this.resourceKey = resourceKey;
    }

    public String operationId() {
        return operationId;
    }

    public LockAnalysis analysis() {
        return analysis;
    }

    public Instant startTime() {
        return startTime;
    }

    public String resourceKey() {
        return resourceKey;
    }

    @Override
    public String toString() {
        return operationId + "[" + analysis.level() + " on '" + resourceKey + "']";
    }
}
