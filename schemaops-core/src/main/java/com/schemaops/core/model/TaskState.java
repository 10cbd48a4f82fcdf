package com.schemaops.core.model;

/**
 * Lifecycle states of a task within one graph run. Finished attempts are
 * recorded as COMPLETED, FAILED or TIMED_OUT.
 */
public enum TaskState {
    /**
     * Waiting for dependencies or a free slot.
     * Transitions: -> RUNNING
     */
    PENDING,

    /**
     * Currently executing.
     * Transitions: -> COMPLETED, FAILED, TIMED_OUT
     */
    RUNNING,

    /**
     * Backing off before another attempt.
     * Transitions: -> RUNNING
     */
    RETRYING,

    /**
     * Finished successfully. Terminal state.
     */
    COMPLETED,

    /**
     * Attempt failed with an error.
     * Transitions: -> RETRYING (if retries available)
     */
    FAILED,

    /**
     * Attempt exceeded the task timeout.
     * Transitions: -> RETRYING (if retries available)
     */
    TIMED_OUT
}
