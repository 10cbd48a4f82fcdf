package com.schemaops.engine.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.schemaops.core.exception.TaskExecutionException;

/**
 * Runs one kind of task.
 * The coordinator picks a handler by the task's type and applies the
 * timeout and retry policy around it.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Execute one attempt of the task.
     *
     * @param context the task being run and helpers for reading its metadata
     * @return the task output
     * @throws TaskExecutionException if the task fails; non-retryable failures
     *         skip the remaining retry budget
     */
    JsonNode execute(TaskContext context) throws TaskExecutionException;
}
