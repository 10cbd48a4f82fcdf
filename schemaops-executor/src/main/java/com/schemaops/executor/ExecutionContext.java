package com.schemaops.executor;

import java.util.Map;

/**
 * Caller context carried with an operation.
 *
 * @param taskId owning task, if any
 * @param retryCount deadlock retries already made for this operation
 * @param attributes free-form values for listeners and logs
 */
public record ExecutionContext(String taskId, int retryCount, Map<String, Object> attributes) {

    public ExecutionContext {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static ExecutionContext empty() {
        return new ExecutionContext(null, 0, Map.of());
    }

    public static ExecutionContext forTask(String taskId) {
        return new ExecutionContext(taskId, 0, Map.of());
    }

    public ExecutionContext withRetry() {
        return new ExecutionContext(taskId, retryCount + 1, attributes);
    }
}
