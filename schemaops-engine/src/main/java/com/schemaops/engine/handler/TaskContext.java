package com.schemaops.engine.handler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemaops.core.exception.TaskExecutionException;
import com.schemaops.core.model.TaskDefinition;
import com.schemaops.executor.ExecutionContext;

import java.util.Map;

/**
 * Context provided to task handlers during one attempt.
 */
public class TaskContext {

    private final TaskDefinition task;
    private final String runId;
    private final ObjectMapper objectMapper;

    public TaskContext(TaskDefinition task, String runId, ObjectMapper objectMapper) {
        this.task = task;
        this.runId = runId;
        this.objectMapper = objectMapper;
    }

    public TaskDefinition getTask() {
        return task;
    }

    public String getTaskId() {
        return task.id();
    }

    public String getRunId() {
        return runId;
    }

    /**
     * 1 for the first attempt, incremented on each retry.
     */
    public int getAttemptNumber() {
        return task.retryCount() + 1;
    }

    public Map<String, Object> getMetadata() {
        return task.metadata();
    }

    /**
     * Metadata value converted to the given type, or null when absent.
     *
     * @throws TaskExecutionException (non-retryable) if the value cannot be converted
     */
    public <T> T getMetadata(String key, Class<T> type) {
        Object value = task.metadata().get(key);
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw invalidMetadata(key, e);
        }
    }

    public <T> T getMetadata(String key, TypeReference<T> type) {
        Object value = task.metadata().get(key);
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw invalidMetadata(key, e);
        }
    }

    /**
     * Metadata value as a JSON tree; a missing node when absent.
     */
    public JsonNode getMetadataNode(String key) {
        return objectMapper.valueToTree(task.metadata()).path(key);
    }

    /**
     * Executor context for SQL issued on behalf of this task.
     * Deadlock retries of each operation start from zero.
     */
    public ExecutionContext executionContext() {
        return new ExecutionContext(task.id(), 0, Map.of("runId", runId, "attempt", getAttemptNumber()));
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }

    private TaskExecutionException invalidMetadata(String key, IllegalArgumentException cause) {
        return new TaskExecutionException(TaskExecutionException.ERROR_CODE, task.id(),
            "Invalid metadata '" + key + "' for task " + task.id() + ": " + cause.getMessage(), cause, false);
    }
}
