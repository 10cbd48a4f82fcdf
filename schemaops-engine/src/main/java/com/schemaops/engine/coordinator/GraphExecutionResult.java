package com.schemaops.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one task graph run. A failed run still reports how far it got.
 *
 * @param success every task completed
 * @param error why the run stopped; null on success
 * @param duration wall time of the run
 * @param completedTasks tasks that completed
 * @param failedTasks tasks that failed permanently
 * @param results output of each completed task, in completion order
 */
public record GraphExecutionResult(
    boolean success,
    String error,
    Duration duration,
    int completedTasks,
    int failedTasks,
    Map<String, JsonNode> results
) {
    public GraphExecutionResult {
        results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }
}
