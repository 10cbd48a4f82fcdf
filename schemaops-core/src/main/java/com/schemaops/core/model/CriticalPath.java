package com.schemaops.core.model;

import java.util.List;

/**
 * Longest-duration dependency chain through a task graph.
 *
 * @param path task ids from the first task of the chain to the last
 * @param duration accumulated estimated duration along the chain
 * @param tasks task definitions matching {@code path}
 */
public record CriticalPath(List<String> path, long duration, List<TaskDefinition> tasks) {

    public CriticalPath {
        path = List.copyOf(path);
        tasks = List.copyOf(tasks);
    }

    public static CriticalPath empty() {
        return new CriticalPath(List.of(), 0, List.of());
    }
}
