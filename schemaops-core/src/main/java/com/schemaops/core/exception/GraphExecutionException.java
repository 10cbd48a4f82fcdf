package com.schemaops.core.exception;

import java.util.Set;

/**
 * Thrown when a task graph run cannot make further progress.
 */
public class GraphExecutionException extends SchemaOpsException {

    public static final String ERROR_CODE = "GRAPH_EXECUTION_FAILED";

    private final Set<String> failedTaskIds;

    public GraphExecutionException(Set<String> failedTaskIds) {
        super(ERROR_CODE, "Tasks failed: " + String.join(", ", failedTaskIds));
        this.failedTaskIds = Set.copyOf(failedTaskIds);
    }

    public GraphExecutionException(String message) {
        super(ERROR_CODE, message);
        this.failedTaskIds = Set.of();
    }

    public Set<String> getFailedTaskIds() {
        return failedTaskIds;
    }
}
