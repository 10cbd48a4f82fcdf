package com.schemaops.engine.coordinator;

import com.schemaops.core.model.TaskDefinition;

import java.time.Duration;

/**
 * Callbacks for task lifecycle transitions. Called on coordinator threads.
 */
public interface TaskListener {

    TaskListener NONE = new TaskListener() { };

    default void onTaskStarted(TaskDefinition task) {
    }

    default void onTaskCompleted(TaskDefinition task, Duration duration) {
    }

    default void onTaskFailed(TaskDefinition task, String errorCode, boolean willRetry) {
    }

    default void onTaskRetry(TaskDefinition task, int retryNumber, Duration backoff) {
    }
}
