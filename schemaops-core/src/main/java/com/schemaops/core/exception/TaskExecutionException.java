package com.schemaops.core.exception;

/**
 * Thrown when a task fails to execute.
 * Non-retryable failures skip the task's remaining retry budget.
 */
public class TaskExecutionException extends SchemaOpsException {

    public static final String ERROR_CODE = "TASK_FAILED";
    public static final String TIMEOUT = "TASK_TIMEOUT";
    public static final String UNKNOWN_TASK_TYPE = "UNKNOWN_TASK_TYPE";

    private final String taskId;
    private final boolean retryable;

    public TaskExecutionException(String taskId, String message, Throwable cause) {
        this(ERROR_CODE, taskId, message, cause, true);
    }

    public TaskExecutionException(String errorCode, String taskId, String message, Throwable cause, boolean retryable) {
        super(errorCode, message, cause);
        this.taskId = taskId;
        this.retryable = retryable;
    }

    public String getTaskId() {
        return taskId;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static TaskExecutionException permanent(String errorCode, String taskId, String message) {
        return new TaskExecutionException(errorCode, taskId, message, null, false);
    }

    public static TaskExecutionException timedOut(String taskId, long timeoutMillis) {
        return new TaskExecutionException(TIMEOUT, taskId,
            String.format("Task %s timed out after %dms", taskId, timeoutMillis), null, true);
    }
}
