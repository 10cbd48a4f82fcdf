package com.schemaops.core.exception;

/**
 * Thrown when a task definition is invalid.
 */
public class TaskValidationException extends SchemaOpsException {

    public static final String ERROR_CODE = "TASK_VALIDATION_FAILED";

    public TaskValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public TaskValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid task definition: %s - %s", field, reason));
    }
}
