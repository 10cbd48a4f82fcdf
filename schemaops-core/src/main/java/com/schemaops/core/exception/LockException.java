package com.schemaops.core.exception;

/**
 * Thrown when an advisory lock operation fails.
 * Wraps the lower-level database error, if any.
 */
public class LockException extends SchemaOpsException {

    public static final String ERROR_CODE = "LOCK_ERROR";

    public LockException(String message) {
        super(ERROR_CODE, message);
    }

    public LockException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    protected LockException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
