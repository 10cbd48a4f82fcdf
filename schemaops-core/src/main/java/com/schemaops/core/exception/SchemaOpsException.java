package com.schemaops.core.exception;

/**
 * Base exception for all orchestration errors.
 */
public class SchemaOpsException extends RuntimeException {

    private final String errorCode;

    public SchemaOpsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SchemaOpsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
