package com.schemaops.core.exception;

/**
 * Terminal failure of a SQL operation, carrying the operation id and statement.
 */
public class OperationFailedException extends SchemaOpsException {

    public static final String ERROR_CODE = "OPERATION_FAILED";

    private final String operationId;
    private final String sql;

    public OperationFailedException(String operationId, String sql, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Operation %s failed: %s",
            operationId, cause.getMessage()
        ), cause);
        this.operationId = operationId;
        this.sql = sql;
    }

    public String getOperationId() {
        return operationId;
    }

    public String getSql() {
        return sql;
    }
}
