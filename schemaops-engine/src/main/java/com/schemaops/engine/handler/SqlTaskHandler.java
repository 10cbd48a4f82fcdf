package com.schemaops.engine.handler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemaops.core.db.QueryResult;
import com.schemaops.core.exception.TaskExecutionException;
import com.schemaops.core.model.SqlOperation;
import com.schemaops.engine.logging.LoggingContext;
import com.schemaops.executor.LockAwareExecutor;

import java.util.List;

/**
 * Runs a single statement from the task's metadata through the executor.
 *
 * Metadata: {@code sql} (required), {@code params}, {@code transaction}.
 * Output: {@code rowCount} and {@code rows}.
 */
public class SqlTaskHandler implements TaskHandler {

    public static final String SQL = "sql";
    public static final String PARAMS = "params";
    public static final String TRANSACTION = "transaction";

    private final LockAwareExecutor executor;

    public SqlTaskHandler(LockAwareExecutor executor) {
        this.executor = executor;
    }

    @Override
    public JsonNode execute(TaskContext context) {
        String sql = context.getMetadata(SQL, String.class);
        if (sql == null || sql.isBlank()) {
            throw TaskExecutionException.permanent(TaskExecutionException.ERROR_CODE, context.getTaskId(),
                "SQL task " + context.getTaskId() + " has no sql");
        }
        List<Object> params = context.getMetadata(PARAMS, new TypeReference<List<Object>>() { });
        Boolean transaction = context.getMetadata(TRANSACTION, Boolean.class);

        SqlOperation operation = new SqlOperation(context.getTaskId(), sql, params, Boolean.TRUE.equals(transaction));
        QueryResult result;
        try (var ctx = LoggingContext.forOperation(operation.id(), executor.getResourceKey(operation))) {
            result = executor.execute(operation, context.executionContext());
        }
        return toJson(context, result);
    }

    static ObjectNode toJson(TaskContext context, QueryResult result) {
        ObjectNode node = context.getObjectMapper().createObjectNode();
        node.put("rowCount", result.rowCount());
        node.set("rows", context.toJsonNode(result.rows()));
        return node;
    }
}
