package com.schemaops.engine.handler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemaops.core.db.QueryResult;
import com.schemaops.core.model.SqlOperation;
import com.schemaops.engine.logging.LoggingContext;
import com.schemaops.executor.LockAwareExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the task's {@code operations} one after another through the executor.
 * The first failing operation fails the task; later operations are not run.
 * Operations without an id are labelled {@code <taskId>#<index>}.
 */
public class MigrationTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(MigrationTaskHandler.class);

    public static final String OPERATIONS = "operations";

    private final LockAwareExecutor executor;

    public MigrationTaskHandler(LockAwareExecutor executor) {
        this.executor = executor;
    }

    @Override
    public JsonNode execute(TaskContext context) {
        List<SqlOperation> operations = context.getMetadata(OPERATIONS, new TypeReference<List<SqlOperation>>() { });
        if (operations == null) {
            operations = List.of();
        }

        ArrayNode results = context.getObjectMapper().createArrayNode();
        for (int i = 0; i < operations.size(); i++) {
            SqlOperation operation = operations.get(i);
            if (operation.id() == null) {
                operation = new SqlOperation(context.getTaskId() + "#" + i,
                    operation.sql(), operation.params(), operation.transaction());
            }
            QueryResult result;
            try (var ctx = LoggingContext.forOperation(operation.id(), executor.getResourceKey(operation))) {
                log.debug("Migration step {}/{}", i + 1, operations.size());
                result = executor.execute(operation, context.executionContext());
            }
            results.add(SqlTaskHandler.toJson(context, result));
        }

        ObjectNode output = context.getObjectMapper().createObjectNode();
        output.put("operations", results.size());
        output.set("results", results);
        return output;
    }
}
