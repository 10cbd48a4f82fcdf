package com.schemaops.engine.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemaops.core.exception.TaskExecutionException;
import com.schemaops.core.model.LockAnalysis;
import com.schemaops.core.model.LockLevel;
import com.schemaops.executor.sql.ResourceKeyExtractor;
import com.schemaops.executor.sql.SqlClassifier;

/**
 * Sanity checks that run without touching the database.
 *
 * {@code validationType = schema}: counts {@code schema.tables}.
 * {@code validationType = migration}: classifies each of
 * {@code migration.operations[].sql} and warns about every statement
 * that takes an ACCESS EXCLUSIVE lock.
 */
public class ValidationTaskHandler implements TaskHandler {

    public static final String VALIDATION_TYPE = "validationType";
    public static final String SCHEMA = "schema";
    public static final String MIGRATION = "migration";

    private final SqlClassifier classifier;
    private final ResourceKeyExtractor resourceKeys;

    public ValidationTaskHandler() {
        this(new SqlClassifier(), new ResourceKeyExtractor());
    }

    public ValidationTaskHandler(SqlClassifier classifier, ResourceKeyExtractor resourceKeys) {
        this.classifier = classifier;
        this.resourceKeys = resourceKeys;
    }

    @Override
    public JsonNode execute(TaskContext context) {
        String validationType = context.getMetadata(VALIDATION_TYPE, String.class);
        if (SCHEMA.equals(validationType)) {
            return validateSchema(context, context.getMetadataNode(SCHEMA));
        }
        if (MIGRATION.equals(validationType)) {
            return validateMigration(context, context.getMetadataNode(MIGRATION));
        }
        throw TaskExecutionException.permanent(TaskExecutionException.ERROR_CODE, context.getTaskId(),
            "Unknown validation type: " + validationType);
    }

    private JsonNode validateSchema(TaskContext context, JsonNode schema) {
        ObjectNode output = context.getObjectMapper().createObjectNode();
        output.put("valid", true);
        output.put("tables", schema.path("tables").size());
        output.putArray("errors");
        return output;
    }

    private JsonNode validateMigration(TaskContext context, JsonNode migration) {
        JsonNode operations = migration.path("operations");
        ObjectNode output = context.getObjectMapper().createObjectNode();
        ArrayNode warnings = context.getObjectMapper().createArrayNode();

        int highRisk = 0;
        int index = 0;
        for (JsonNode operation : operations) {
            index++;
            String sql = operation.path("sql").asText("");
            if (sql.isBlank()) {
                continue;
            }
            LockAnalysis analysis = classifier.analyze(sql);
            if (analysis.level() == LockLevel.ACCESS_EXCLUSIVE) {
                highRisk++;
                String key = resourceKeys.resourceKey(sql);
                warnings.add(String.format("%s takes an ACCESS EXCLUSIVE lock on '%s'",
                    operation.path("id").asText("statement " + index), key));
            }
        }

        output.put("valid", true);
        output.put("operations", operations.size());
        output.set("warnings", warnings);
        ObjectNode lockAnalysis = output.putObject("lockAnalysis");
        lockAnalysis.put("highRiskOperations", highRisk);
        lockAnalysis.put("estimatedDuration", "< 1s");
        return output;
    }
}
