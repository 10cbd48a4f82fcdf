package com.schemaops.engine.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;

/**
 * Records a code generation step. Generators run outside the orchestrator;
 * this handler reports the generator name and the expected artifact count.
 */
public class GenerationTaskHandler implements TaskHandler {

    public static final String GENERATOR = "generator";
    public static final String EXPECTED_FILES = "expectedFiles";

    private final Clock clock;

    public GenerationTaskHandler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public JsonNode execute(TaskContext context) {
        Integer expectedFiles = context.getMetadata(EXPECTED_FILES, Integer.class);

        ObjectNode output = context.getObjectMapper().createObjectNode();
        output.put("generator", context.getMetadata(GENERATOR, String.class));
        output.put("filesGenerated", expectedFiles != null ? expectedFiles : 1);
        output.put("timestamp", clock.instant().toString());
        return output;
    }
}
