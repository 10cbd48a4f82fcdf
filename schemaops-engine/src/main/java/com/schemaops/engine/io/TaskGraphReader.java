package com.schemaops.engine.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemaops.core.exception.TaskValidationException;
import com.schemaops.core.model.TaskDefinition;
import com.schemaops.core.model.TaskGraph;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a task graph from a JSON array of task specs.
 *
 * <pre>
 * [
 *   {"id": "add-column", "priority": 5, "timeout": 60000,
 *    "metadata": {"type": "sql", "sql": "ALTER TABLE users ADD COLUMN age int"}},
 *   {"id": "backfill", "dependencies": ["add-column"],
 *    "metadata": {"type": "migration", "operations": [{"sql": "UPDATE users SET age = 0"}]}}
 * ]
 * </pre>
 *
 * {@code timeout} and {@code estimatedDuration} are milliseconds.
 */
public class TaskGraphReader {

    private static final TypeReference<List<TaskSpec>> TASK_LIST = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public TaskGraphReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TaskGraph read(String json) {
        try {
            return toGraph(objectMapper.readValue(json, TASK_LIST));
        } catch (JsonProcessingException e) {
            throw new TaskValidationException("Invalid task graph JSON: " + e.getOriginalMessage());
        }
    }

    public TaskGraph read(InputStream json) throws IOException {
        try {
            return toGraph(objectMapper.readValue(json, TASK_LIST));
        } catch (JsonProcessingException e) {
            throw new TaskValidationException("Invalid task graph JSON: " + e.getOriginalMessage());
        }
    }

    private static TaskGraph toGraph(List<TaskSpec> specs) {
        TaskGraph graph = new TaskGraph();
        for (TaskSpec spec : specs) {
            graph.addTask(spec.toDefinition());
        }
        return graph;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TaskSpec(
        String id,
        String name,
        String description,
        Set<String> dependencies,
        Set<String> resources,
        Integer priority,
        Long estimatedDuration,
        Integer maxRetries,
        Long timeout,
        Boolean requiresExclusiveAccess,
        Boolean canRunConcurrently,
        Set<String> tags,
        Map<String, Object> metadata
    ) {
        TaskDefinition toDefinition() {
            TaskDefinition.Builder builder = TaskDefinition.builder(id)
                .name(name)
                .description(description)
                .estimatedDuration(estimatedDuration);
            if (dependencies != null) {
                builder.dependsOn(dependencies.toArray(String[]::new));
            }
            if (resources != null) {
                resources.forEach(builder::requires);
            }
            if (tags != null) {
                tags.forEach(builder::tag);
            }
            if (priority != null) {
                builder.priority(priority);
            }
            if (maxRetries != null) {
                builder.maxRetries(maxRetries);
            }
            if (timeout != null) {
                builder.timeout(Duration.ofMillis(timeout));
            }
            if (requiresExclusiveAccess != null) {
                builder.requiresExclusiveAccess(requiresExclusiveAccess);
            }
            if (canRunConcurrently != null) {
                builder.canRunConcurrently(canRunConcurrently);
            }
            if (metadata != null) {
                builder.metadata(metadata);
            }
            return builder.build();
        }
    }
}
