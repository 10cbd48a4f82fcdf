package com.schemaops.core.model;

import com.schemaops.core.exception.TaskValidationException;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * An identified unit of work in a task graph.
 * Immutable: retries and other adjustments produce a new value through
 * {@link #extend()}, leaving the original untouched.
 *
 * Invariants:
 * - id is non-empty
 * - dependencies never include the task's own id
 * - maxRetries >= 0, timeout > 0
 */
public record TaskDefinition(
    // Identity
    String id,
    String name,
    String description,

    // Graph structure (blocking dependencies)
    Set<String> dependencies,

    // Scheduling
    Set<String> resources,
    int priority,
    Long estimatedDuration,
    int maxRetries,
    Duration timeout,
    boolean requiresExclusiveAccess,
    boolean canRunConcurrently,

    // Metadata
    Set<String> tags,
    Map<String, Object> metadata
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_RETRIES = 3;

    /**
     * Metadata key holding the retry counter of an extended task.
     */
    public static final String RETRY_COUNT = "retryCount";

    /**
     * Metadata key selecting the task handler.
     */
    public static final String TYPE = "type";

    public TaskDefinition {
        if (id == null || id.isBlank()) {
            throw new TaskValidationException("id", "must not be empty");
        }
        if (maxRetries < 0) {
            throw new TaskValidationException("maxRetries", "must be >= 0");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new TaskValidationException("timeout", "must be positive");
        }
        dependencies = frozen(dependencies);
        if (dependencies.contains(id)) {
            throw new TaskValidationException("dependencies", "task " + id + " cannot depend on itself");
        }
        name = name != null ? name : id;
        description = description != null ? description : "";
        resources = frozen(resources);
        tags = frozen(tags);
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Check if this task can run with the given resources available.
     */
    public boolean canExecuteWith(Set<String> availableResources) {
        return availableResources.containsAll(resources);
    }

    /**
     * Check if every dependency is in the completed set.
     */
    public boolean dependenciesSatisfied(Set<String> completedTasks) {
        return completedTasks.containsAll(dependencies);
    }

    /**
     * Number of retries already made for this task.
     */
    public int retryCount() {
        Object value = metadata.get(RETRY_COUNT);
        return value instanceof Number number ? number.intValue() : 0;
    }

    /**
     * Copy of this task carrying the given retry counter.
     */
    public TaskDefinition withRetryCount(int retryCount) {
        return extend().metadata(RETRY_COUNT, retryCount).build();
    }

    /**
     * Task type named by metadata, defaulting to SQL.
     */
    public TaskType taskType() {
        return TaskType.fromValue(metadata.get(TYPE));
    }

    /**
     * Start a builder pre-populated with this task's configuration.
     * Building it yields a new value; this instance is never mutated.
     */
    public Builder extend() {
        Builder builder = new Builder(id)
            .name(name)
            .description(description)
            .priority(priority)
            .estimatedDuration(estimatedDuration)
            .maxRetries(maxRetries)
            .timeout(timeout)
            .requiresExclusiveAccess(requiresExclusiveAccess)
            .canRunConcurrently(canRunConcurrently);
        dependencies.forEach(builder::dependsOn);
        resources.forEach(builder::requires);
        tags.forEach(builder::tag);
        builder.metadata.putAll(metadata);
        return builder;
    }

    private static Set<String> frozen(Collection<String> values) {
        return values == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    /**
     * Builder for TaskDefinition.
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String name;
        private String description;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private final Set<String> resources = new LinkedHashSet<>();
        private int priority;
        private Long estimatedDuration;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration timeout = DEFAULT_TIMEOUT;
        private boolean requiresExclusiveAccess;
        private boolean canRunConcurrently = true;
        private final Set<String> tags = new LinkedHashSet<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder dependsOn(String... taskIds) {
            Collections.addAll(dependencies, taskIds);
            return this;
        }

        public Builder requires(String resource) {
            resources.add(resource);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder estimatedDuration(Long estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder requiresExclusiveAccess(boolean requiresExclusiveAccess) {
            this.requiresExclusiveAccess = requiresExclusiveAccess;
            return this;
        }

        public Builder canRunConcurrently(boolean canRunConcurrently) {
            this.canRunConcurrently = canRunConcurrently;
            return this;
        }

        public Builder tag(String tag) {
            tags.add(tag);
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> values) {
            metadata.putAll(values);
            return this;
        }

        public TaskDefinition build() {
            return new TaskDefinition(
                id, name, description, dependencies, resources, priority,
                estimatedDuration, maxRetries, timeout, requiresExclusiveAccess,
                canRunConcurrently, tags, metadata
            );
        }
    }
}
