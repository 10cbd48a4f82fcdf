package com.schemaops.core.model;

import com.schemaops.core.exception.TaskExecutionException;

import java.util.Locale;

/**
 * Kinds of task the coordinator knows how to dispatch.
 */
public enum TaskType {
    /**
     * A single SQL statement run through the lock-aware executor.
     */
    SQL,

    /**
     * An ordered batch of SQL operations, run one after another.
     */
    MIGRATION,

    /**
     * Code generation. Recorded only; generators live outside the orchestrator.
     */
    GENERATION,

    /**
     * Schema or migration sanity checks.
     */
    VALIDATION;

    /**
     * Resolve a metadata value ("sql", "migration", ...) to a task type.
     * A missing value means SQL.
     */
    public static TaskType fromValue(Object value) {
        if (value == null) {
            return SQL;
        }
        if (value instanceof TaskType type) {
            return type;
        }
        try {
            return valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw TaskExecutionException.permanent(
                TaskExecutionException.UNKNOWN_TASK_TYPE, null, "Unknown task type: " + value);
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
