package com.schemaops.core.model;

import com.schemaops.core.exception.TaskExecutionException;
import com.schemaops.core.exception.TaskValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskDefinitionTest {

    @Test
    void builder_shouldApplyDefaults() {
        TaskDefinition task = TaskDefinition.builder("migrate").build();

        assertEquals("migrate", task.name());
        assertEquals(TaskDefinition.DEFAULT_MAX_RETRIES, task.maxRetries());
        assertEquals(TaskDefinition.DEFAULT_TIMEOUT, task.timeout());
        assertTrue(task.canRunConcurrently());
        assertFalse(task.requiresExclusiveAccess());
        assertEquals(0, task.retryCount());
        assertEquals(TaskType.SQL, task.taskType());
    }

    @Test
    void constructor_shouldRejectSelfDependency() {
        TaskValidationException ex = assertThrows(TaskValidationException.class,
            () -> TaskDefinition.builder("loop").dependsOn("loop").build());
        assertEquals(TaskValidationException.ERROR_CODE, ex.getErrorCode());
    }

    @Test
    void constructor_shouldRejectInvalidFields() {
        assertThrows(TaskValidationException.class, () -> TaskDefinition.builder(" ").build());
        assertThrows(TaskValidationException.class, () -> TaskDefinition.builder("t").maxRetries(-1).build());
        assertThrows(TaskValidationException.class, () -> TaskDefinition.builder("t").timeout(Duration.ZERO).build());
    }

    @Test
    void withRetryCount_shouldLeaveOriginalUntouched() {
        TaskDefinition original = TaskDefinition.builder("migrate")
            .dependsOn("prepare")
            .requires("users")
            .tag("schema")
            .metadata(TaskDefinition.TYPE, "migration")
            .build();

        TaskDefinition retried = original.withRetryCount(2);

        assertEquals(0, original.retryCount());
        assertEquals(2, retried.retryCount());
        assertEquals(original.dependencies(), retried.dependencies());
        assertEquals(original.resources(), retried.resources());
        assertEquals(original.tags(), retried.tags());
        assertEquals(TaskType.MIGRATION, retried.taskType());
    }

    @Test
    void collections_shouldBeImmutable() {
        TaskDefinition task = TaskDefinition.builder("t").dependsOn("a").build();

        assertThrows(UnsupportedOperationException.class, () -> task.dependencies().add("b"));
        assertThrows(UnsupportedOperationException.class, () -> task.metadata().put("k", "v"));
    }

    @Test
    void extend_shouldBuildANewValue() {
        TaskDefinition original = TaskDefinition.builder("backfill").priority(2).dependsOn("migrate").build();

        TaskDefinition extended = original.extend().priority(7).tag("slow").build();

        assertEquals(2, original.priority());
        assertTrue(original.tags().isEmpty());
        assertEquals(7, extended.priority());
        assertEquals(Set.of("migrate"), extended.dependencies());
        assertEquals(Set.of("slow"), extended.tags());
    }

    @Test
    void dependenciesSatisfied_shouldRequireEveryDependency() {
        TaskDefinition task = TaskDefinition.builder("test").dependsOn("prepare", "lint").build();

        assertFalse(task.dependenciesSatisfied(Set.of("prepare")));
        assertTrue(task.dependenciesSatisfied(Set.of("prepare", "lint", "other")));
    }

    @Test
    void canExecuteWith_shouldRequireEveryResource() {
        TaskDefinition task = TaskDefinition.builder("t").requires("users").requires("orders").build();

        assertTrue(task.canExecuteWith(Set.of("users", "orders", "audit")));
        assertFalse(task.canExecuteWith(Set.of("users")));
    }

    @Test
    void taskType_shouldRejectUnknownType() {
        TaskDefinition task = TaskDefinition.builder("t").metadata(TaskDefinition.TYPE, "deploy").build();

        TaskExecutionException ex = assertThrows(TaskExecutionException.class, task::taskType);
        assertEquals(TaskExecutionException.UNKNOWN_TASK_TYPE, ex.getErrorCode());
        assertFalse(ex.isRetryable());
    }

    @Test
    void taskType_shouldIgnoreCase() {
        TaskDefinition task = TaskDefinition.builder("t").metadata(TaskDefinition.TYPE, "Validation").build();

        assertEquals(TaskType.VALIDATION, task.taskType());
        assertEquals("validation", TaskType.VALIDATION.value());
    }

    @Test
    void sqlOperation_label_shouldFallBackToSqlPrefix() {
        String sql = "SELECT id, email, created_at FROM users WHERE created_at > now() - interval '1 day'";

        assertEquals("users-recent", SqlOperation.of("users-recent", sql).label());
        assertEquals(sql.substring(0, 50), SqlOperation.of(sql).label());
        assertThrows(IllegalArgumentException.class, () -> new SqlOperation("x", " ", List.of(), false));
    }
}
