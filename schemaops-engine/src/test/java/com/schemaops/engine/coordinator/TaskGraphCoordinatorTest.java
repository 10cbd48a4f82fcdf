package com.schemaops.engine.coordinator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.schemaops.core.model.TaskDefinition;
import com.schemaops.core.model.TaskGraph;
import com.schemaops.core.model.TaskState;
import com.schemaops.core.model.TaskType;
import com.schemaops.core.test.FakeConnectionPool;
import com.schemaops.core.test.Gate;
import com.schemaops.core.test.RecordingSleeper;
import com.schemaops.executor.ExecutionListener;
import com.schemaops.executor.ExecutorSettings;
import com.schemaops.executor.LockAwareExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class TaskGraphCoordinatorTest {

    private FakeConnectionPool pool;
    private RecordingSleeper sleeper;
    private LockAwareExecutor executor;
    private TaskGraphCoordinator coordinator;

    @BeforeEach
    void setUp() {
        pool = new FakeConnectionPool(10);
        sleeper = new RecordingSleeper();
        executor = new LockAwareExecutor(pool, ExecutorSettings.defaults(), ExecutionListener.NONE,
            new RecordingSleeper(), Clock.systemUTC());
        coordinator = newCoordinator(1);
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
        executor.shutdown();
    }

    private TaskGraphCoordinator newCoordinator(int maxConcurrentTasks) {
        return new TaskGraphCoordinator(executor,
            CoordinatorSettings.defaults().withMaxConcurrentTasks(maxConcurrentTasks),
            new ObjectMapper(), TaskListener.NONE, sleeper, Clock.systemUTC());
    }

    private static TaskDefinition.Builder sqlTask(String id, String sql) {
        return TaskDefinition.builder(id)
            .metadata(TaskDefinition.TYPE, "sql")
            .metadata("sql", sql);
    }

    @Test
    @DisplayName("Tasks run by priority once their dependencies complete")
    void testDependencyAndPriorityOrder() {
        TaskGraph graph = new TaskGraph(List.of(
            sqlTask("prepare", "SELECT 'prepare'").priority(1).build(),
            sqlTask("lint", "SELECT 'lint'").priority(5).build(),
            sqlTask("test", "SELECT 'test'").priority(3).dependsOn("prepare", "lint").build()
        ));

        GraphExecutionResult result = coordinator.executeTaskGraph(graph);

        assertThat(result.success()).isTrue();
        assertThat(result.error()).isNull();
        assertThat(result.completedTasks()).isEqualTo(3);
        assertThat(result.failedTasks()).isZero();
        assertThat(result.results()).containsOnlyKeys("prepare", "lint", "test");
        assertThat(result.results().get("lint").get("rowCount").asInt()).isZero();
        assertThat(pool.executedStatements())
            .containsSubsequence("SELECT 'lint'", "SELECT 'prepare'", "SELECT 'test'");
    }

    @Test
    @DisplayName("A cyclic graph is rejected before anything runs")
    void testCycleRejected() {
        TaskGraph graph = new TaskGraph(List.of(
            sqlTask("a", "SELECT 1").dependsOn("b").build(),
            sqlTask("b", "SELECT 2").dependsOn("a").build()
        ));

        GraphExecutionResult result = coordinator.executeTaskGraph(graph);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("Circular dependency");
        assertThat(result.completedTasks()).isZero();
        assertThat(pool.acquiredConnections()).isZero();
    }

    @Test
    @DisplayName("A dependency on an unknown task is rejected before anything runs")
    void testUnresolvedDependencyRejected() {
        TaskGraph graph = new TaskGraph(List.of(
            sqlTask("report", "SELECT 1").dependsOn("missing").build()
        ));

        GraphExecutionResult result = coordinator.executeTaskGraph(graph);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("missing");
        assertThat(pool.acquiredConnections()).isZero();
    }

    @Test
    @DisplayName("A failed attempt is retried on an extended copy after backing off")
    void testRetryAfterFailure() {
        pool.script().failOnce("INSERT INTO audit",
            () -> new DataIntegrityViolationException("duplicate key value"));
        TaskGraph graph = new TaskGraph(List.of(
            sqlTask("audit", "INSERT INTO audit (event) VALUES ('start')").build()
        ));

        GraphExecutionResult result = coordinator.executeTaskGraph(graph);

        assertThat(result.success()).isTrue();
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(1));
        assertThat(coordinator.getTaskHistory())
            .extracting(TaskRecord::state, TaskRecord::retryCount)
            .containsExactly(
                tuple(TaskState.FAILED, 0),
                tuple(TaskState.COMPLETED, 1));
        assertThat(graph.getTask("audit").orElseThrow().retryCount()).isZero();
    }

    @Test
    @DisplayName("A permanently failed task blocks its dependents and fails the run")
    void testPermanentFailureBlocksDependents() {
        pool.script().fail("FROM broken",
            () -> new DataIntegrityViolationException("constraint violated"));
        TaskGraph graph = new TaskGraph(List.of(
            sqlTask("broken", "DELETE FROM broken").maxRetries(2).priority(10).build(),
            sqlTask("downstream", "SELECT * FROM downstream").dependsOn("broken").build(),
            sqlTask("independent", "SELECT * FROM independent").build()
        ));

        GraphExecutionResult result = coordinator.executeTaskGraph(graph);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Tasks failed: broken");
        assertThat(result.completedTasks()).isEqualTo(1);
        assertThat(result.failedTasks()).isEqualTo(1);
        assertThat(result.results()).containsOnlyKeys("independent");
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(pool.executed("DELETE FROM broken")).hasSize(3);
        assertThat(pool.executed("FROM downstream")).isEmpty();
    }

    @Test
    @DisplayName("An attempt that outlives its timeout fails the task without waiting for the statement")
    void testTaskTimeout() {
        Gate gate = new Gate();
        pool.script().hold("pg_sleep", gate);
        TaskGraph graph = new TaskGraph(List.of(
            sqlTask("slow", "SELECT pg_sleep(60)").timeout(Duration.ofMillis(200)).maxRetries(0).build()
        ));

        try {
            GraphExecutionResult result = coordinator.executeTaskGraph(graph);

            assertThat(result.success()).isFalse();
            assertThat(result.failedTasks()).isEqualTo(1);
            assertThat(coordinator.getTaskHistory())
                .singleElement()
                .satisfies(record -> {
                    assertThat(record.state()).isEqualTo(TaskState.TIMED_OUT);
                    assertThat(record.error()).contains("timed out after 200ms");
                });
            assertThat(gate.hasEntered()).isTrue();
        } finally {
            gate.open();
        }
    }

    @Test
    @DisplayName("Unknown task types fail without retrying")
    void testUnknownTaskTypeNotRetried() {
        TaskGraph graph = new TaskGraph(List.of(
            TaskDefinition.builder("deploy").metadata(TaskDefinition.TYPE, "kubernetes").build()
        ));

        GraphExecutionResult result = coordinator.executeTaskGraph(graph);

        assertThat(result.success()).isFalse();
        assertThat(sleeper.sleeps()).isEmpty();
        assertThat(coordinator.getTaskHistory())
            .singleElement()
            .satisfies(record -> assertThat(record.error()).contains("Unknown task type: kubernetes"));
    }

    @Test
    @DisplayName("No more than maxConcurrentTasks tasks run at once")
    void testConcurrencyLimit() throws Exception {
        coordinator.shutdown();
        coordinator = newCoordinator(2);

        Gate first = new Gate();
        Gate second = new Gate();
        pool.script()
            .hold("FROM t1", first)
            .hold("FROM t2", second);
        TaskGraph graph = new TaskGraph(List.of(
            sqlTask("one", "SELECT * FROM t1").priority(3).build(),
            sqlTask("two", "SELECT * FROM t2").priority(2).build(),
            sqlTask("three", "SELECT * FROM t3").priority(1).build()
        ));

        CompletableFuture<GraphExecutionResult> run =
            CompletableFuture.supplyAsync(() -> coordinator.executeTaskGraph(graph));
        first.awaitEntered();
        second.awaitEntered();

        assertThat(coordinator.getRunningTaskCount()).isEqualTo(2);
        assertThat(pool.executed("FROM t3")).isEmpty();

        first.open();
        second.open();
        GraphExecutionResult result = run.get(5, TimeUnit.SECONDS);
        assertThat(result.success()).isTrue();
        assertThat(result.completedTasks()).isEqualTo(3);
        assertThat(coordinator.getRunningTaskCount()).isZero();
    }

    @Test
    @DisplayName("Registered handlers replace the built-in handler for their type")
    void testCustomHandler() {
        coordinator.registerHandler(TaskType.GENERATION, context -> TextNode.valueOf("generated " + context.getTaskId()));
        TaskGraph graph = new TaskGraph(List.of(
            TaskDefinition.builder("types").metadata(TaskDefinition.TYPE, "generation").build()
        ));

        GraphExecutionResult result = coordinator.executeTaskGraph(graph);

        assertThat(result.results().get("types").asText()).isEqualTo("generated types");
    }

    @Test
    @DisplayName("Statistics count completed and failed tasks and include executor stats")
    void testStats() {
        pool.script().fail("FROM flaky",
            () -> new DataIntegrityViolationException("nope"));
        coordinator.executeTaskGraph(new TaskGraph(List.of(
            sqlTask("ok", "SELECT 1").build(),
            sqlTask("flaky", "DELETE FROM flaky").maxRetries(0).build()
        )));

        CoordinatorStats stats = coordinator.getStats();

        assertThat(stats.runningTasks()).isZero();
        assertThat(stats.completedTasks()).isEqualTo(1);
        assertThat(stats.failedTasks()).isEqualTo(1);
        assertThat(stats.recentTasks()).isEqualTo(2);
        assertThat(stats.successRate()).isEqualTo(0.5);
        assertThat(stats.executorStats().recentOperations()).isEqualTo(2);
    }

    @Test
    @DisplayName("A shut down coordinator rejects new runs")
    void testShutdownRejectsRuns() {
        coordinator.shutdown();

        GraphExecutionResult result = coordinator.executeTaskGraph(
            new TaskGraph(List.of(sqlTask("late", "SELECT 1").build())));

        assertThat(coordinator.isShuttingDown()).isTrue();
        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("shut down");
    }
}
