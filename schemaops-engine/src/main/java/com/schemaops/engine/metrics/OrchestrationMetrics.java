package com.schemaops.engine.metrics;

import com.schemaops.advisory.LockEvent;
import com.schemaops.advisory.LockEventListener;
import com.schemaops.core.model.LockAnalysis;
import com.schemaops.core.model.SqlOperation;
import com.schemaops.core.model.TaskDefinition;
import com.schemaops.engine.coordinator.TaskListener;
import com.schemaops.executor.ExecutionListener;
import com.schemaops.executor.ExecutorStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.function.ToIntFunction;

/**
 * Micrometer metrics for task graph runs, the lock-aware executor and
 * advisory locks.
 *
 * Metrics exposed:
 * - Running tasks, queued operations and active resource keys (gauges)
 * - Task completions, failures and retries
 * - Deadlock retries, queued operations and queue timeouts
 * - Advisory lock events by type
 * - Task and operation durations
 *
 * Registered as the coordinator's {@link TaskListener}, the executor's
 * {@link ExecutionListener} and the lock manager's {@link LockEventListener}.
 * Events arriving before {@link #bindTo} are dropped.
 */
public class OrchestrationMetrics implements MeterBinder, TaskListener, ExecutionListener, LockEventListener {

    public static final String TASKS_RUNNING = "schemaops.tasks.running";
    public static final String TASKS_COMPLETED = "schemaops.tasks.completed";
    public static final String TASK_FAILURES = "schemaops.task.failures";
    public static final String TASK_RETRIES = "schemaops.task.retries";
    public static final String TASK_DURATION = "schemaops.task.duration";

    public static final String OPERATIONS_QUEUED = "schemaops.operations.queued";
    public static final String OPERATIONS_ENQUEUED = "schemaops.operations.enqueued";
    public static final String OPERATION_QUEUE_TIMEOUTS = "schemaops.operations.queue.timeouts";
    public static final String OPERATION_DURATION = "schemaops.operation.duration";
    public static final String DEADLOCK_RETRIES = "schemaops.operations.deadlock.retries";
    public static final String ACTIVE_RESOURCE_KEYS = "schemaops.locks.resource.keys";

    public static final String LOCK_EVENTS = "schemaops.advisory.lock.events";

    private volatile MeterRegistry registry;
    private volatile Supplier<ExecutorStats> executorStats;

    private final AtomicInteger runningTasks = new AtomicInteger();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(TASKS_RUNNING, runningTasks, AtomicInteger::get)
            .description("Task attempts currently running")
            .register(registry);
        Gauge.builder(OPERATIONS_QUEUED, this, m -> m.executorStat(ExecutorStats::queuedOperations))
            .description("SQL operations waiting for a conflicting lock to clear")
            .register(registry);
        Gauge.builder(ACTIVE_RESOURCE_KEYS, this, m -> m.executorStat(ExecutorStats::activeLocks))
            .description("Resource keys with running operations")
            .register(registry);
    }

    /**
     * Source for the executor gauges. The executor is created with this
     * object as its listener, so the source is attached afterwards.
     */
    public void monitorExecutor(Supplier<ExecutorStats> executorStats) {
        this.executorStats = executorStats;
    }

    private double executorStat(ToIntFunction<ExecutorStats> stat) {
        Supplier<ExecutorStats> source = executorStats;
        return source == null ? 0 : stat.applyAsInt(source.get());
    }

    // ========== Task Metrics ==========

    @Override
    public void onTaskStarted(TaskDefinition task) {
        runningTasks.incrementAndGet();
    }

    @Override
    public void onTaskCompleted(TaskDefinition task, Duration duration) {
        runningTasks.updateAndGet(v -> Math.max(0, v - 1));
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Counter.builder(TASKS_COMPLETED)
            .tag("type", task.taskType().value())
            .description("Tasks completed successfully")
            .register(registry)
            .increment();
        Timer.builder(TASK_DURATION)
            .tag("type", task.taskType().value())
            .tag("outcome", "success")
            .description("Task attempt duration")
            .register(registry)
            .record(duration);
    }

    @Override
    public void onTaskFailed(TaskDefinition task, String errorCode, boolean willRetry) {
        runningTasks.updateAndGet(v -> Math.max(0, v - 1));
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Counter.builder(TASK_FAILURES)
            .tag("error_code", errorCode)
            .tag("will_retry", String.valueOf(willRetry))
            .description("Failed task attempts")
            .register(registry)
            .increment();
    }

    @Override
    public void onTaskRetry(TaskDefinition task, int retryNumber, Duration backoff) {
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Counter.builder(TASK_RETRIES)
            .tag("attempt", String.valueOf(retryNumber + 1))
            .description("Task retry attempts")
            .register(registry)
            .increment();
    }

    // ========== Executor Metrics ==========

    @Override
    public void onQueued(SqlOperation operation, String resourceKey, LockAnalysis analysis) {
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Counter.builder(OPERATIONS_ENQUEUED)
            .tag("level", analysis.level().name())
            .description("Operations that had to wait for a lock")
            .register(registry)
            .increment();
    }

    @Override
    public void onCompleted(SqlOperation operation, LockAnalysis analysis, Duration duration, boolean success) {
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Timer.builder(OPERATION_DURATION)
            .tag("type", analysis.type().name())
            .tag("outcome", success ? "success" : "error")
            .description("SQL operation duration")
            .register(registry)
            .record(duration);
    }

    @Override
    public void onDeadlockRetry(SqlOperation operation, int retryNumber, Duration backoff) {
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Counter.builder(DEADLOCK_RETRIES)
            .description("Operations retried after a deadlock")
            .register(registry)
            .increment();
    }

    @Override
    public void onQueueTimeout(SqlOperation operation, String resourceKey) {
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Counter.builder(OPERATION_QUEUE_TIMEOUTS)
            .description("Operations that timed out waiting in the lock queue")
            .register(registry)
            .increment();
    }

    // ========== Advisory Lock Metrics ==========

    @Override
    public void onLockEvent(LockEvent event) {
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Counter.builder(LOCK_EVENTS)
            .tag("event", event.type().name().toLowerCase())
            .tag("lock_type", event.lockType().name().toLowerCase())
            .description("Advisory lock lifecycle events")
            .register(registry)
            .increment();
    }

    public int getRunningTasks() {
        return runningTasks.get();
    }
}
