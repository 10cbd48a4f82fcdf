package com.schemaops.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemaops.core.exception.CircularDependencyException;
import com.schemaops.core.exception.GraphExecutionException;
import com.schemaops.core.exception.SchemaOpsException;
import com.schemaops.core.exception.TaskExecutionException;
import com.schemaops.core.exception.UnresolvedDependencyException;
import com.schemaops.core.model.TaskDefinition;
import com.schemaops.core.model.TaskGraph;
import com.schemaops.core.model.TaskState;
import com.schemaops.core.model.TaskType;
import com.schemaops.core.util.Sleeper;
import com.schemaops.engine.handler.GenerationTaskHandler;
import com.schemaops.engine.handler.MigrationTaskHandler;
import com.schemaops.engine.handler.SqlTaskHandler;
import com.schemaops.engine.handler.TaskContext;
import com.schemaops.engine.handler.TaskHandler;
import com.schemaops.engine.handler.ValidationTaskHandler;
import com.schemaops.engine.logging.LoggingContext;
import com.schemaops.executor.LockAwareExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a task graph to completion.
 *
 * A run is validated before anything starts: a graph with a cycle or an
 * unknown dependency is rejected. The coordinator then repeatedly starts the
 * highest-priority ready tasks up to {@code maxConcurrentTasks} and waits for
 * one of them to finish. Each task attempt is dispatched to the handler for
 * its type and raced against the task's timeout; a failed attempt is retried
 * with exponential backoff on an extended copy of the task until its retry
 * budget is spent.
 *
 * A permanently failed task never completes, so its dependents never become
 * ready. Once nothing is running and nothing can start, the run ends with a
 * failure naming the failed tasks.
 *
 * Invariants:
 * - no task starts before all of its dependencies completed
 * - at most maxConcurrentTasks tasks of a run execute at once
 * - a timed-out attempt is abandoned, not cancelled: its SQL keeps running
 *   until it finishes or hits the server-side lock_timeout
 */
public class TaskGraphCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphCoordinator.class);

    private static final int HISTORY_CAPACITY = 1000;
    private static final Duration RECENT_WINDOW = Duration.ofMinutes(1);

    private final LockAwareExecutor executor;
    private final CoordinatorSettings settings;
    private final ObjectMapper objectMapper;
    private final TaskListener listener;
    private final Sleeper sleeper;
    private final Clock clock;

    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);
    private final ExecutorService taskExecutor;
    private final ExecutorService attemptExecutor;

    private final Set<String> runningTasks = ConcurrentHashMap.newKeySet();
    private final AtomicInteger completedTasks = new AtomicInteger();
    private final AtomicInteger failedTasks = new AtomicInteger();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    // guarded by itself
    private final Deque<TaskRecord> taskHistory = new ArrayDeque<>();

    public TaskGraphCoordinator(LockAwareExecutor executor) {
        this(executor, CoordinatorSettings.defaults(), new ObjectMapper(), TaskListener.NONE,
            Sleeper.SYSTEM, Clock.systemUTC());
    }

    public TaskGraphCoordinator(
            LockAwareExecutor executor,
            CoordinatorSettings settings,
            ObjectMapper objectMapper,
            TaskListener listener,
            Sleeper sleeper,
            Clock clock) {
        this.executor = executor;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.listener = listener != null ? listener : TaskListener.NONE;
        this.sleeper = sleeper;
        this.clock = clock;
        this.taskExecutor = Executors.newFixedThreadPool(settings.maxConcurrentTasks(), namedThreads("task"));
        this.attemptExecutor = Executors.newCachedThreadPool(namedThreads("task-attempt"));

        handlers.put(TaskType.SQL, new SqlTaskHandler(executor));
        handlers.put(TaskType.MIGRATION, new MigrationTaskHandler(executor));
        handlers.put(TaskType.GENERATION, new GenerationTaskHandler(clock));
        handlers.put(TaskType.VALIDATION, new ValidationTaskHandler());
    }

    /**
     * Replace the handler used for a task type.
     */
    public void registerHandler(TaskType type, TaskHandler handler) {
        synchronized (handlers) {
            handlers.put(type, handler);
        }
        log.info("Registered {} handler: {}", type.value(), handler.getClass().getSimpleName());
    }

    // ========== Graph Execution ==========

    /**
     * Run every task of the graph. Never throws for task or graph failures;
     * the result says how far the run got.
     */
    public GraphExecutionResult executeTaskGraph(TaskGraph graph) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        Instant startTime = clock.instant();
        GraphRun run = new GraphRun(runId);

        try (var ctx = LoggingContext.forRun(runId)) {
            try {
                if (shuttingDown.get()) {
                    throw new GraphExecutionException("Coordinator is shut down");
                }
                validate(graph);
                log.info("Starting graph run with {} tasks", graph.size());
                drive(graph, run);

                Duration duration = Duration.between(startTime, clock.instant());
                log.info("Graph run completed: {} tasks in {}ms", run.completed.size(), duration.toMillis());
                return new GraphExecutionResult(true, null, duration,
                    run.completed.size(), run.failed.size(), run.results);
            } catch (SchemaOpsException e) {
                Duration duration = Duration.between(startTime, clock.instant());
                log.error("Graph run failed after {}ms: {}", duration.toMillis(), e.getMessage());
                return new GraphExecutionResult(false, e.getMessage(), duration,
                    run.completed.size(), run.failed.size(), run.results);
            } finally {
                run.running.forEach(taskId -> runningTasks.remove(run.key(taskId)));
            }
        }
    }

    private void validate(TaskGraph graph) {
        List<List<String>> cycles = graph.detectCycles();
        if (!cycles.isEmpty()) {
            throw new CircularDependencyException(cycles);
        }
        Map<String, Set<String>> unresolved = graph.getUnresolvedDependencies();
        if (!unresolved.isEmpty()) {
            throw new UnresolvedDependencyException(unresolved);
        }
        log.debug("Execution order: {}", graph.getExecutionOrder());
    }

    private void drive(TaskGraph graph, GraphRun run) {
        CompletionService<TaskOutcome> completion = new ExecutorCompletionService<>(taskExecutor);

        while (run.completed.size() < graph.size()) {
            List<TaskDefinition> available = new ArrayList<>();
            for (TaskDefinition task : graph.getReadyTasks(run.completed)) {
                if (!run.running.contains(task.id()) && !run.failed.containsKey(task.id())) {
                    available.add(task);
                }
            }

            int slots = settings.maxConcurrentTasks() - run.running.size();
            for (TaskDefinition task : available.subList(0, Math.min(slots, available.size()))) {
                start(task, run, completion);
            }

            if (run.running.isEmpty()) {
                if (!run.failed.isEmpty()) {
                    throw new GraphExecutionException(run.failed.keySet());
                }
                throw new GraphExecutionException("No runnable tasks remain; "
                    + (graph.size() - run.completed.size()) + " tasks never became ready");
            }

            TaskOutcome outcome = awaitNext(completion);
            run.running.remove(outcome.taskId());
            runningTasks.remove(run.key(outcome.taskId()));

            if (outcome.error() == null) {
                run.completed.add(outcome.taskId());
                run.results.put(outcome.taskId(), outcome.result());
                completedTasks.incrementAndGet();
            } else {
                run.failed.put(outcome.taskId(), outcome.error());
                failedTasks.incrementAndGet();
            }
        }
    }

    private void start(TaskDefinition task, GraphRun run, CompletionService<TaskOutcome> completion) {
        run.running.add(task.id());
        runningTasks.add(run.key(task.id()));
        try {
            completion.submit(() -> runTask(task, run.runId));
        } catch (RejectedExecutionException e) {
            run.running.remove(task.id());
            runningTasks.remove(run.key(task.id()));
            throw new GraphExecutionException("Coordinator is shut down; task " + task.id() + " not started");
        }
    }

    private TaskOutcome awaitNext(CompletionService<TaskOutcome> completion) {
        try {
            return completion.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GraphExecutionException("Interrupted while waiting for running tasks");
        } catch (ExecutionException e) {
            throw new GraphExecutionException("Task runner failed unexpectedly: " + e.getCause());
        }
    }

    // ========== Task Execution ==========

    /**
     * Run a task through all of its attempts. Returns the final outcome
     * rather than throwing.
     */
    private TaskOutcome runTask(TaskDefinition task, String runId) {
        TaskDefinition current = task;
        while (true) {
            int retryCount = current.retryCount();
            Instant started = clock.instant();

            try (var ctx = LoggingContext.forTask(runId, current.id(), retryCount + 1)) {
                listener.onTaskStarted(current);
                log.info("Starting task (attempt {}/{})", retryCount + 1, current.maxRetries() + 1);
                try {
                    JsonNode result = runAttempt(current, runId);
                    Duration duration = Duration.between(started, clock.instant());
                    recordTaskResult(current, TaskState.COMPLETED, duration, null);
                    listener.onTaskCompleted(current, duration);
                    log.info("Task completed in {}ms", duration.toMillis());
                    return new TaskOutcome(task.id(), result, null);
                } catch (TaskExecutionException e) {
                    Duration duration = Duration.between(started, clock.instant());
                    recordTaskResult(current, attemptState(e), duration, e);

                    boolean willRetry = e.isRetryable()
                        && retryCount < current.maxRetries()
                        && !shuttingDown.get();
                    listener.onTaskFailed(current, e.getErrorCode(), willRetry);
                    if (!willRetry) {
                        log.warn("Task failed permanently after {} attempts: {}", retryCount + 1, e.getMessage());
                        return new TaskOutcome(task.id(), null, e);
                    }

                    int retryNumber = retryCount + 1;
                    Duration backoff = settings.retryBackoff().computeBackoff(retryNumber);
                    log.warn("Task failed, retry {}/{} in {}ms: {}",
                        retryNumber, current.maxRetries(), backoff.toMillis(), e.getMessage());
                    listener.onTaskRetry(current, retryNumber, backoff);
                    try {
                        sleeper.sleep(backoff);
                    } catch (InterruptedException interrupted) {
                        Thread.currentThread().interrupt();
                        return new TaskOutcome(task.id(), null, e);
                    }
                    current = current.withRetryCount(retryNumber);
                }
            }
        }
    }

    private JsonNode runAttempt(TaskDefinition task, String runId) {
        TaskHandler handler = resolveHandler(task);
        int attempt = task.retryCount() + 1;

        Future<JsonNode> future;
        try {
            future = attemptExecutor.submit(() -> {
                try (var ctx = LoggingContext.forTask(runId, task.id(), attempt)) {
                    return handler.execute(new TaskContext(task, runId, objectMapper));
                }
            });
        } catch (RejectedExecutionException e) {
            throw new TaskExecutionException(TaskExecutionException.ERROR_CODE, task.id(),
                "Coordinator is shut down", e, false);
        }

        long timeoutMillis = task.timeout().toMillis();
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Attempt timed out after {}ms; statements it issued may still be running", timeoutMillis);
            throw TaskExecutionException.timedOut(task.id(), timeoutMillis);
        } catch (ExecutionException e) {
            throw asTaskFailure(task, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskExecutionException(TaskExecutionException.ERROR_CODE, task.id(),
                "Interrupted while running task " + task.id(), e, false);
        }
    }

    private TaskHandler resolveHandler(TaskDefinition task) {
        TaskType type;
        try {
            type = task.taskType();
        } catch (TaskExecutionException e) {
            throw TaskExecutionException.permanent(e.getErrorCode(), task.id(), e.getMessage());
        }
        TaskHandler handler;
        synchronized (handlers) {
            handler = handlers.get(type);
        }
        if (handler == null) {
            throw TaskExecutionException.permanent(TaskExecutionException.UNKNOWN_TASK_TYPE, task.id(),
                "No handler registered for task type: " + type.value());
        }
        return handler;
    }

    private static TaskExecutionException asTaskFailure(TaskDefinition task, Throwable cause) {
        if (cause instanceof TaskExecutionException taskFailure) {
            return taskFailure;
        }
        return new TaskExecutionException(task.id(),
            "Task " + task.id() + " failed: " + cause.getMessage(), cause);
    }

    // ========== Statistics ==========

    private static TaskState attemptState(TaskExecutionException e) {
        return TaskExecutionException.TIMEOUT.equals(e.getErrorCode()) ? TaskState.TIMED_OUT : TaskState.FAILED;
    }

    private void recordTaskResult(TaskDefinition task, TaskState state, Duration duration,
                                  TaskExecutionException error) {
        String taskType = String.valueOf(task.metadata().getOrDefault(TaskDefinition.TYPE, "unknown"));
        TaskRecord record = new TaskRecord(task.id(), taskType, state, duration, clock.instant(),
            error == null ? null : error.getMessage(), task.retryCount());
        synchronized (taskHistory) {
            taskHistory.addLast(record);
            while (taskHistory.size() > HISTORY_CAPACITY) {
                taskHistory.removeFirst();
            }
        }
    }

    public CoordinatorStats getStats() {
        Instant cutoff = clock.instant().minus(RECENT_WINDOW);
        List<TaskRecord> recent = new ArrayList<>();
        synchronized (taskHistory) {
            for (TaskRecord record : taskHistory) {
                if (record.timestamp().isAfter(cutoff)) {
                    recent.add(record);
                }
            }
        }

        double successRate = recent.isEmpty()
            ? 1.0
            : (double) recent.stream().filter(TaskRecord::succeeded).count() / recent.size();
        double averageDuration = recent.stream()
            .mapToLong(r -> r.duration().toMillis())
            .average()
            .orElse(0.0);

        return new CoordinatorStats(runningTasks.size(), completedTasks.get(), failedTasks.get(),
            recent.size(), successRate, averageDuration, executor.getStats());
    }

    public List<TaskRecord> getTaskHistory() {
        synchronized (taskHistory) {
            return List.copyOf(taskHistory);
        }
    }

    public int getRunningTaskCount() {
        return runningTasks.size();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    // ========== Lifecycle ==========

    /**
     * Stop accepting runs and wait up to the grace period for running tasks.
     * Tasks still running afterwards are abandoned; SQL they issued is not
     * cancelled.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down coordinator with {} running tasks (grace period {}s)",
            runningTasks.size(), settings.shutdownGracePeriod().toSeconds());

        taskExecutor.shutdown();
        attemptExecutor.shutdown();
        try {
            if (!taskExecutor.awaitTermination(settings.shutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Grace period elapsed with {} tasks still running: {}",
                    runningTasks.size(), runningTasks);
                taskExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            taskExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        runningTasks.clear();
        log.info("Coordinator shut down");
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record TaskOutcome(String taskId, JsonNode result, TaskExecutionException error) {
    }

    /**
     * Bookkeeping of one executeTaskGraph call. Touched only by the calling thread.
     */
    private static final class GraphRun {
        final String runId;
        final Set<String> completed = new LinkedHashSet<>();
        final Map<String, TaskExecutionException> failed = new LinkedHashMap<>();
        final Set<String> running = new HashSet<>();
        final Map<String, JsonNode> results = new LinkedHashMap<>();

        GraphRun(String runId) {
            this.runId = runId;
        }

        String key(String taskId) {
            return runId + ":" + taskId;
        }
    }
}
