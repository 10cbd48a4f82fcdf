package com.schemaops.executor;

import com.schemaops.core.db.ConnectionPool;
import com.schemaops.core.db.DatabaseConnection;
import com.schemaops.core.db.PoolStats;
import com.schemaops.core.db.QueryResult;
import com.schemaops.core.exception.LockException;
import com.schemaops.core.exception.LockTimeoutException;
import com.schemaops.core.exception.OperationFailedException;
import com.schemaops.core.exception.SchemaOpsException;
import com.schemaops.core.model.LockAnalysis;
import com.schemaops.core.model.LockLevel;
import com.schemaops.core.model.OperationType;
import com.schemaops.core.model.SqlOperation;
import com.schemaops.core.util.Sleeper;
import com.schemaops.core.util.SqlErrors;
import com.schemaops.executor.sql.ResourceKeyExtractor;
import com.schemaops.executor.sql.SqlClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs SQL operations with awareness of the table locks they take.
 *
 * Each operation is classified by lock level and grouped by resource key
 * (the tables it touches). An operation that conflicts with one already
 * running on its key, or that arrives while the connection pool is above
 * the backpressure threshold, waits in a FIFO queue for that key. Queued
 * operations start in order as conflicting ones finish, and fail with
 * {@link LockTimeoutException} if they wait longer than the lock timeout.
 *
 * Deadlocks reported by the database are retried with exponential backoff;
 * once retries are exhausted the database error itself is thrown. Other
 * failures are wrapped in {@link OperationFailedException}.
 *
 * Invariants:
 * - an operation's active record is removed in its cleanup path whatever the outcome
 * - at most one CREATE INDEX CONCURRENTLY runs per resource key
 * - within a resource key, queued operations start in submission order
 */
public class LockAwareExecutor {

    private static final Logger log = LoggerFactory.getLogger(LockAwareExecutor.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final ConnectionPool pool;
    private final ExecutorSettings settings;
    private final ExecutionListener listener;
    private final Sleeper sleeper;
    private final Clock clock;

    private final SqlClassifier classifier = new SqlClassifier();
    private final ResourceKeyExtractor resourceKeys = new ResourceKeyExtractor();
    private final OperationHistory history = new OperationHistory();
    private final AtomicLong operationSequence = new AtomicLong();

    private final ExecutorService workers;
    private final ExecutorService backoffExecutor;
    private final ScheduledExecutorService queueTimer;

    // guarded by this
    private final Map<String, List<ActiveOperation>> activeLocks = new LinkedHashMap<>();
    private final Map<String, Deque<QueuedOperation>> lockQueue = new LinkedHashMap<>();
    private boolean shutdown;

    public LockAwareExecutor(ConnectionPool pool) {
        this(pool, ExecutorSettings.defaults(), ExecutionListener.NONE, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public LockAwareExecutor(ConnectionPool pool, ExecutorSettings settings, ExecutionListener listener,
                             Sleeper sleeper, Clock clock) {
        this.pool = pool;
        this.settings = settings;
        this.listener = listener != null ? listener : ExecutionListener.NONE;
        this.sleeper = sleeper;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(settings.maxConcurrency(), namedThreads("lock-executor"));
        this.backoffExecutor = Executors.newCachedThreadPool(namedThreads("deadlock-backoff"));
        this.queueTimer = Executors.newSingleThreadScheduledExecutor(namedThreads("lock-queue-timer"));
    }

    // ========== Classification ==========

    public LockAnalysis analyzeLockLevel(String sql) {
        return classifier.analyze(sql);
    }

    public String getResourceKey(SqlOperation operation) {
        return resourceKeys.resourceKey(operation.sql());
    }

    /**
     * Whether an operation of the given lock requirements must wait on the key.
     */
    public synchronized boolean hasConflicts(LockAnalysis analysis, String resourceKey) {
        List<ActiveOperation> active = activeLocks.getOrDefault(resourceKey, List.of());

        if (analysis.level() == LockLevel.ACCESS_EXCLUSIVE && !active.isEmpty()) {
            return true;
        }
        for (ActiveOperation op : active) {
            if (analysis.conflictsWith(op.analysis())) {
                return true;
            }
        }
        if (analysis.type() == OperationType.CONCURRENT_INDEX
                && active.stream().anyMatch(op -> op.analysis().type() == OperationType.CONCURRENT_INDEX)) {
            return true;
        }

        PoolStats stats = pool.getStats();
        return stats.utilization() > settings.backpressureThreshold();
    }

    // ========== Execution ==========

    /**
     * Run an operation and wait for its result.
     *
     * @throws LockTimeoutException if it waited in the queue past the lock timeout
     * @throws OperationFailedException on a terminal database failure
     * @throws org.springframework.dao.DataAccessException if deadlock retries are exhausted
     */
    public QueryResult execute(SqlOperation operation, ExecutionContext context) {
        try {
            return submit(operation, context).join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new OperationFailedException(operation.label(), operation.sql(), cause);
        }
    }

    public QueryResult execute(SqlOperation operation) {
        return execute(operation, ExecutionContext.empty());
    }

    /**
     * Start or queue an operation. The returned future settles with the
     * result once the operation, and any deadlock retries, finish.
     */
    public CompletableFuture<QueryResult> submit(SqlOperation operation, ExecutionContext context) {
        if (context == null) {
            context = ExecutionContext.empty();
        }
        Attempt attempt = new Attempt(
            operation,
            context,
            analyzeLockLevel(operation.sql()),
            getResourceKey(operation),
            operation.id() != null ? operation.id() : "op_" + operationSequence.incrementAndGet()
        );
        return admit(attempt).exceptionallyCompose(error -> handleFailure(attempt, error));
    }

    private CompletableFuture<QueryResult> admit(Attempt attempt) {
        ActiveOperation reserved = null;
        QueuedOperation queued = null;

        synchronized (this) {
            if (shutdown) {
                return CompletableFuture.failedFuture(
                    new LockException("Executor is shut down; rejected operation " + attempt.operationId));
            }
            Deque<QueuedOperation> waiting = lockQueue.get(attempt.resourceKey);
            if ((waiting != null && !waiting.isEmpty()) || hasConflicts(attempt.analysis, attempt.resourceKey)) {
                queued = enqueue(attempt);
            } else {
                reserved = reserve(attempt);
            }
        }

        if (queued != null) {
            log.debug("Queued operation {} ({}) on '{}'",
                attempt.operationId, attempt.analysis.level(), attempt.resourceKey);
            notifyListener(() -> listener.onQueued(attempt.operation, attempt.resourceKey, attempt.analysis));
            return queued.result;
        }
        return start(attempt, reserved);
    }

    private CompletableFuture<QueryResult> start(Attempt attempt, ActiveOperation reserved) {
        try {
            return CompletableFuture.supplyAsync(() -> run(attempt, reserved), workers);
        } catch (RejectedExecutionException e) {
            finish(reserved);
            return CompletableFuture.failedFuture(
                new LockException("Executor is shut down; rejected operation " + attempt.operationId, e));
        }
    }

    private QueryResult run(Attempt attempt, ActiveOperation reserved) {
        Instant started = clock.instant();
        DatabaseConnection connection = null;
        try {
            connection = pool.acquire();
            connection.query("SET lock_timeout = " + settings.lockTimeout().toMillis());

            QueryResult result = attempt.operation.transaction()
                ? runInTransaction(connection, attempt.operation)
                : connection.query(attempt.operation.sql(), attempt.operation.params());

            recordOutcome(attempt, started, null);
            return result;
        } catch (RuntimeException e) {
            recordOutcome(attempt, started, e);
            throw e;
        } finally {
            if (connection != null) {
                try {
                    pool.release(connection);
                } catch (RuntimeException e) {
                    log.warn("Failed to release connection after operation {}: {}",
                        attempt.operationId, e.getMessage());
                }
            }
            finish(reserved);
        }
    }

    private QueryResult runInTransaction(DatabaseConnection connection, SqlOperation operation) {
        connection.query("BEGIN");
        try {
            QueryResult result = connection.query(operation.sql(), operation.params());
            connection.query("COMMIT");
            return result;
        } catch (RuntimeException e) {
            try {
                connection.query("ROLLBACK");
            } catch (RuntimeException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            throw e;
        }
    }

    private CompletableFuture<QueryResult> handleFailure(Attempt attempt, Throwable error) {
        Throwable cause = unwrap(error);

        if (SqlErrors.isDeadlock(cause)) {
            int retryCount = attempt.context.retryCount();
            if (retryCount < settings.deadlockRetries()) {
                int retryNumber = retryCount + 1;
                Duration backoff = settings.deadlockBackoff().computeBackoff(retryNumber);
                log.warn("Deadlock on operation {}, retry {}/{} in {}ms",
                    attempt.operationId, retryNumber, settings.deadlockRetries(), backoff.toMillis());
                notifyListener(() -> listener.onDeadlockRetry(attempt.operation, retryNumber, backoff));
                return CompletableFuture.runAsync(() -> pause(backoff), backoffExecutor)
                    .thenCompose(ignored -> submit(attempt.operation, attempt.context.withRetry()));
            }
            log.error("Operation {} still deadlocked after {} retries", attempt.operationId, retryCount);
            return CompletableFuture.failedFuture(cause);
        }

        if (cause instanceof SchemaOpsException) {
            return CompletableFuture.failedFuture(cause);
        }
        log.warn("Operation {} failed: {}", attempt.operationId, cause.getMessage());
        return CompletableFuture.failedFuture(
            new OperationFailedException(attempt.operationId, attempt.operation.sql(), cause));
    }

    private void pause(Duration backoff) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockException("Interrupted during deadlock backoff", e);
        }
    }

    // ========== Queue management ==========

    // caller holds the monitor
    private ActiveOperation reserve(Attempt attempt) {
        ActiveOperation op = new ActiveOperation(
            attempt.operationId, attempt.analysis, clock.instant(), attempt.resourceKey);
        activeLocks.computeIfAbsent(attempt.resourceKey, k -> new ArrayList<>()).add(op);
        return op;
    }

    // caller holds the monitor
    private QueuedOperation enqueue(Attempt attempt) {
        QueuedOperation entry = new QueuedOperation(attempt, clock.instant());
        lockQueue.computeIfAbsent(attempt.resourceKey, k -> new ArrayDeque<>()).addLast(entry);
        entry.timeout = queueTimer.schedule(
            () -> expire(entry), settings.lockTimeout().toMillis(), TimeUnit.MILLISECONDS);
        return entry;
    }

    private void expire(QueuedOperation entry) {
        String key = entry.attempt.resourceKey;
        boolean removed;
        synchronized (this) {
            Deque<QueuedOperation> queue = lockQueue.get(key);
            removed = queue != null && queue.remove(entry);
            if (queue != null && queue.isEmpty()) {
                lockQueue.remove(key);
            }
        }
        if (!removed) {
            return;
        }

        log.warn("Operation {} timed out after {}ms waiting for lock on '{}'",
            entry.attempt.operationId, settings.lockTimeout().toMillis(), key);
        notifyListener(() -> listener.onQueueTimeout(entry.attempt.operation, key));
        entry.result.completeExceptionally(new LockTimeoutException(
            String.format("Operation %s timed out waiting for lock on '%s'", entry.attempt.operationId, key),
            key, settings.lockTimeout()));
    }

    /**
     * Drop the operation's active record, then start whatever queued work
     * is now admissible: the same key's queue first, then other keys
     * (operations parked by backpressure).
     */
    private void finish(ActiveOperation op) {
        List<Admitted> admitted = new ArrayList<>();
        synchronized (this) {
            List<ActiveOperation> ops = activeLocks.get(op.resourceKey());
            if (ops != null) {
                ops.removeIf(candidate -> candidate == op);
                if (ops.isEmpty()) {
                    activeLocks.remove(op.resourceKey());
                }
            }

            drainQueue(op.resourceKey(), admitted);
            for (String key : new ArrayList<>(lockQueue.keySet())) {
                if (!key.equals(op.resourceKey())) {
                    drainQueue(key, admitted);
                }
            }
        }

        for (Admitted next : admitted) {
            QueuedOperation entry = next.entry;
            if (entry.timeout != null) {
                entry.timeout.cancel(false);
            }
            log.debug("Dequeued operation {} on '{}' after {}ms", entry.attempt.operationId,
                entry.attempt.resourceKey, Duration.between(entry.queuedAt, clock.instant()).toMillis());
            start(entry.attempt, next.reserved).whenComplete((result, error) -> {
                if (error == null) {
                    entry.result.complete(result);
                } else {
                    entry.result.completeExceptionally(unwrap(error));
                }
            });
        }
    }

    // caller holds the monitor
    private void drainQueue(String key, List<Admitted> admitted) {
        Deque<QueuedOperation> queue = lockQueue.get(key);
        if (queue == null) {
            return;
        }
        while (!queue.isEmpty()) {
            QueuedOperation head = queue.peekFirst();
            if (head.result.isDone()) {
                queue.pollFirst();
                continue;
            }
            if (hasConflicts(head.attempt.analysis, key)) {
                break;
            }
            queue.pollFirst();
            admitted.add(new Admitted(head, reserve(head.attempt)));
        }
        if (queue.isEmpty()) {
            lockQueue.remove(key);
        }
    }

    // ========== Statistics ==========

    public synchronized ExecutorStats getStats() {
        int activeOperations = activeLocks.values().stream().mapToInt(List::size).sum();
        int queued = (int) lockQueue.values().stream()
            .flatMap(Deque::stream)
            .filter(entry -> !entry.result.isDone())
            .count();

        List<OperationRecord> recent = history.recent(clock.instant());
        double successRate = recent.isEmpty()
            ? 1.0
            : (double) recent.stream().filter(OperationRecord::succeeded).count() / recent.size();
        double averageDuration = recent.stream()
            .mapToLong(r -> r.duration().toMillis())
            .average()
            .orElse(0.0);

        return new ExecutorStats(activeLocks.size(), activeOperations, queued,
            recent.size(), successRate, averageDuration);
    }

    public OperationHistory getHistory() {
        return history;
    }

    public synchronized List<ActiveOperation> getActiveOperations(String resourceKey) {
        return List.copyOf(activeLocks.getOrDefault(resourceKey, List.of()));
    }

    public ExecutorSettings getSettings() {
        return settings;
    }

    /**
     * Fail queued operations and stop accepting work. Running statements
     * are given up to 30 seconds to finish.
     */
    public void shutdown() {
        List<QueuedOperation> pending = new ArrayList<>();
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            lockQueue.values().forEach(pending::addAll);
            lockQueue.clear();
        }

        log.info("Shutting down executor, failing {} queued operations", pending.size());
        for (QueuedOperation entry : pending) {
            if (entry.timeout != null) {
                entry.timeout.cancel(false);
            }
            entry.result.completeExceptionally(new LockException(
                "Executor shut down before operation " + entry.attempt.operationId + " started"));
        }

        queueTimer.shutdownNow();
        backoffExecutor.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ========== Helpers ==========

    private void recordOutcome(Attempt attempt, Instant started, RuntimeException error) {
        Instant finished = clock.instant();
        Duration duration = Duration.between(started, finished);
        history.record(new OperationRecord(
            attempt.operation.label(),
            error == null ? OperationRecord.Status.SUCCESS : OperationRecord.Status.ERROR,
            duration,
            finished,
            error == null ? null : error.getMessage()
        ));
        notifyListener(() -> listener.onCompleted(attempt.operation, attempt.analysis, duration, error == null));
    }

    private void notifyListener(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("Execution listener failed: {}", e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class Attempt {
        final SqlOperation operation;
        final ExecutionContext context;
        final LockAnalysis analysis;
        final String resourceKey;
        final String operationId;

        Attempt(SqlOperation operation, ExecutionContext context, LockAnalysis analysis,
                String resourceKey, String operationId) {
            this.operation = operation;
            this.context = context;
            this.analysis = analysis;
            this.resourceKey = resourceKey;
            this.operationId = operationId;
        }
    }

    private static final class QueuedOperation {
        final Attempt attempt;
        final Instant queuedAt;
        final CompletableFuture<QueryResult> result = new CompletableFuture<>();
        volatile ScheduledFuture<?> timeout;

        QueuedOperation(Attempt attempt, Instant queuedAt) {
            this.attempt = attempt;
            this.queuedAt = queuedAt;
        }
    }

    private record Admitted(QueuedOperation entry, ActiveOperation reserved) {
    }
}
