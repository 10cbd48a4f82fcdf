package com.schemaops.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Puts the correlation ids of the current graph run, task or SQL operation
 * on the logging thread and removes them again on close.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(runId, taskId, attempt)) {
 *     log.info("Running task"); // includes runId, taskId, attempt
 * }
 * </pre>
 *
 * MDC is per thread: open a context on every thread that logs for a task.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String TASK_ID = "taskId";
    public static final String ATTEMPT = "attempt";
    public static final String OPERATION_ID = "operationId";
    public static final String RESOURCE_KEY = "resourceKey";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    /**
     * Context for graph-level logging.
     */
    public static LoggingContext forRun(String runId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(RUN_ID, runId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Context for one attempt of a task.
     */
    public static LoggingContext forTask(String runId, String taskId, int attempt) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(RUN_ID, runId);
        putIfPresent(TASK_ID, taskId);
        MDC.put(ATTEMPT, String.valueOf(attempt));
        ensureTraceId();
        return ctx;
    }

    /**
     * Context for a SQL operation run through the executor.
     */
    public static LoggingContext forOperation(String operationId, String resourceKey) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(OPERATION_ID, operationId);
        putIfPresent(RESOURCE_KEY, resourceKey);
        ensureTraceId();
        return ctx;
    }

    public static String getRunId() {
        return MDC.get(RUN_ID);
    }

    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(RUN_ID);
        MDC.remove(TASK_ID);
        MDC.remove(ATTEMPT);
        MDC.remove(OPERATION_ID);
        MDC.remove(RESOURCE_KEY);
        // TRACE_ID stays for the rest of the thread's unit of work
    }

    /**
     * Clear all MDC context, including the trace id.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
