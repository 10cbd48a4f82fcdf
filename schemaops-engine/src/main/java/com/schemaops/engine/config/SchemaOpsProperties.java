package com.schemaops.engine.config;

import com.schemaops.advisory.LockManagerSettings;
import com.schemaops.core.model.BackoffPolicy;
import com.schemaops.engine.coordinator.CoordinatorSettings;
import com.schemaops.executor.ExecutorSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from {@code schemaops.*}. Anything left unset takes the
 * component's default.
 */
@ConfigurationProperties(prefix = "schemaops")
public record SchemaOpsProperties(
    Locks locks,
    Executor executor,
    Coordinator coordinator
) {
    public SchemaOpsProperties {
        locks = locks != null ? locks : new Locks(null, null);
        executor = executor != null ? executor : new Executor(null, null, null, null);
        coordinator = coordinator != null ? coordinator : new Coordinator(null, null);
    }

    /**
     * @param prefix namespace mixed into advisory lock keys
     * @param defaultTimeout wait bound for blocking lock acquisition
     */
    public record Locks(String prefix, Duration defaultTimeout) {

        public LockManagerSettings toSettings() {
            return new LockManagerSettings(prefix, defaultTimeout);
        }
    }

    /**
     * @param maxConcurrency worker threads running statements
     * @param lockTimeout per-statement lock_timeout and queue wait bound
     * @param deadlockRetries retries after a deadlock
     * @param backpressureThreshold pool utilisation above which work is queued
     */
    public record Executor(
        Integer maxConcurrency,
        Duration lockTimeout,
        Integer deadlockRetries,
        Double backpressureThreshold
    ) {
        public ExecutorSettings toSettings() {
            return new ExecutorSettings(
                maxConcurrency != null ? maxConcurrency : ExecutorSettings.DEFAULT_MAX_CONCURRENCY,
                lockTimeout != null ? lockTimeout : ExecutorSettings.DEFAULT_LOCK_TIMEOUT,
                deadlockRetries != null ? deadlockRetries : ExecutorSettings.DEFAULT_DEADLOCK_RETRIES,
                backpressureThreshold != null ? backpressureThreshold : ExecutorSettings.DEFAULT_BACKPRESSURE_THRESHOLD,
                BackoffPolicy.exponential()
            );
        }
    }

    /**
     * @param maxConcurrentTasks tasks of a run allowed at once
     * @param shutdownGracePeriod how long shutdown waits for running tasks
     */
    public record Coordinator(Integer maxConcurrentTasks, Duration shutdownGracePeriod) {

        public CoordinatorSettings toSettings() {
            return new CoordinatorSettings(
                maxConcurrentTasks != null ? maxConcurrentTasks : CoordinatorSettings.DEFAULT_MAX_CONCURRENT_TASKS,
                shutdownGracePeriod != null ? shutdownGracePeriod : CoordinatorSettings.DEFAULT_SHUTDOWN_GRACE_PERIOD,
                BackoffPolicy.exponential()
            );
        }
    }
}
