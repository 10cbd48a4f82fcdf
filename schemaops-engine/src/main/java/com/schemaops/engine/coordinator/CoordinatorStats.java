package com.schemaops.engine.coordinator;

import com.schemaops.executor.ExecutorStats;

/**
 * Snapshot of coordinator activity. Rates and averages cover task attempts
 * finished in the last minute.
 */
public record CoordinatorStats(
    int runningTasks,
    int completedTasks,
    int failedTasks,
    int recentTasks,
    double successRate,
    double averageTaskDurationMillis,
    ExecutorStats executorStats
) {
}
