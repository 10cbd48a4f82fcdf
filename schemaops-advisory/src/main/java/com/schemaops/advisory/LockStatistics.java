package com.schemaops.advisory;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of the manager's lock cache.
 */
public record LockStatistics(
    int totalSessions,
    int totalLocks,
    Map<LockType, Integer> locksByType,
    List<String> activeSessions
) {
}
