package com.schemaops.core.db;

/**
 * Connection pool utilisation snapshot.
 *
 * @param active connections currently borrowed
 * @param total pool capacity
 */
public record PoolStats(int active, int total) {

    public double utilization() {
        return total <= 0 ? 0.0 : (double) active / total;
    }
}
