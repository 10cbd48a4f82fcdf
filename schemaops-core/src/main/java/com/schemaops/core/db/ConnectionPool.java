package com.schemaops.core.db;

/**
 * Source of pooled database sessions.
 * The only shared mutable resource the executor contends for.
 */
public interface ConnectionPool {

    /**
     * Borrow a connection, blocking until one is available.
     */
    DatabaseConnection acquire();

    /**
     * Return a connection obtained from {@link #acquire()}.
     */
    void release(DatabaseConnection connection);

    /**
     * Current utilisation, used for backpressure decisions.
     */
    PoolStats getStats();
}
