package com.schemaops.core.model;

/**
 * Statement families distinguished by the lock classifier.
 */
public enum OperationType {
    DDL,
    /**
     * CREATE INDEX CONCURRENTLY (and DROP INDEX CONCURRENTLY).
     */
    CONCURRENT_INDEX,
    DML,
    SELECT,
    UNKNOWN
}
