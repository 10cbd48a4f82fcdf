package com.schemaops.core.model;

/**
 * Lock requirements of a single statement.
 */
public record LockAnalysis(
    OperationType type,
    LockLevel level,
    boolean canRunConcurrently,
    boolean blocksReads,
    boolean blocksWrites,
    boolean requiresSpecialHandling
) {
    public static LockAnalysis ddl() {
        return new LockAnalysis(OperationType.DDL, LockLevel.ACCESS_EXCLUSIVE, false, true, true, false);
    }

    /**
     * At most one per resource key, but reads and writes continue.
     */
    public static LockAnalysis concurrentIndex() {
        return new LockAnalysis(OperationType.CONCURRENT_INDEX, LockLevel.SHARE_UPDATE_EXCLUSIVE,
            false, false, false, true);
    }

    public static LockAnalysis dml() {
        return new LockAnalysis(OperationType.DML, LockLevel.ROW_EXCLUSIVE, true, false, false, false);
    }

    public static LockAnalysis select() {
        return new LockAnalysis(OperationType.SELECT, LockLevel.ACCESS_SHARE, true, false, false, false);
    }

    /**
     * Fallback for statements the classifier does not recognise.
     */
    public static LockAnalysis unknown() {
        return new LockAnalysis(OperationType.UNKNOWN, LockLevel.EXCLUSIVE, false, true, true, false);
    }

    public boolean conflictsWith(LockAnalysis other) {
        return level.conflictsWith(other.level);
    }
}
