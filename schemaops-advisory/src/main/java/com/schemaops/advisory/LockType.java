package com.schemaops.advisory;

/**
 * Advisory lock mode. Shared locks coexist with each other; exclusive locks
 * coexist with nothing.
 */
public enum LockType {
    EXCLUSIVE("pg_advisory_lock", "pg_try_advisory_lock", "pg_advisory_unlock"),
    SHARED("pg_advisory_lock_shared", "pg_try_advisory_lock_shared", "pg_advisory_unlock_shared");

    private final String lockFunction;
    private final String tryLockFunction;
    private final String unlockFunction;

    LockType(String lockFunction, String tryLockFunction, String unlockFunction) {
        this.lockFunction = lockFunction;
        this.tryLockFunction = tryLockFunction;
        this.unlockFunction = unlockFunction;
    }

    String lockFunction(boolean tryOnly) {
        return tryOnly ? tryLockFunction : lockFunction;
    }

    String unlockFunction() {
        return unlockFunction;
    }
}
