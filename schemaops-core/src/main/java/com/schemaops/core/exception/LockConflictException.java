package com.schemaops.core.exception;

/**
 * Thrown when a lock is currently held by another session and the caller
 * asked not to wait for it.
 */
public class LockConflictException extends LockException {

    public static final String ERROR_CODE = "LOCK_CONFLICT";

    private final String lockKey;
    private final String conflictingSession;

    public LockConflictException(String lockKey, String conflictingSession) {
        super(ERROR_CODE, String.format(
            "Lock '%s' is held by session %s",
            lockKey, conflictingSession
        ), null);
        this.lockKey = lockKey;
        this.conflictingSession = conflictingSession;
    }

    public String getLockKey() {
        return lockKey;
    }

    public String getConflictingSession() {
        return conflictingSession;
    }
}
