package com.schemaops.core.exception;

import java.time.Duration;

/**
 * Thrown when a blocking lock acquisition, or an operation waiting for a
 * conflicting one to finish, exceeds its deadline.
 */
public class LockTimeoutException extends LockException {

    public static final String ERROR_CODE = "LOCK_TIMEOUT";

    private final String lockKey;
    private final Duration timeout;

    public LockTimeoutException(String message, String lockKey, Duration timeout) {
        this(message, lockKey, timeout, null);
    }

    public LockTimeoutException(String message, String lockKey, Duration timeout, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.lockKey = lockKey;
        this.timeout = timeout;
    }

    public String getLockKey() {
        return lockKey;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
