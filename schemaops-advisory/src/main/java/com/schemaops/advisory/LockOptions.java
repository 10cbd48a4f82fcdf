package com.schemaops.advisory;

import java.time.Duration;

/**
 * Per-call lock options.
 *
 * @param timeout how long a blocking acquire may wait; null uses the manager default
 * @param namespace when set, the lock uses the two-part key (namespace, identifier)
 */
public record LockOptions(Duration timeout, String namespace) {

    public static final LockOptions DEFAULTS = new LockOptions(null, null);

    public LockOptions {
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static LockOptions timeout(Duration timeout) {
        return new LockOptions(timeout, null);
    }

    public static LockOptions namespace(String namespace) {
        return new LockOptions(null, namespace);
    }

    public LockOptions withTimeout(Duration timeout) {
        return new LockOptions(timeout, namespace);
    }

    boolean twoPart() {
        return namespace != null;
    }
}
