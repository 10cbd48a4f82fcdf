package com.schemaops.advisory;

import java.time.Duration;

/**
 * Advisory lock manager configuration.
 *
 * @param prefix namespace mixed into every single-key hash
 * @param defaultTimeout wait bound for blocking acquisitions
 */
public record LockManagerSettings(String prefix, Duration defaultTimeout) {

    public static final String DEFAULT_PREFIX = "schemaops";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public LockManagerSettings {
        if (prefix == null || prefix.isEmpty()) {
            prefix = DEFAULT_PREFIX;
        }
        if (defaultTimeout == null) {
            defaultTimeout = DEFAULT_TIMEOUT;
        }
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
    }

    public static LockManagerSettings defaults() {
        return new LockManagerSettings(DEFAULT_PREFIX, DEFAULT_TIMEOUT);
    }
}
