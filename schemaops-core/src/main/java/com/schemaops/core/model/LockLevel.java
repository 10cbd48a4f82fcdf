package com.schemaops.core.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * PostgreSQL table lock levels, weakest to strongest.
 * Conflicts follow PostgreSQL's lock-conflict matrix and are symmetric.
 */
public enum LockLevel {
    ACCESS_SHARE,
    ROW_SHARE,
    ROW_EXCLUSIVE,
    SHARE_UPDATE_EXCLUSIVE,
    SHARE,
    EXCLUSIVE,
    ACCESS_EXCLUSIVE;

    private static final Map<LockLevel, Set<LockLevel>> CONFLICTS = new EnumMap<>(LockLevel.class);

    static {
        CONFLICTS.put(ACCESS_EXCLUSIVE, EnumSet.allOf(LockLevel.class));
        CONFLICTS.put(EXCLUSIVE, EnumSet.of(
            ACCESS_SHARE, ROW_SHARE, ROW_EXCLUSIVE, SHARE_UPDATE_EXCLUSIVE, SHARE, EXCLUSIVE));
        CONFLICTS.put(SHARE_UPDATE_EXCLUSIVE, EnumSet.of(
            ROW_EXCLUSIVE, SHARE_UPDATE_EXCLUSIVE, SHARE, EXCLUSIVE));
        CONFLICTS.put(SHARE, EnumSet.of(ROW_EXCLUSIVE, SHARE_UPDATE_EXCLUSIVE, EXCLUSIVE));
        CONFLICTS.put(ROW_EXCLUSIVE, EnumSet.of(SHARE, SHARE_UPDATE_EXCLUSIVE, EXCLUSIVE));
        CONFLICTS.put(ROW_SHARE, EnumSet.of(EXCLUSIVE));
        CONFLICTS.put(ACCESS_SHARE, EnumSet.of(ACCESS_EXCLUSIVE, EXCLUSIVE));
    }

    /**
     * Check whether holding this level blocks the other one, in either direction.
     */
    public boolean conflictsWith(LockLevel other) {
        return CONFLICTS.get(this).contains(other) || CONFLICTS.get(other).contains(this);
    }
}
