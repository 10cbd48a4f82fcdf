package com.schemaops.advisory;

/**
 * Advisory lock row from {@code pg_locks} for the current backend.
 */
public record SessionLock(long classId, long objId, int objSubId, String mode, boolean granted, String sessionId) {

    /**
     * True for locks taken with the two-argument functions.
     */
    public boolean twoPart() {
        return objSubId == 2;
    }
}
