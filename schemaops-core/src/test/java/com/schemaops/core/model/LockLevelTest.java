package com.schemaops.core.model;

import org.junit.jupiter.api.Test;

import static com.schemaops.core.model.LockLevel.*;
import static org.junit.jupiter.api.Assertions.*;

class LockLevelTest {

    @Test
    void accessExclusive_shouldConflictWithEverything() {
        for (LockLevel level : LockLevel.values()) {
            assertTrue(ACCESS_EXCLUSIVE.conflictsWith(level), level.name());
        }
    }

    @Test
    void conflicts_shouldBeSymmetric() {
        for (LockLevel a : LockLevel.values()) {
            for (LockLevel b : LockLevel.values()) {
                assertEquals(a.conflictsWith(b), b.conflictsWith(a), a + " vs " + b);
            }
        }
    }

    @Test
    void readsAndWrites_shouldCoexist() {
        assertFalse(ACCESS_SHARE.conflictsWith(ACCESS_SHARE));
        assertFalse(ACCESS_SHARE.conflictsWith(ROW_EXCLUSIVE));
        assertFalse(ROW_EXCLUSIVE.conflictsWith(ROW_EXCLUSIVE));
        assertFalse(ROW_SHARE.conflictsWith(SHARE));
    }

    @Test
    void shareUpdateExclusive_shouldConflictWithItself() {
        assertTrue(SHARE_UPDATE_EXCLUSIVE.conflictsWith(SHARE_UPDATE_EXCLUSIVE));
        assertTrue(SHARE_UPDATE_EXCLUSIVE.conflictsWith(ROW_EXCLUSIVE));
        assertFalse(SHARE_UPDATE_EXCLUSIVE.conflictsWith(ACCESS_SHARE));
    }

    @Test
    void exclusive_shouldBlockReads() {
        assertTrue(EXCLUSIVE.conflictsWith(ACCESS_SHARE));
        assertTrue(LockAnalysis.unknown().conflictsWith(LockAnalysis.select()));
        assertFalse(LockAnalysis.dml().conflictsWith(LockAnalysis.select()));
    }
}
