package com.schemaops.advisory;

/**
 * Receives advisory lock events. Called on the acquiring thread; keep it cheap.
 */
@FunctionalInterface
public interface LockEventListener {

    LockEventListener NONE = event -> { };

    void onLockEvent(LockEvent event);
}
