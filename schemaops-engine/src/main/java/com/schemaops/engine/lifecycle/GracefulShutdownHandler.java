package com.schemaops.engine.lifecycle;

import com.schemaops.advisory.AdvisoryLockManager;
import com.schemaops.advisory.LockStatistics;
import com.schemaops.engine.coordinator.TaskGraphCoordinator;
import com.schemaops.executor.LockAwareExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shuts the orchestration components down in dependency order when the
 * application context closes.
 *
 * On shutdown:
 * 1. The coordinator stops starting tasks and waits out its grace period
 * 2. The executor fails queued operations and lets running statements finish
 * 3. The advisory lock cache is cleared; the database releases the locks
 *    themselves when the pool closes their sessions
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final TaskGraphCoordinator coordinator;
    private final LockAwareExecutor executor;
    private final AdvisoryLockManager lockManager;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownHandler(TaskGraphCoordinator coordinator, LockAwareExecutor executor,
                                   AdvisoryLockManager lockManager) {
        this.coordinator = coordinator;
        this.executor = executor;
        this.lockManager = lockManager;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Runs before the context destroys its beans, so the pool is still open.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        shutdown();
    }

    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown ({} tasks running, {} operations queued)",
            coordinator.getRunningTaskCount(), executor.getStats().queuedOperations());

        coordinator.shutdown();
        executor.shutdown();

        LockStatistics locks = lockManager.getLockStatistics();
        if (locks.totalLocks() > 0) {
            log.warn("{} advisory locks still tracked for sessions {}; they end with their sessions",
                locks.totalLocks(), locks.activeSessions());
        }
        lockManager.cleanup();

        log.info("Graceful shutdown complete");
    }
}
