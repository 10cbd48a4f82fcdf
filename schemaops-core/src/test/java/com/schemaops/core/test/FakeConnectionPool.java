package com.schemaops.core.test;

import com.schemaops.core.db.ConnectionPool;
import com.schemaops.core.db.DatabaseConnection;
import com.schemaops.core.db.PoolStats;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Unbounded pool of {@link FakeConnection}s sharing one script and statement log.
 * Reported utilisation can be pinned to exercise backpressure.
 */
public class FakeConnectionPool implements ConnectionPool {

    private final StatementScript script = new StatementScript();
    private final Queue<String> log = StatementScript.newLog();
    private final AtomicInteger nextSession = new AtomicInteger(1000);
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger acquired = new AtomicInteger();
    private final int total;
    private volatile PoolStats pinnedStats;

    public FakeConnectionPool() {
        this(10);
    }

    public FakeConnectionPool(int total) {
        this.total = total;
    }

    @Override
    public DatabaseConnection acquire() {
        active.incrementAndGet();
        acquired.incrementAndGet();
        return new FakeConnection(nextSession.getAndIncrement(), script, log);
    }

    @Override
    public void release(DatabaseConnection connection) {
        active.decrementAndGet();
    }

    @Override
    public PoolStats getStats() {
        PoolStats pinned = pinnedStats;
        return pinned != null ? pinned : new PoolStats(active.get(), total);
    }

    /**
     * Report fixed stats regardless of real usage; null restores live counts.
     */
    public void pinStats(PoolStats stats) {
        this.pinnedStats = stats;
    }

    public StatementScript script() {
        return script;
    }

    /**
     * Every statement run on any connection from this pool, in arrival order.
     */
    public List<String> executedStatements() {
        return new ArrayList<>(log);
    }

    /**
     * Executed statements containing the fragment.
     */
    public List<String> executed(String fragment) {
        return executedStatements().stream()
            .filter(sql -> sql.contains(fragment))
            .toList();
    }

    public int activeConnections() {
        return active.get();
    }

    public int acquiredConnections() {
        return acquired.get();
    }
}
