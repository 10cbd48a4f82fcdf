package com.schemaops.advisory;

import com.schemaops.core.exception.LockConflictException;
import com.schemaops.core.exception.LockException;
import com.schemaops.core.exception.LockTimeoutException;
import com.schemaops.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class AdvisoryLockManagerTest {

    private PgAdvisoryStub database;
    private TimeController time;
    private List<LockEvent> events;
    private AdvisoryLockManager manager;

    @BeforeEach
    void setUp() {
        database = new PgAdvisoryStub();
        time = TimeController.frozenAt(Instant.parse("2024-03-01T10:00:00Z"));
        events = new CopyOnWriteArrayList<>();
        manager = new AdvisoryLockManager(
            new LockManagerSettings("migrations", Duration.ofSeconds(30)), events::add, time);
    }

    @Test
    @DisplayName("Lock keys are deterministic and non-negative")
    void testGenerateLockKey() {
        int key = manager.generateLockKey("users");

        assertThat(manager.generateLockKey("users")).isEqualTo(key);
        assertThat(key).isEqualTo(Math.abs("migrations:users".hashCode()));
        assertThat(key).isNotNegative();
        assertThat(manager.generateLockKey("orders")).isNotEqualTo(key);
    }

    @Test
    @DisplayName("Lock keys depend on the manager prefix")
    void testPrefixChangesKey() {
        AdvisoryLockManager other = new AdvisoryLockManager(
            new LockManagerSettings("reporting", Duration.ofSeconds(5)), LockEventListener.NONE, time);

        assertThat(other.generateLockKey("users")).isNotEqualTo(manager.generateLockKey("users"));
    }

    @Test
    @DisplayName("Two-part key halves are independent")
    void testTwoPartKeyIndependence() {
        TwoPartKey a = manager.generateTwoPartKey("tenant-a", "users");
        TwoPartKey b = manager.generateTwoPartKey("tenant-a", "orders");
        TwoPartKey c = manager.generateTwoPartKey("tenant-b", "users");

        assertThat(a.key1()).isEqualTo(b.key1());
        assertThat(a.key2()).isEqualTo(c.key2());
        assertThat(a.key1()).isEqualTo(manager.generateLockKey("tenant-a"));
        assertThat(a.key2()).isEqualTo(manager.generateLockKey("users"));
    }

    @Test
    @DisplayName("Exclusive lock is visible in the catalog and released with its held duration")
    void testAcquireAndRelease() {
        PgAdvisoryStub.Session session = database.connect();

        LockAcquisition acquisition = manager.acquireExclusiveLock(session, "users");
        assertThat(acquisition.acquired()).isTrue();
        assertThat(acquisition.sessionId()).isEqualTo(String.valueOf(session.pid()));
        assertThat(manager.isLockHeld(session, "users")).isTrue();

        time.advanceSeconds(5);
        LockRelease release = manager.releaseLock(session, "users");

        assertThat(release.released()).isTrue();
        assertThat(release.heldFor()).isEqualTo(Duration.ofSeconds(5));
        assertThat(manager.isLockHeld(session, "users")).isFalse();
        assertThat(events).extracting(LockEvent::type).containsExactly(
            LockEvent.Type.ATTEMPT, LockEvent.Type.ACQUIRED, LockEvent.Type.RELEASED);
    }

    @Test
    @DisplayName("Blocking acquire restores the session lock_timeout")
    void testLockTimeoutRestored() {
        PgAdvisoryStub.Session session = database.connect();

        manager.acquireExclusiveLock(session, "users", LockOptions.timeout(Duration.ofMillis(750)));

        assertThat(session.statements())
            .filteredOn(sql -> sql.contains("set_config"))
            .hasSize(2);
        assertThat(session.query("SELECT current_setting('lock_timeout') AS lock_timeout").firstValue("lock_timeout"))
            .contains("0");
    }

    @Test
    @DisplayName("Releasing a lock that is not held returns false")
    void testReleaseNotHeld() {
        PgAdvisoryStub.Session session = database.connect();

        LockRelease release = manager.releaseLock(session, "never-locked");

        assertThat(release.released()).isFalse();
        assertThat(release.heldFor()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("Try-acquire reports contention without waiting")
    void testTryAcquireContended() {
        PgAdvisoryStub.Session owner = database.connect();
        PgAdvisoryStub.Session other = database.connect();

        assertThat(manager.tryAcquireExclusiveLock(owner, "orders").acquired()).isTrue();
        assertThat(manager.tryAcquireExclusiveLock(other, "orders").acquired()).isFalse();
        assertThat(manager.tryAcquireSharedLock(other, "orders").acquired()).isFalse();
    }

    @Test
    @DisplayName("Shared locks coexist across sessions but block exclusive")
    void testSharedLocks() {
        PgAdvisoryStub.Session first = database.connect();
        PgAdvisoryStub.Session second = database.connect();

        manager.acquireSharedLock(first, "catalog");
        manager.acquireSharedLock(second, "catalog");

        assertThat(manager.tryAcquireExclusiveLock(first, "catalog").acquired()).isFalse();
        assertThat(manager.getLockStatistics().locksByType()).containsEntry(LockType.SHARED, 2);

        assertThat(manager.releaseLock(first, "catalog").released()).isTrue();
        assertThat(manager.releaseLock(second, "catalog").released()).isTrue();
        assertThat(manager.getLockStatistics().totalLocks()).isZero();
    }

    @Test
    @DisplayName("Blocking acquire times out with the lock key and timeout")
    void testAcquireTimeout() {
        PgAdvisoryStub.Session owner = database.connect();
        PgAdvisoryStub.Session waiter = database.connect();
        manager.acquireExclusiveLock(owner, "users");

        assertThatThrownBy(() -> manager.acquireExclusiveLock(waiter, "users",
                LockOptions.timeout(Duration.ofMillis(50))))
            .isInstanceOfSatisfying(LockTimeoutException.class, e -> {
                assertThat(e.getLockKey()).isEqualTo(String.valueOf(manager.generateLockKey("users")));
                assertThat(e.getTimeout()).isEqualTo(Duration.ofMillis(50));
                assertThat(e.getErrorCode()).isEqualTo(LockTimeoutException.ERROR_CODE);
            });
        assertThat(events).extracting(LockEvent::type).contains(LockEvent.Type.TIMEOUT);
        assertThat(manager.getLockStatistics().activeSessions())
            .containsExactly(String.valueOf(owner.pid()));
    }

    @Test
    @DisplayName("A sub-millisecond timeout still bounds the wait")
    void testSubMillisecondTimeout() throws Exception {
        PgAdvisoryStub.Session owner = database.connect();
        PgAdvisoryStub.Session waiter = database.connect();
        manager.acquireExclusiveLock(owner, "users");

        CompletableFuture<LockAcquisition> pending = CompletableFuture.supplyAsync(() ->
            manager.acquireExclusiveLock(waiter, "users", LockOptions.timeout(Duration.ofNanos(500_000))));

        assertThatThrownBy(() -> pending.get(5, TimeUnit.SECONDS))
            .hasCauseInstanceOf(LockTimeoutException.class);
        assertThat(AdvisoryLockManager.lockTimeoutMillis(Duration.ofNanos(1))).isEqualTo(1);
        assertThat(AdvisoryLockManager.lockTimeoutMillis(Duration.ofMillis(1500))).isEqualTo(1500);
        assertThat(AdvisoryLockManager.lockTimeoutMillis(Duration.ofMillis(1500).plusNanos(1))).isEqualTo(1501);
    }

    @Test
    void testNonPositiveTimeoutRejected() {
        assertThatThrownBy(() -> LockOptions.timeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeout must be positive");
        assertThatThrownBy(() -> LockOptions.namespace("tenant-a").withTimeout(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(LockOptions.timeout(null).timeout()).isNull();
    }

    @Test
    @DisplayName("Blocking acquire proceeds once the holder releases")
    void testAcquireWaitsForRelease() throws Exception {
        PgAdvisoryStub.Session owner = database.connect();
        PgAdvisoryStub.Session waiter = database.connect();
        manager.acquireExclusiveLock(owner, "users");

        CompletableFuture<LockAcquisition> pending = CompletableFuture.supplyAsync(() ->
            manager.acquireExclusiveLock(waiter, "users", LockOptions.timeout(Duration.ofSeconds(5))));

        Thread.sleep(100);
        assertThat(pending).isNotDone();

        manager.releaseLock(owner, "users");
        assertThat(pending.get(5, TimeUnit.SECONDS).acquired()).isTrue();
    }

    @Test
    @DisplayName("Reacquiring a held lock stacks holds instead of deadlocking")
    void testReentrantAcquire() {
        PgAdvisoryStub.Session session = database.connect();

        manager.acquireExclusiveLock(session, "users");
        manager.acquireExclusiveLock(session, "users", LockOptions.timeout(Duration.ofMillis(50)));

        assertThat(manager.getLockDetails()).singleElement()
            .extracting(LockDetail::holdCount).isEqualTo(2);
        String sessionId = manager.getSessionId(session);
        assertThat(manager.getLockRecord(sessionId, "users", LockType.EXCLUSIVE))
            .hasValueSatisfying(record -> assertThat(record.holdCount()).isEqualTo(2));
        assertThat(manager.getLockRecord(sessionId, "users", LockType.SHARED)).isEmpty();

        assertThat(manager.releaseLock(session, "users").released()).isTrue();
        assertThat(manager.isLockHeld(session, "users")).isTrue();
        assertThat(manager.releaseLock(session, "users").released()).isTrue();
        assertThat(manager.isLockHeld(session, "users")).isFalse();
        assertThat(manager.getLockDetails()).isEmpty();
    }

    @Test
    @DisplayName("Namespaced locks use the two-part form")
    void testTwoPartLock() {
        PgAdvisoryStub.Session session = database.connect();
        LockOptions tenant = LockOptions.namespace("tenant-a");

        LockAcquisition acquisition = manager.acquireExclusiveLock(session, "users", tenant);

        assertThat(acquisition.twoPartKey()).isEqualTo(manager.generateTwoPartKey("tenant-a", "users"));
        assertThat(manager.isLockHeld(session, "users", tenant)).isTrue();
        assertThat(manager.isLockHeld(session, "users")).isFalse();
        assertThat(manager.getSessionLocks(session)).singleElement()
            .satisfies(lock -> {
                assertThat(lock.twoPart()).isTrue();
                assertThat(lock.classId()).isEqualTo(acquisition.twoPartKey().key1());
                assertThat(lock.objId()).isEqualTo(acquisition.twoPartKey().key2());
            });
    }

    @Test
    @DisplayName("Fail-fast acquire names the holding session")
    void testAcquireOrFail() {
        PgAdvisoryStub.Session owner = database.connect();
        PgAdvisoryStub.Session other = database.connect();
        manager.acquireExclusiveLock(owner, "users");

        assertThatThrownBy(() -> manager.acquireExclusiveLockOrFail(other, "users", LockOptions.DEFAULTS))
            .isInstanceOfSatisfying(LockConflictException.class, e ->
                assertThat(e.getConflictingSession()).isEqualTo(String.valueOf(owner.pid())));
    }

    @Test
    @DisplayName("Release all clears catalog and cache for the session")
    void testReleaseAll() {
        PgAdvisoryStub.Session session = database.connect();
        PgAdvisoryStub.Session other = database.connect();
        manager.acquireExclusiveLock(session, "users");
        manager.acquireSharedLock(session, "orders");
        manager.acquireExclusiveLock(other, "audit");

        assertThat(manager.releaseAllLocks(session)).isEqualTo(2);

        assertThat(manager.getSessionLocks(session)).isEmpty();
        assertThat(manager.isLockHeld(session, "users")).isFalse();
        LockStatistics stats = manager.getLockStatistics();
        assertThat(stats.totalSessions()).isEqualTo(1);
        assertThat(stats.totalLocks()).isEqualTo(1);
    }

    @Test
    @DisplayName("Lock details are ordered by acquisition time")
    void testLockDetails() {
        PgAdvisoryStub.Session session = database.connect();
        manager.acquireExclusiveLock(session, "first");
        time.advanceSeconds(2);
        manager.acquireExclusiveLock(session, "second");
        time.advanceSeconds(3);

        List<LockDetail> details = manager.getLockDetails();

        assertThat(details).extracting(LockDetail::identifier).containsExactly("first", "second");
        assertThat(details).extracting(LockDetail::heldFor)
            .containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(3));

        manager.cleanup();
        assertThat(manager.getLockDetails()).isEmpty();
        assertThat(manager.isLockHeld(session, "first")).isTrue();
    }

    @Test
    @DisplayName("Database failures surface as LockException and session id falls back to unknown")
    void testBrokenConnection() {
        PgAdvisoryStub.Session session = database.connect();
        session.breakConnection();

        assertThat(manager.getSessionId(session)).isEqualTo(AdvisoryLockManager.UNKNOWN_SESSION);
        assertThatThrownBy(() -> manager.tryAcquireExclusiveLock(session, "users"))
            .isInstanceOf(LockException.class);
        assertThatThrownBy(() -> manager.acquireExclusiveLock(session, "users"))
            .isInstanceOf(LockException.class)
            .isNotInstanceOf(LockTimeoutException.class);
    }
}
