package com.schemaops.advisory;

import com.schemaops.core.db.DatabaseConnection;
import com.schemaops.core.db.QueryResult;
import com.schemaops.core.exception.LockConflictException;
import com.schemaops.core.exception.LockException;
import com.schemaops.core.exception.LockTimeoutException;
import com.schemaops.core.util.SqlErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL advisory lock coordination.
 *
 * Lock keys are hashed from string identifiers, so independent processes
 * agree on a key without a shared allocator. Two identifiers may collide;
 * callers needing isolation use a namespace, which selects the two-argument
 * lock form.
 *
 * Locks belong to the database session. The manager keeps a per-session
 * cache of what it acquired for statistics and held-duration reporting;
 * {@link #isLockHeld} and {@link #getSessionLocks} read the lock catalog
 * and are authoritative.
 *
 * Reentrant: PostgreSQL stacks advisory locks per session, so acquiring a
 * held lock again succeeds immediately and must be matched by another release.
 */
public class AdvisoryLockManager {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryLockManager.class);

    static final String UNKNOWN_SESSION = "unknown";

    private static final String SESSION_ID_SQL = "SELECT pg_backend_pid() AS session_id";
    private static final String CURRENT_LOCK_TIMEOUT_SQL = "SELECT current_setting('lock_timeout') AS lock_timeout";
    private static final String SET_LOCK_TIMEOUT_SQL = "SELECT set_config('lock_timeout', ?, false)";
    private static final String UNLOCK_ALL_SQL = "SELECT pg_advisory_unlock_all()";

    private static final String LOCK_HELD_SQL = """
        SELECT EXISTS(
            SELECT 1 FROM pg_locks
            WHERE locktype = 'advisory'
              AND classid::bigint = ?
              AND objid::bigint = ?
              AND objsubid = ?
              AND granted
        ) AS locked
        """;

    private static final String LOCK_HOLDER_SQL = """
        SELECT pid FROM pg_locks
        WHERE locktype = 'advisory'
          AND classid::bigint = ?
          AND objid::bigint = ?
          AND objsubid = ?
          AND granted
          AND pid <> pg_backend_pid()
        LIMIT 1
        """;

    private static final String SESSION_LOCKS_SQL = """
        SELECT classid::bigint AS classid, objid::bigint AS objid, objsubid, mode, granted
        FROM pg_locks
        WHERE locktype = 'advisory'
          AND pid = pg_backend_pid()
        ORDER BY classid, objid
        """;

    private final LockManagerSettings settings;
    private final LockEventListener listener;
    private final Clock clock;

    // sessionId -> held locks; guarded by this
    private final Map<String, Map<LockHandle, LockRecord>> activeLocks = new LinkedHashMap<>();

    public AdvisoryLockManager() {
        this(LockManagerSettings.defaults(), LockEventListener.NONE, Clock.systemUTC());
    }

    public AdvisoryLockManager(LockManagerSettings settings, LockEventListener listener, Clock clock) {
        this.settings = settings;
        this.listener = listener != null ? listener : LockEventListener.NONE;
        this.clock = clock;
    }

    // ========== Key derivation ==========

    /**
     * Hash {@code prefix:identifier} into a non-negative 32-bit key.
     * Pure: the same identifier and prefix always give the same key.
     */
    public int generateLockKey(String identifier) {
        return foldKey(settings.prefix() + ":" + identifier);
    }

    /**
     * Hash namespace and identifier independently into a key pair.
     */
    public TwoPartKey generateTwoPartKey(String namespace, String identifier) {
        return new TwoPartKey(generateLockKey(namespace), generateLockKey(identifier));
    }

    /**
     * Whole milliseconds for {@code lock_timeout}, rounded up: PostgreSQL
     * reads 0 as "wait forever".
     */
    static long lockTimeoutMillis(Duration timeout) {
        long millis = timeout.toMillis();
        if (timeout.minusMillis(millis).isZero() && millis > 0) {
            return millis;
        }
        return millis + 1;
    }

    private static int foldKey(String value) {
        // String.hashCode is the 31-multiplier fold over UTF-16 units
        int hash = value.hashCode();
        return hash == Integer.MIN_VALUE ? Integer.MAX_VALUE : Math.abs(hash);
    }

    // ========== Acquisition ==========

    public LockAcquisition acquireExclusiveLock(DatabaseConnection connection, String identifier) {
        return acquireLock(connection, identifier, LockType.EXCLUSIVE, LockOptions.DEFAULTS);
    }

    public LockAcquisition acquireExclusiveLock(DatabaseConnection connection, String identifier, LockOptions options) {
        return acquireLock(connection, identifier, LockType.EXCLUSIVE, options);
    }

    public LockAcquisition acquireSharedLock(DatabaseConnection connection, String identifier) {
        return acquireLock(connection, identifier, LockType.SHARED, LockOptions.DEFAULTS);
    }

    public LockAcquisition acquireSharedLock(DatabaseConnection connection, String identifier, LockOptions options) {
        return acquireLock(connection, identifier, LockType.SHARED, options);
    }

    public LockAcquisition tryAcquireExclusiveLock(DatabaseConnection connection, String identifier) {
        return tryAcquireLock(connection, identifier, LockType.EXCLUSIVE, LockOptions.DEFAULTS);
    }

    public LockAcquisition tryAcquireExclusiveLock(DatabaseConnection connection, String identifier, LockOptions options) {
        return tryAcquireLock(connection, identifier, LockType.EXCLUSIVE, options);
    }

    public LockAcquisition tryAcquireSharedLock(DatabaseConnection connection, String identifier) {
        return tryAcquireLock(connection, identifier, LockType.SHARED, LockOptions.DEFAULTS);
    }

    public LockAcquisition tryAcquireSharedLock(DatabaseConnection connection, String identifier, LockOptions options) {
        return tryAcquireLock(connection, identifier, LockType.SHARED, options);
    }

    /**
     * Block until the lock is granted or the timeout elapses.
     * The wait is bounded server-side through the session's {@code lock_timeout},
     * which is restored afterwards.
     *
     * @throws LockTimeoutException if the lock is not granted in time
     * @throws LockException on any other database failure
     */
    public LockAcquisition acquireLock(DatabaseConnection connection, String identifier,
                                       LockType lockType, LockOptions options) {
        LockHandle handle = handle(identifier, lockType, options);
        String sessionId = getSessionId(connection);
        Duration timeout = options.timeout() != null ? options.timeout() : settings.defaultTimeout();

        emit(LockEvent.Type.ATTEMPT, handle, identifier, sessionId, Duration.ZERO);
        log.debug("Acquiring {} lock {} ({}) for session {}", lockType, handle.lockKey, identifier, sessionId);

        String previousTimeout = currentLockTimeout(connection);
        try {
            connection.query(SET_LOCK_TIMEOUT_SQL, lockTimeoutMillis(timeout) + "ms");
            runLockFunction(connection, handle, false);
        } catch (RuntimeException e) {
            if (SqlErrors.isLockNotAvailable(e)) {
                emit(LockEvent.Type.TIMEOUT, handle, identifier, sessionId, timeout);
                log.warn("Timed out after {}ms waiting for {} lock on {}", timeout.toMillis(), lockType, identifier);
                throw new LockTimeoutException(
                    String.format("Failed to acquire %s lock on %s within %dms",
                        lockType.name().toLowerCase(), identifier, timeout.toMillis()),
                    String.valueOf(handle.lockKey), timeout, e);
            }
            throw new LockException(
                String.format("Failed to acquire %s lock on %s: %s",
                    lockType.name().toLowerCase(), identifier, e.getMessage()), e);
        } finally {
            restoreLockTimeout(connection, previousTimeout);
        }

        register(sessionId, handle, identifier);
        emit(LockEvent.Type.ACQUIRED, handle, identifier, sessionId, Duration.ZERO);
        return new LockAcquisition(handle.lockKey, handle.twoPartKey, true, sessionId);
    }

    /**
     * Attempt the lock once without waiting.
     */
    public LockAcquisition tryAcquireLock(DatabaseConnection connection, String identifier,
                                          LockType lockType, LockOptions options) {
        LockHandle handle = handle(identifier, lockType, options);
        String sessionId = getSessionId(connection);

        emit(LockEvent.Type.ATTEMPT, handle, identifier, sessionId, Duration.ZERO);

        boolean acquired;
        try {
            acquired = runLockFunction(connection, handle, true);
        } catch (RuntimeException e) {
            throw new LockException(
                String.format("Failed to try %s lock on %s: %s",
                    lockType.name().toLowerCase(), identifier, e.getMessage()), e);
        }

        if (acquired) {
            register(sessionId, handle, identifier);
            emit(LockEvent.Type.ACQUIRED, handle, identifier, sessionId, Duration.ZERO);
        } else {
            log.debug("{} lock on {} is busy", lockType, identifier);
        }
        return new LockAcquisition(handle.lockKey, handle.twoPartKey, acquired, sessionId);
    }

    /**
     * Take an exclusive lock without waiting, or fail naming the session that holds it.
     *
     * @throws LockConflictException if another session holds the lock
     */
    public LockAcquisition acquireExclusiveLockOrFail(DatabaseConnection connection, String identifier,
                                                      LockOptions options) {
        LockAcquisition acquisition = tryAcquireLock(connection, identifier, LockType.EXCLUSIVE, options);
        if (acquisition.acquired()) {
            return acquisition;
        }
        LockHandle handle = handle(identifier, LockType.EXCLUSIVE, options);
        String holder;
        try {
            holder = connection.query(LOCK_HOLDER_SQL, catalogParams(handle))
                .firstValue("pid")
                .map(String::valueOf)
                .orElse(UNKNOWN_SESSION);
        } catch (RuntimeException e) {
            throw new LockException("Failed to look up holder of lock on " + identifier, e);
        }
        throw new LockConflictException(String.valueOf(handle.lockKey), holder);
    }

    // ========== Release ==========

    /**
     * Release one hold on the lock. Releasing a lock the session does not
     * hold returns {@code released = false}.
     */
    public LockRelease releaseLock(DatabaseConnection connection, String identifier) {
        return releaseLock(connection, identifier, LockOptions.DEFAULTS);
    }

    public LockRelease releaseLock(DatabaseConnection connection, String identifier, LockOptions options) {
        String sessionId = getSessionId(connection);
        LockHandle exclusive = handle(identifier, LockType.EXCLUSIVE, options);
        LockHandle handle = isTracked(sessionId, exclusive) || !isTracked(sessionId, exclusive.as(LockType.SHARED))
            ? exclusive
            : exclusive.as(LockType.SHARED);

        boolean released;
        try {
            QueryResult result = connection.query(unlockSql(handle), lockParams(handle));
            released = result.firstValue("released").map(Boolean.TRUE::equals).orElse(false);
        } catch (RuntimeException e) {
            throw new LockException("Failed to release lock on " + identifier + ": " + e.getMessage(), e);
        }

        if (!released) {
            log.debug("Session {} did not hold lock {} ({})", sessionId, handle.lockKey, identifier);
            return new LockRelease(handle.lockKey, false, sessionId, Duration.ZERO);
        }

        Duration heldFor = unregister(sessionId, handle);
        emit(LockEvent.Type.RELEASED, handle, identifier, sessionId, heldFor);
        log.debug("Released {} lock {} ({}) after {}ms", handle.type, handle.lockKey, identifier, heldFor.toMillis());
        return new LockRelease(handle.lockKey, true, sessionId, heldFor);
    }

    /**
     * Release every advisory lock the session holds and forget its cached records.
     *
     * @return number of cached locks that were cleared
     */
    public int releaseAllLocks(DatabaseConnection connection) {
        String sessionId = getSessionId(connection);
        try {
            connection.query(UNLOCK_ALL_SQL);
        } catch (RuntimeException e) {
            throw new LockException("Failed to release all locks: " + e.getMessage(), e);
        }

        Map<LockHandle, LockRecord> cleared;
        synchronized (this) {
            cleared = activeLocks.remove(sessionId);
        }
        int count = cleared != null ? cleared.size() : 0;
        log.info("Released all advisory locks for session {} ({} tracked)", sessionId, count);
        return count;
    }

    // ========== Introspection ==========

    /**
     * Check the lock catalog for a granted lock on the identifier, held by any session.
     */
    public boolean isLockHeld(DatabaseConnection connection, String identifier) {
        return isLockHeld(connection, identifier, LockOptions.DEFAULTS);
    }

    public boolean isLockHeld(DatabaseConnection connection, String identifier, LockOptions options) {
        LockHandle handle = handle(identifier, LockType.EXCLUSIVE, options);
        try {
            return connection.query(LOCK_HELD_SQL, catalogParams(handle))
                .firstValue("locked")
                .map(Boolean.TRUE::equals)
                .orElse(false);
        } catch (RuntimeException e) {
            throw new LockException("Failed to check lock status: " + e.getMessage(), e);
        }
    }

    /**
     * Advisory locks held by the connection's session, read from the lock catalog.
     */
    public List<SessionLock> getSessionLocks(DatabaseConnection connection) {
        String sessionId = getSessionId(connection);
        try {
            return connection.query(SESSION_LOCKS_SQL).rows().stream()
                .map(row -> new SessionLock(
                    ((Number) row.get("classid")).longValue(),
                    ((Number) row.get("objid")).longValue(),
                    ((Number) row.get("objsubid")).intValue(),
                    (String) row.get("mode"),
                    Boolean.TRUE.equals(row.get("granted")),
                    sessionId))
                .toList();
        } catch (RuntimeException e) {
            throw new LockException("Failed to get session locks: " + e.getMessage(), e);
        }
    }

    /**
     * Backend pid of the connection's session, or {@code "unknown"} if it cannot be read.
     */
    public String getSessionId(DatabaseConnection connection) {
        try {
            return connection.query(SESSION_ID_SQL)
                .firstValue("session_id")
                .map(String::valueOf)
                .orElse(UNKNOWN_SESSION);
        } catch (RuntimeException e) {
            log.warn("Could not read backend pid: {}", e.getMessage());
            return UNKNOWN_SESSION;
        }
    }

    public synchronized LockStatistics getLockStatistics() {
        Map<LockType, Integer> byType = new EnumMap<>(LockType.class);
        int total = 0;
        for (Map<LockHandle, LockRecord> locks : activeLocks.values()) {
            total += locks.size();
            for (LockRecord record : locks.values()) {
                byType.merge(record.lockType(), 1, Integer::sum);
            }
        }
        return new LockStatistics(activeLocks.size(), total, byType, List.copyOf(activeLocks.keySet()));
    }

    /**
     * Cached locks, oldest first.
     */
    public synchronized List<LockDetail> getLockDetails() {
        Instant now = clock.instant();
        List<LockDetail> details = new ArrayList<>();
        for (Map<LockHandle, LockRecord> locks : activeLocks.values()) {
            for (LockRecord record : locks.values()) {
                details.add(new LockDetail(
                    record.lockKey(), record.identifier(), record.lockType(), record.sessionId(),
                    record.acquiredAt(), Duration.between(record.acquiredAt(), now), record.holdCount()));
            }
        }
        details.sort(Comparator.comparing(LockDetail::acquiredAt));
        return details;
    }

    public synchronized Optional<LockRecord> getLockRecord(String sessionId, String identifier, LockType lockType) {
        Map<LockHandle, LockRecord> locks = activeLocks.get(sessionId);
        if (locks == null) {
            return Optional.empty();
        }
        return locks.values().stream()
            .filter(r -> r.identifier().equals(identifier) && r.lockType() == lockType)
            .findFirst();
    }

    /**
     * Forget all cached records. Database locks are untouched; they end with
     * their sessions.
     */
    public synchronized void cleanup() {
        int sessions = activeLocks.size();
        activeLocks.clear();
        log.info("Cleared lock cache for {} sessions", sessions);
    }

    // ========== Internals ==========

    private LockHandle handle(String identifier, LockType type, LockOptions options) {
        int lockKey = generateLockKey(identifier);
        TwoPartKey twoPartKey = options.twoPart() ? generateTwoPartKey(options.namespace(), identifier) : null;
        return new LockHandle(lockKey, twoPartKey, type);
    }

    private boolean runLockFunction(DatabaseConnection connection, LockHandle handle, boolean tryOnly) {
        String function = handle.type.lockFunction(tryOnly);
        String sql = handle.twoPartKey != null
            ? "SELECT " + function + "(?, ?) AS acquired"
            : "SELECT " + function + "(?) AS acquired";
        QueryResult result = connection.query(sql, lockParams(handle));
        // pg_advisory_lock returns void; only the try variants report false
        return result.firstValue("acquired").map(v -> !Boolean.FALSE.equals(v)).orElse(true);
    }

    private static String unlockSql(LockHandle handle) {
        String function = handle.type.unlockFunction();
        return handle.twoPartKey != null
            ? "SELECT " + function + "(?, ?) AS released"
            : "SELECT " + function + "(?) AS released";
    }

    private static List<Object> lockParams(LockHandle handle) {
        if (handle.twoPartKey != null) {
            return List.of(handle.twoPartKey.key1(), handle.twoPartKey.key2());
        }
        return List.of((long) handle.lockKey);
    }

    // pg_locks encodes a bigint key as (classid = high, objid = low, objsubid = 1)
    // and an (int, int) key as (classid = key1, objid = key2, objsubid = 2)
    private static List<Object> catalogParams(LockHandle handle) {
        if (handle.twoPartKey != null) {
            return List.of((long) handle.twoPartKey.key1(), (long) handle.twoPartKey.key2(), 2);
        }
        return List.of(0L, (long) handle.lockKey, 1);
    }

    private String currentLockTimeout(DatabaseConnection connection) {
        try {
            return connection.query(CURRENT_LOCK_TIMEOUT_SQL)
                .firstValue("lock_timeout")
                .map(String::valueOf)
                .orElse("0");
        } catch (RuntimeException e) {
            throw new LockException("Failed to read lock_timeout: " + e.getMessage(), e);
        }
    }

    private void restoreLockTimeout(DatabaseConnection connection, String previous) {
        try {
            connection.query(SET_LOCK_TIMEOUT_SQL, previous);
        } catch (RuntimeException e) {
            log.warn("Failed to restore lock_timeout to {}: {}", previous, e.getMessage());
        }
    }

    private synchronized void register(String sessionId, LockHandle handle, String identifier) {
        activeLocks.computeIfAbsent(sessionId, k -> new LinkedHashMap<>())
            .merge(handle,
                new LockRecord(handle.lockKey, handle.twoPartKey, identifier, handle.type,
                    sessionId, clock.instant(), 1),
                (existing, fresh) -> existing.reacquired());
    }

    private synchronized Duration unregister(String sessionId, LockHandle handle) {
        Map<LockHandle, LockRecord> locks = activeLocks.get(sessionId);
        LockRecord record = locks != null ? locks.get(handle) : null;
        if (record == null) {
            return Duration.ZERO;
        }
        Duration heldFor = Duration.between(record.acquiredAt(), clock.instant());
        if (record.holdCount() > 1) {
            locks.put(handle, record.released());
        } else {
            locks.remove(handle);
            if (locks.isEmpty()) {
                activeLocks.remove(sessionId);
            }
        }
        return heldFor;
    }

    private synchronized boolean isTracked(String sessionId, LockHandle handle) {
        Map<LockHandle, LockRecord> locks = activeLocks.get(sessionId);
        return locks != null && locks.containsKey(handle);
    }

    private void emit(LockEvent.Type type, LockHandle handle, String identifier, String sessionId, Duration duration) {
        try {
            listener.onLockEvent(new LockEvent(type, handle.lockKey, identifier, sessionId,
                handle.type, duration, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Lock event listener failed on {}: {}", type, e.getMessage());
        }
    }

    private record LockHandle(int lockKey, TwoPartKey twoPartKey, LockType type) {
        LockHandle as(LockType other) {
            return new LockHandle(lockKey, twoPartKey, other);
        }
    }
}
