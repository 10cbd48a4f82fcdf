package com.schemaops.executor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded history of recent operation outcomes. Oldest entries are dropped
 * once the capacity is reached.
 */
public class OperationHistory {

    public static final int DEFAULT_CAPACITY = 1000;
    public static final Duration RECENT_WINDOW = Duration.ofMinutes(1);

    private final int capacity;
    private final Deque<OperationRecord> records = new ArrayDeque<>();

    public OperationHistory() {
        this(DEFAULT_CAPACITY);
    }

    public OperationHistory(int capacity) {
        this.capacity = capacity;
    }

    public synchronized void record(OperationRecord record) {
        records.addLast(record);
        while (records.size() > capacity) {
            records.removeFirst();
        }
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized List<OperationRecord> snapshot() {
        return List.copyOf(records);
    }

    /**
     * Records from the last minute before {@code now}.
     */
    public synchronized List<OperationRecord> recent(Instant now) {
        Instant cutoff = now.minus(RECENT_WINDOW);
        return records.stream()
            .filter(r -> r.timestamp().isAfter(cutoff))
            .toList();
    }
}
