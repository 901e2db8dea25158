package com.fedquery.repository;

import com.fedquery.query.Field;
import com.fedquery.query.Row;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存快照存储，每个集合保留最近 maxHistory 个快照
 */
public class InMemorySnapshotStore implements SnapshotStore {
    private final Map<String, Map<String, Deque<CollectionSnapshot>>> snapshots = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final int maxHistory;
    private final Clock clock;

    public InMemorySnapshotStore() {
        this(5, Clock.systemUTC());
    }

    public InMemorySnapshotStore(int maxHistory, Clock clock) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be at least 1");
        }
        this.maxHistory = maxHistory;
        this.clock = clock;
    }

    @Override
    public CollectionSnapshot getLatest(String sourceId, String collection) {
        lock.readLock().lock();
        try {
            Deque<CollectionSnapshot> history = historyOf(sourceId, collection);
            return history != null ? history.peekLast() : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CollectionSnapshot put(String sourceId, String collection, List<Row> rows, List<Field> schema) {
        lock.writeLock().lock();
        try {
            Deque<CollectionSnapshot> history = snapshots
                .computeIfAbsent(sourceId, k -> new HashMap<>())
                .computeIfAbsent(collection, k -> new ArrayDeque<>());
            Instant previous = history.isEmpty() ? null : history.peekLast().getFetchedAt();
            CollectionSnapshot snapshot = new CollectionSnapshot(sourceId, collection, schema, rows,
                nextFetchedAt(clock, previous));
            history.addLast(snapshot);
            while (history.size() > maxHistory) {
                history.removeFirst();
            }
            return snapshot;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<CollectionSnapshot> history(String sourceId, String collection) {
        lock.readLock().lock();
        try {
            Deque<CollectionSnapshot> history = historyOf(sourceId, collection);
            return history != null ? new ArrayList<>(history) : List.of();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void evict(String sourceId) {
        lock.writeLock().lock();
        try {
            snapshots.remove(sourceId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Deque<CollectionSnapshot> historyOf(String sourceId, String collection) {
        Map<String, Deque<CollectionSnapshot>> bySource = snapshots.get(sourceId);
        return bySource != null ? bySource.get(collection) : null;
    }

    /**
     * 当前时间；时钟未前进时在上一个快照基础上加 1 纳秒
     */
    static Instant nextFetchedAt(Clock clock, Instant previous) {
        Instant now = clock.instant();
        if (previous != null && !now.isAfter(previous)) {
            return previous.plusNanos(1);
        }
        return now;
    }
}
