package com.courier.eventstore;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive lock per aggregate id.
 * <p>
 * Locks are reference-counted and dropped when their last holder or waiter leaves, so the map only
 * holds aggregates with a command in flight. Different aggregates never share a lock.
 */
public final class AggregateLocks {

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }

    private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();

    /**
     * Runs the action while holding the aggregate's lock.
     */
    public <T> T withLock(String aggregateId, Supplier<T> action) {
        Entry entry = locks.compute(aggregateId, (id, current) -> {
            Entry acquired = current == null ? new Entry() : current;
            acquired.holders++;
            return acquired;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(aggregateId, (id, current) -> --current.holders == 0 ? null : current);
        }
    }

    /** Number of aggregates with a command in flight. */
    public int activeCount() {
        return locks.size();
    }
}
