package com.courier.eventstore;

import com.courier.eventmodel.PendingEvent;
import com.courier.eventmodel.StoredEvent;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/** Wraps an {@link EventLog}, counting appends and failing on demand like an unreachable store. */
final class ControllableEventLog implements EventLog {

    private final EventLog delegate;
    private final AtomicBoolean failAppends = new AtomicBoolean();
    private final AtomicBoolean failReads = new AtomicBoolean();
    private final AtomicInteger appendCalls = new AtomicInteger();

    ControllableEventLog(EventLog delegate) {
        this.delegate = delegate;
    }

    void failAppends(boolean fail) {
        failAppends.set(fail);
    }

    void failReads(boolean fail) {
        failReads.set(fail);
    }

    int appendCalls() {
        return appendCalls.get();
    }

    @Override
    public StoredEvent append(PendingEvent event) {
        appendCalls.incrementAndGet();
        checkAppend();
        return delegate.append(event);
    }

    @Override
    public StoredEvent append(PendingEvent event, long expectedLatestId) {
        appendCalls.incrementAndGet();
        checkAppend();
        return delegate.append(event, expectedLatestId);
    }

    @Override
    public List<StoredEvent> listByAggregate(String aggregateId) {
        checkRead();
        return delegate.listByAggregate(aggregateId);
    }

    @Override
    public long latestEventId(String aggregateId) {
        checkRead();
        return delegate.latestEventId(aggregateId);
    }

    private void checkAppend() {
        if (failAppends.get()) {
            throw new EventStorageException("store unreachable", new IllegalStateException("connection refused"));
        }
    }

    private void checkRead() {
        if (failReads.get()) {
            throw new EventStorageException("store unreachable", new IllegalStateException("connection refused"));
        }
    }
}
