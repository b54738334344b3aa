package com.courier.eventstore;

import com.courier.eventmodel.EventFactory;
import com.courier.eventmodel.PendingEvent;
import com.courier.eventmodel.StoredEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link EventLog} kept in process memory, one stream per aggregate.
 * <p>
 * Appends to the same aggregate are serialized on the stream; different aggregates never contend.
 * Events are kept in append order and sorted into replay order on read.
 */
public final class InMemoryEventLog implements EventLog {

    private final ConcurrentMap<String, List<StoredEvent>> streams = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryEventLog() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of {@code createdAt} timestamps
     */
    public InMemoryEventLog(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    @Override
    public StoredEvent append(PendingEvent event) {
        List<StoredEvent> stream = streams.computeIfAbsent(event.aggregateId(), id -> new ArrayList<>());
        synchronized (stream) {
            return appendLocked(stream, event);
        }
    }

    @Override
    public StoredEvent append(PendingEvent event, long expectedLatestId) {
        List<StoredEvent> stream = streams.computeIfAbsent(event.aggregateId(), id -> new ArrayList<>());
        synchronized (stream) {
            if (stream.size() != expectedLatestId) {
                throw new ConcurrentAppendException(event.aggregateId(), expectedLatestId, null);
            }
            return appendLocked(stream, event);
        }
    }

    private StoredEvent appendLocked(List<StoredEvent> stream, PendingEvent event) {
        StoredEvent stored = EventFactory.stored(event, stream.size() + 1L, clock.instant());
        stream.add(stored);
        return stored;
    }

    @Override
    public List<StoredEvent> listByAggregate(String aggregateId) {
        List<StoredEvent> stream = streams.get(aggregateId);
        if (stream == null) {
            return List.of();
        }
        List<StoredEvent> copy;
        synchronized (stream) {
            copy = new ArrayList<>(stream);
        }
        copy.sort(StoredEvent.REPLAY_ORDER);
        return List.copyOf(copy);
    }

    @Override
    public long latestEventId(String aggregateId) {
        List<StoredEvent> stream = streams.get(aggregateId);
        if (stream == null) {
            return 0;
        }
        synchronized (stream) {
            return stream.size();
        }
    }
}
