package com.courier.eventstore;

import com.courier.eventmodel.EventFactory;
import com.courier.eventmodel.PendingEvent;
import com.courier.eventmodel.StoredEvent;

import java.util.List;
import java.util.Map;

/**
 * Append-only, per-aggregate ordered store of immutable events.
 * <p>
 * Implementations must make an append durable before returning it, and must return the same total
 * order ({@link StoredEvent#REPLAY_ORDER}) for the same committed data on every read. Backing store
 * failures surface as {@link EventStorageException}.
 */
public interface EventLog {

    /**
     * Appends an event, assigning the next id for its aggregate and the current timestamp.
     *
     * @return the stored event
     * @throws EventStorageException if the backing store fails
     */
    StoredEvent append(PendingEvent event);

    /**
     * Appends an event only if the aggregate's newest event id is still {@code expectedLatestId}
     * (0 for an aggregate with no events).
     *
     * @return the stored event, with id {@code expectedLatestId + 1}
     * @throws ConcurrentAppendException if another event was appended in the meantime
     * @throws EventStorageException if the backing store fails
     */
    StoredEvent append(PendingEvent event, long expectedLatestId);

    /**
     * Convenience overload of {@link #append(PendingEvent)}.
     */
    default StoredEvent append(String aggregateId, String type, Map<String, Object> payload) {
        return append(EventFactory.pending(aggregateId, type, payload));
    }

    /**
     * Returns every event of the aggregate in replay order, or an empty list if it has none.
     *
     * @throws EventStorageException if the backing store fails
     */
    List<StoredEvent> listByAggregate(String aggregateId);

    /**
     * Returns the highest event id committed for the aggregate, or 0 if it has no events.
     *
     * @throws EventStorageException if the backing store fails
     */
    long latestEventId(String aggregateId);
}
