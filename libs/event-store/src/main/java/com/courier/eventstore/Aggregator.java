package com.courier.eventstore;

import com.courier.eventmodel.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Replay engine: derives an aggregate's current state by folding its events, in replay order,
 * through the {@link ReducerRegistry}.
 * <p>
 * Replay is deterministic and side-effect free. If any reducer fails the failure propagates and
 * no partial state is returned.
 *
 * @param <S> aggregate state type
 */
public final class Aggregator<S> {

    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    private final EventLog eventLog;
    private final ReducerRegistry<S> registry;

    public Aggregator(EventLog eventLog, ReducerRegistry<S> registry) {
        if (eventLog == null) {
            throw new IllegalArgumentException("eventLog must not be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.eventLog = eventLog;
        this.registry = registry;
    }

    /**
     * Replays every event of the aggregate.
     *
     * @return the derived projection
     * @throws AggregateNotFoundException if the aggregate has no events
     * @throws UnknownEventTypeException if a stored event has no registered reducer
     * @throws DomainRuleViolationException if a reducer rejects a stored event
     * @throws EventStorageException if the event log cannot be read
     */
    public Projection<S> replay(String aggregateId) {
        List<StoredEvent> events = eventLog.listByAggregate(aggregateId);
        if (events.isEmpty()) {
            throw new AggregateNotFoundException(aggregateId);
        }
        return fold(events);
    }

    /**
     * Replays every event of the aggregate and returns only the state.
     *
     * @see #replay(String)
     */
    public S deriveState(String aggregateId) {
        return replay(aggregateId).state();
    }

    private Projection<S> fold(List<StoredEvent> events) {
        S state = null;
        long lastEventId = 0;
        for (StoredEvent event : events) {
            Reducer<S> reducer = registry.get(event.type())
                    .orElseThrow(() -> new UnknownEventTypeException(event.type()));
            try {
                state = reducer.apply(state, event);
            } catch (DomainRuleViolationException e) {
                log.error("Replay of aggregate {} rejected stored event #{} ({}): {}",
                        event.aggregateId(), event.id(), event.type(), e.reason());
                throw e;
            }
            if (state == null) {
                throw new IllegalStateException("Reducer for '" + event.type() + "' returned null state");
            }
            lastEventId = Math.max(lastEventId, event.id());
        }
        StoredEvent last = events.get(events.size() - 1);
        log.debug("Replayed {} events for aggregate {}", events.size(), last.aggregateId());
        return new Projection<>(state, lastEventId, last.createdAt());
    }
}
