package com.courier.eventstore;

import com.courier.eventmodel.EventFactory;
import com.courier.eventmodel.EventValidator;
import com.courier.eventmodel.PendingEvent;
import com.courier.eventmodel.StoredEvent;
import com.courier.eventmodel.ValidationResult;
import com.courier.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.Optional;

/**
 * Entry point for commands: validates a command against the aggregate's current state, appends
 * the resulting event and refreshes the projection cache.
 * <p>
 * For one aggregate, the whole sequence (load prior state, run the reducer, append) runs under
 * that aggregate's lock from {@link AggregateLocks}, and the append additionally checks that no
 * other writer moved the log in the meantime. A rejected command appends nothing. The event is
 * committed once {@link EventLog#append} returns; the cache update that follows is best-effort.
 *
 * @param <S> aggregate state type
 */
public final class CommandDispatcher<S> {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    /** MDC key holding the aggregate id while a command runs. */
    public static final String MDC_AGGREGATE_ID = "aggregateId";

    static final String COMMANDS_METRIC = "courier.commands";

    private final EventLog eventLog;
    private final ReducerRegistry<S> registry;
    private final ProjectionService<S> projections;
    private final MetricFactory metrics;
    private final AggregateLocks locks = new AggregateLocks();

    public CommandDispatcher(
            EventLog eventLog,
            ReducerRegistry<S> registry,
            ProjectionService<S> projections,
            MetricFactory metrics) {
        if (eventLog == null || registry == null || projections == null || metrics == null) {
            throw new IllegalArgumentException("eventLog, registry, projections and metrics must not be null");
        }
        this.eventLog = eventLog;
        this.registry = registry;
        this.projections = projections;
        this.metrics = metrics;
    }

    /**
     * Applies a command to an aggregate.
     *
     * @param aggregateId target aggregate
     * @param type        event type to apply
     * @param payload     event payload; {@code null} is treated as empty
     * @return the aggregate's state after the event
     * @throws IllegalArgumentException if the aggregate id or type is missing or malformed
     * @throws AggregateAlreadyExistsException if a creation type targets an existing aggregate
     * @throws AggregateNotFoundException if any other type targets an aggregate with no events
     * @throws UnknownEventTypeException if no reducer is registered for {@code type}
     * @throws DomainRuleViolationException if the reducer rejects the event
     * @throws EventStorageException if the event log fails; the command was not committed
     */
    public S dispatch(String aggregateId, String type, Map<String, Object> payload) {
        PendingEvent event = EventFactory.pending(aggregateId, type, payload);
        ValidationResult validation = EventValidator.validate(event);
        if (!validation.valid()) {
            throw new IllegalArgumentException("Invalid command: " + validation.message());
        }

        String typeTag = registry.get(type).isPresent() ? type : "unknown";
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_AGGREGATE_ID, aggregateId)) {
            S state = locks.withLock(aggregateId, () -> commit(event));
            count(typeTag, "committed");
            return state;
        } catch (EventStorageException e) {
            count(typeTag, "failed");
            log.warn("Command {} for aggregate {} not committed: {}", type, aggregateId, e.getMessage());
            throw e;
        } catch (EventStoreException e) {
            count(typeTag, "rejected");
            log.warn("Command {} for aggregate {} rejected: {}", type, aggregateId, e.getMessage());
            throw e;
        }
    }

    private S commit(PendingEvent event) {
        String aggregateId = event.aggregateId();
        Optional<Projection<S>> prior = projections.load(aggregateId);
        if (registry.createsAggregate(event.type())) {
            if (prior.isPresent()) {
                throw new AggregateAlreadyExistsException(aggregateId);
            }
        } else if (prior.isEmpty()) {
            throw new AggregateNotFoundException(aggregateId);
        }

        Reducer<S> reducer = registry.get(event.type())
                .orElseThrow(() -> new UnknownEventTypeException(event.type()));

        S next = reducer.apply(prior.map(Projection::state).orElse(null), event);
        if (next == null) {
            throw new IllegalStateException("Reducer for '" + event.type() + "' returned null state");
        }

        long expectedLatestId = prior.map(Projection::lastEventId).orElse(0L);
        StoredEvent stored = eventLog.append(event, expectedLatestId);
        log.info("Committed {} as event #{} of aggregate {}", stored.type(), stored.id(), aggregateId);

        refreshCache(stored, prior, next);
        return next;
    }

    /**
     * Caches the reducer result if the new event also sorts last on replay. If its timestamp lands
     * before an existing event (clock skew), the entry is dropped and the next read replays.
     */
    private void refreshCache(StoredEvent stored, Optional<Projection<S>> prior, S next) {
        boolean sortsLast = prior.map(p -> !stored.createdAt().isBefore(p.lastEventAt())).orElse(true);
        if (sortsLast) {
            projections.remember(stored.aggregateId(), new Projection<>(next, stored.id(), stored.createdAt()));
        } else {
            log.debug("Event #{} of aggregate {} sorts before earlier events, evicting projection",
                    stored.id(), stored.aggregateId());
            projections.evict(stored.aggregateId());
        }
    }

    private void count(String type, String outcome) {
        metrics.counter(COMMANDS_METRIC, "Commands handled by the dispatcher", "type", type, "outcome", outcome)
                .increment();
    }
}
