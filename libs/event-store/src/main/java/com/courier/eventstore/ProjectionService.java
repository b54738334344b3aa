package com.courier.eventstore;

import com.courier.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Read side of the event store: serves projections from the {@link ProjectionCache} when they are
 * current and falls back to the {@link Aggregator} otherwise.
 * <p>
 * Reads take no lock. A cached projection is trusted only when its {@code lastEventId} equals the
 * newest event id in the log; a miss or a stale entry triggers a replay whose result is written
 * back. Cache writes are best-effort: a failing cache is logged and bypassed.
 *
 * @param <S> aggregate state type
 */
public final class ProjectionService<S> {

    private static final Logger log = LoggerFactory.getLogger(ProjectionService.class);

    static final String READS_METRIC = "courier.projection.reads";
    static final String REPLAY_METRIC = "courier.projection.replay";

    private final EventLog eventLog;
    private final Aggregator<S> aggregator;
    private final ProjectionCache<S> cache;
    private final MetricFactory metrics;

    public ProjectionService(
            EventLog eventLog, Aggregator<S> aggregator, ProjectionCache<S> cache, MetricFactory metrics) {
        if (eventLog == null || aggregator == null || cache == null || metrics == null) {
            throw new IllegalArgumentException("eventLog, aggregator, cache and metrics must not be null");
        }
        this.eventLog = eventLog;
        this.aggregator = aggregator;
        this.cache = cache;
        this.metrics = metrics;
    }

    /**
     * Returns the aggregate's current projection, or empty if it has no events.
     */
    public Optional<Projection<S>> load(String aggregateId) {
        long latestEventId = eventLog.latestEventId(aggregateId);
        if (latestEventId == 0) {
            return Optional.empty();
        }
        Optional<Projection<S>> cached = cachedProjection(aggregateId);
        if (cached.isPresent() && !cached.get().isStaleComparedTo(latestEventId)) {
            metrics.counter(READS_METRIC, "Projection reads", "result", "hit").increment();
            log.debug("Projection cache hit for aggregate {} at event #{}", aggregateId, latestEventId);
            return cached;
        }
        metrics.counter(READS_METRIC, "Projection reads", "result", "miss").increment();
        Projection<S> projection = metrics.timer(REPLAY_METRIC, "Time spent replaying an aggregate's events")
                .record(() -> aggregator.replay(aggregateId));
        remember(aggregateId, projection);
        return Optional.of(projection);
    }

    /**
     * Returns the aggregate's current state.
     *
     * @throws AggregateNotFoundException if the aggregate has no events
     */
    public S currentState(String aggregateId) {
        return load(aggregateId)
                .map(Projection::state)
                .orElseThrow(() -> new AggregateNotFoundException(aggregateId));
    }

    /**
     * Writes a projection to the cache. Failures are logged; the next read re-derives.
     */
    public void remember(String aggregateId, Projection<S> projection) {
        try {
            cache.put(aggregateId, projection);
        } catch (RuntimeException e) {
            log.warn("Could not cache projection of aggregate {} at event #{}",
                    aggregateId, projection.lastEventId(), e);
        }
    }

    /**
     * Drops the aggregate's cache entry. Failures are logged; a stale entry is caught by the
     * {@code lastEventId} check on the next read.
     */
    public void evict(String aggregateId) {
        try {
            cache.invalidate(aggregateId);
        } catch (RuntimeException e) {
            log.warn("Could not invalidate cached projection of aggregate {}", aggregateId, e);
        }
    }

    private Optional<Projection<S>> cachedProjection(String aggregateId) {
        try {
            return cache.get(aggregateId);
        } catch (RuntimeException e) {
            log.warn("Projection cache read failed for aggregate {}, replaying", aggregateId, e);
            return Optional.empty();
        }
    }
}
