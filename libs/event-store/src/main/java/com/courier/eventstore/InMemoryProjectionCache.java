package com.courier.eventstore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link ProjectionCache} backed by a {@link ConcurrentHashMap}. Entries are updated per key, so
 * aggregates never contend with each other, and an entry is never replaced by an older one.
 *
 * @param <S> aggregate state type
 */
public final class InMemoryProjectionCache<S> implements ProjectionCache<S> {

    private final ConcurrentMap<String, Projection<S>> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<Projection<S>> get(String aggregateId) {
        return Optional.ofNullable(entries.get(aggregateId));
    }

    @Override
    public void put(String aggregateId, Projection<S> projection) {
        entries.merge(aggregateId, projection,
                (current, candidate) -> candidate.lastEventId() >= current.lastEventId() ? candidate : current);
    }

    @Override
    public void invalidate(String aggregateId) {
        entries.remove(aggregateId);
    }

    /** Number of cached aggregates. */
    public int size() {
        return entries.size();
    }
}
