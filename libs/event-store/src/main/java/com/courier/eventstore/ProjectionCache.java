package com.courier.eventstore;

import java.util.Optional;

/**
 * Memoizes the last derived {@link Projection} per aggregate.
 * <p>
 * The cache is an optimization only. Callers must compare a cached projection's
 * {@code lastEventId} with the log before trusting it, and every path stays correct with
 * {@link #disabled()} in place of a real cache.
 *
 * @param <S> aggregate state type
 */
public interface ProjectionCache<S> {

    Optional<Projection<S>> get(String aggregateId);

    /**
     * Stores the projection. Implementations keep the entry with the higher {@code lastEventId}
     * if one is already present.
     */
    void put(String aggregateId, Projection<S> projection);

    void invalidate(String aggregateId);

    /**
     * Returns a cache that stores nothing.
     */
    @SuppressWarnings("unchecked")
    static <S> ProjectionCache<S> disabled() {
        return (ProjectionCache<S>) DisabledProjectionCache.INSTANCE;
    }
}
