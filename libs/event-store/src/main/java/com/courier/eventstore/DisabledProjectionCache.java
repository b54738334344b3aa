package com.courier.eventstore;

import java.util.Optional;

/** No-op {@link ProjectionCache}; every read misses. */
final class DisabledProjectionCache implements ProjectionCache<Object> {

    static final DisabledProjectionCache INSTANCE = new DisabledProjectionCache();

    private DisabledProjectionCache() {
    }

    @Override
    public Optional<Projection<Object>> get(String aggregateId) {
        return Optional.empty();
    }

    @Override
    public void put(String aggregateId, Projection<Object> projection) {
        // nothing to store
    }

    @Override
    public void invalidate(String aggregateId) {
        // nothing to invalidate
    }
}
