package com.courier.eventstore;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps event type names to their {@link Reducer}, exactly one reducer per type.
 * <p>
 * Types registered with {@link #registerCreation(String, Reducer)} start a new aggregate: the
 * dispatcher only accepts them for aggregates with no events, and rejects every other type for
 * such aggregates. Registering a type twice is a configuration error.
 *
 * @param <S> aggregate state type
 */
public final class ReducerRegistry<S> {

    private record Registration<S>(Reducer<S> reducer, boolean createsAggregate) {}

    private final Map<String, Registration<S>> registrations = new ConcurrentHashMap<>();

    /**
     * Registers the reducer for an event type that applies to an existing aggregate.
     *
     * @throws IllegalStateException if the type already has a reducer
     */
    public ReducerRegistry<S> register(String type, Reducer<S> reducer) {
        return register(type, reducer, false);
    }

    /**
     * Registers the reducer for an event type that creates its aggregate.
     *
     * @throws IllegalStateException if the type already has a reducer
     */
    public ReducerRegistry<S> registerCreation(String type, Reducer<S> reducer) {
        return register(type, reducer, true);
    }

    private ReducerRegistry<S> register(String type, Reducer<S> reducer, boolean createsAggregate) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (reducer == null) {
            throw new IllegalArgumentException("reducer must not be null");
        }
        Registration<S> existing =
                registrations.putIfAbsent(type, new Registration<>(reducer, createsAggregate));
        if (existing != null) {
            throw new IllegalStateException("A reducer is already registered for event type '" + type + "'");
        }
        return this;
    }

    /**
     * Returns the reducer for the type, or empty if none is registered.
     */
    public Optional<Reducer<S>> get(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registrations.get(type)).map(Registration::reducer);
    }

    /**
     * Returns true if the type is registered as a creation type.
     */
    public boolean createsAggregate(String type) {
        Registration<S> registration = type == null ? null : registrations.get(type);
        return registration != null && registration.createsAggregate();
    }

    /** Returns the registered event type names. */
    public Set<String> types() {
        return Set.copyOf(registrations.keySet());
    }
}
