package com.courier.eventstore;

import com.courier.eventmodel.DomainEvent;

/**
 * Pure state-transition function for one event type.
 * <p>
 * Given the prior state ({@code null} for an aggregate with no events) and an event, returns the
 * next state or throws {@link DomainRuleViolationException}. Implementations perform no I/O, never
 * mutate {@code state}, and must check their precondition before computing anything.
 *
 * @param <S> aggregate state type
 */
@FunctionalInterface
public interface Reducer<S> {

    S apply(S state, DomainEvent event);
}
