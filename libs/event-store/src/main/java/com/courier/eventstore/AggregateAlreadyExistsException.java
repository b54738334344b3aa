package com.courier.eventstore;

/**
 * Thrown when a creation event targets an aggregate that already has events.
 */
public class AggregateAlreadyExistsException extends EventStoreException {

    private final String aggregateId;

    public AggregateAlreadyExistsException(String aggregateId) {
        super("Aggregate '%s' already exists".formatted(aggregateId));
        this.aggregateId = aggregateId;
    }

    public String aggregateId() {
        return aggregateId;
    }
}
