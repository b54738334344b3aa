package com.courier.eventstore;

/**
 * Thrown when a command or query targets an aggregate that has no events.
 */
public class AggregateNotFoundException extends EventStoreException {

    private final String aggregateId;

    public AggregateNotFoundException(String aggregateId) {
        super("Aggregate '%s' not found".formatted(aggregateId));
        this.aggregateId = aggregateId;
    }

    public String aggregateId() {
        return aggregateId;
    }
}
