package com.courier.eventstore;

/**
 * Thrown when no reducer is registered for an event type. Treated as a client or configuration
 * error, never retried.
 */
public class UnknownEventTypeException extends EventStoreException {

    private final String type;

    public UnknownEventTypeException(String type) {
        super("Unknown event type '%s'".formatted(type));
        this.type = type;
    }

    public String type() {
        return type;
    }
}
