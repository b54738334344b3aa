package com.courier.eventstore;

/**
 * Base class for every failure the event store surfaces to a command's caller.
 * <p>
 * Subclasses map one-to-one onto the outcomes a caller must tell apart: a rejected business rule,
 * a missing or already existing aggregate, an unregistered event type, and an unreachable backing
 * store. They are unchecked and always propagate verbatim.
 */
public abstract class EventStoreException extends RuntimeException {

    protected EventStoreException(String message) {
        super(message);
    }

    protected EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
