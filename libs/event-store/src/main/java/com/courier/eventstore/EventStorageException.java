package com.courier.eventstore;

/**
 * Thrown when the backing store is unreachable or fails during an append or read.
 * <p>
 * The command that hit this failure has not been committed, so the caller may safely retry it.
 */
public class EventStorageException extends EventStoreException {

    public EventStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
