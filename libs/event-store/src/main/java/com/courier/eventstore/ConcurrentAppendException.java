package com.courier.eventstore;

/**
 * Thrown when an append loses a race: another writer already committed the event id this append
 * expected to assign. Nothing was written; re-running the command re-reads the log and retries.
 */
public class ConcurrentAppendException extends EventStorageException {

    private final String aggregateId;
    private final long expectedLatestId;

    public ConcurrentAppendException(String aggregateId, long expectedLatestId, Throwable cause) {
        super("Concurrent append to aggregate '%s': expected latest event id %d"
                .formatted(aggregateId, expectedLatestId), cause);
        this.aggregateId = aggregateId;
        this.expectedLatestId = expectedLatestId;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public long expectedLatestId() {
        return expectedLatestId;
    }
}
