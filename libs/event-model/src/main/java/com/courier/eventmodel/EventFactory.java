package com.courier.eventmodel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory methods for creating {@link PendingEvent} and {@link StoredEvent} instances.
 * <p>
 * Event logs use {@link #stored(PendingEvent, long, Instant)} when they commit a pending event, so
 * id and timestamp assignment stays in one place per store.
 */
public final class EventFactory {

    private EventFactory() {
        // utility class
    }

    /**
     * Creates a pending event for the given aggregate. A null payload becomes an empty map.
     */
    public static PendingEvent pending(String aggregateId, String type, Map<String, Object> payload) {
        return new PendingEvent(aggregateId, type, payload == null ? Map.of() : payload);
    }

    /**
     * Turns a pending event into its stored form with the id and timestamp assigned by the log.
     */
    public static StoredEvent stored(PendingEvent pending, long id, Instant createdAt) {
        return new StoredEvent(id, pending.aggregateId(), pending.type(), pending.payload(), createdAt);
    }

    /**
     * Copies a payload into an unmodifiable, insertion-ordered map. Null values are kept (unlike
     * {@link Map#copyOf(Map)}), since JSON payloads may legitimately carry them.
     */
    static Map<String, Object> immutablePayload(Map<String, Object> payload) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
