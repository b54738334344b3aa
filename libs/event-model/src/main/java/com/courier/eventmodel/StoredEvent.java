package com.courier.eventmodel;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;

/**
 * Immutable record of an event that has been appended to the event log.
 * <p>
 * Once appended an event is never mutated or deleted. The aggregate's state is always derivable by
 * replaying its stored events in {@link #REPLAY_ORDER}.
 *
 * @param id          per-aggregate sequence number, starting at 1, assigned at append time
 * @param aggregateId owning aggregate; events are never shared across aggregates
 * @param type        event type tag selecting the reducer
 * @param payload     event data, interpreted only by the matching reducer
 * @param createdAt   append timestamp; primary replay ordering key
 */
public record StoredEvent(
        long id,
        String aggregateId,
        String type,
        Map<String, Object> payload,
        Instant createdAt
) implements DomainEvent {

    /** Replay order: {@code createdAt} ascending, then {@code id} ascending. */
    public static final Comparator<StoredEvent> REPLAY_ORDER =
            Comparator.comparing(StoredEvent::createdAt).thenComparingLong(StoredEvent::id);

    public StoredEvent {
        if (id < 1) {
            throw new IllegalArgumentException("id must be >= 1");
        }
        if (aggregateId == null || aggregateId.isBlank()) {
            throw new IllegalArgumentException("aggregateId must not be null or blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt must not be null");
        }
        payload = EventFactory.immutablePayload(payload == null ? Map.of() : payload);
    }
}
