package com.courier.eventmodel;

import java.util.Map;

/**
 * An event that has been requested by a command but not yet appended to the log.
 *
 * @param aggregateId owning aggregate
 * @param type        event type tag
 * @param payload     event data (copied into an unmodifiable map)
 */
public record PendingEvent(String aggregateId, String type, Map<String, Object> payload)
        implements DomainEvent {

    public PendingEvent {
        payload = payload == null ? null : EventFactory.immutablePayload(payload);
    }
}
