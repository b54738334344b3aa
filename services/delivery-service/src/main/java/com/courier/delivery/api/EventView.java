package com.courier.delivery.api;

import com.courier.eventmodel.StoredEvent;
import java.time.Instant;
import java.util.Map;

/** One entry of a delivery's event history as returned over HTTP. */
public record EventView(long id, String aggregateId, String type, Map<String, Object> data, Instant createdAt) {

    static EventView of(StoredEvent event) {
        return new EventView(
                event.id(), event.aggregateId(), event.type(), event.payload(), event.createdAt());
    }
}
