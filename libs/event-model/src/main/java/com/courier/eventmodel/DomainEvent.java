package com.courier.eventmodel;

import java.util.Map;

/**
 * Common view of an event as seen by a reducer.
 * <p>
 * During command dispatch a reducer receives a {@link PendingEvent} (not yet appended, no id or
 * timestamp). During replay it receives the {@link StoredEvent} read back from the log. Reducers
 * only ever need the owning aggregate, the type tag and the payload, so both share this view.
 */
public interface DomainEvent {

    /** Identifier of the aggregate that owns this event. */
    String aggregateId();

    /** Type tag selecting the reducer (e.g. "PICKUP_ORDER"). */
    String type();

    /** Opaque key/value payload, interpreted only by the matching reducer. */
    Map<String, Object> payload();
}
