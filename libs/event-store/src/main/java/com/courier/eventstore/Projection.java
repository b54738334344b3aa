package com.courier.eventstore;

import java.time.Instant;

/**
 * State derived from an aggregate's events, together with the position it was derived at.
 * <p>
 * A projection is only ever built from a complete replay, or from a reducer result committed on
 * top of one, so {@code state} always equals replaying every event up to {@code lastEventId}.
 *
 * @param state       the derived state
 * @param lastEventId highest event id included
 * @param lastEventAt {@code createdAt} of the event that sorts last in replay order
 * @param <S>         aggregate state type
 */
public record Projection<S>(S state, long lastEventId, Instant lastEventAt) {

    public Projection {
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        if (lastEventId < 1) {
            throw new IllegalArgumentException("lastEventId must be >= 1");
        }
        if (lastEventAt == null) {
            throw new IllegalArgumentException("lastEventAt must not be null");
        }
    }

    /**
     * Returns true if this projection is older than the given newest event id of the log.
     */
    public boolean isStaleComparedTo(long latestEventId) {
        return lastEventId != latestEventId;
    }
}
