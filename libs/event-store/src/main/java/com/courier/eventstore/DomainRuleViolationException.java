package com.courier.eventstore;

/**
 * Thrown by a reducer that rejects an event, e.g. "insufficient budget" or "invalid status
 * transition". The caller may recover by issuing a different command; it is never retried
 * automatically.
 */
public class DomainRuleViolationException extends EventStoreException {

    private final String reason;

    public DomainRuleViolationException(String reason) {
        super(reason);
        this.reason = reason;
    }

    /** Human-readable reason for the rejection. */
    public String reason() {
        return reason;
    }
}
