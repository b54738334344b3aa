package com.courier.eventmodel;

import java.util.ArrayList;

/**
 * Validates {@link PendingEvent} instances for required fields and format before they reach a
 * reducer. All errors are collected and returned at once.
 */
public final class EventValidator {

    /** Upper bound for aggregate identifiers, matching the {@code aggregate_id} column width. */
    public static final int MAX_AGGREGATE_ID_LENGTH = 64;

    private EventValidator() {
        // utility class
    }

    /**
     * Validates that the aggregate id, type and payload of the event are present and well-formed.
     *
     * @param event the pending event to validate
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(PendingEvent event) {
        var errors = new ArrayList<String>();

        if (isBlank(event.aggregateId())) {
            errors.add("aggregateId must not be null or blank");
        } else if (event.aggregateId().length() > MAX_AGGREGATE_ID_LENGTH) {
            errors.add("aggregateId must be at most " + MAX_AGGREGATE_ID_LENGTH + " characters");
        }
        if (isBlank(event.type())) {
            errors.add("type must not be null or blank");
        }
        if (event.payload() == null) {
            errors.add("payload must not be null");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
