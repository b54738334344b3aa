package com.courier.delivery.domain;

import com.courier.eventstore.DomainRuleViolationException;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Reads typed fields out of an event payload. Numbers may arrive as JSON numbers or numeric
 * strings; anything else is a rule violation naming the field.
 */
final class PayloadReader {

    private final Map<String, Object> payload;

    PayloadReader(Map<String, Object> payload) {
        this.payload = payload == null ? Map.of() : payload;
    }

    /** Required non-negative amount under {@code key}, or under the first present alias. */
    BigDecimal amount(String key, String... aliases) {
        String field = presentKey(key, aliases);
        if (field == null) {
            throw new DomainRuleViolationException("Missing field '" + key + "'");
        }
        return nonNegative(field, decimal(field));
    }

    /** Optional non-negative amount, {@code fallback} when absent. */
    BigDecimal amountOrDefault(String key, BigDecimal fallback) {
        return payload.get(key) == null ? fallback : nonNegative(key, decimal(key));
    }

    /** Required non-negative whole number. */
    long count(String key) {
        if (payload.get(key) == null) {
            throw new DomainRuleViolationException("Missing field '" + key + "'");
        }
        BigDecimal value = nonNegative(key, decimal(key));
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new DomainRuleViolationException("Field '" + key + "' must be a whole number");
        }
    }

    String text(String key, String fallback) {
        Object value = payload.get(key);
        return value == null ? fallback : value.toString();
    }

    private String presentKey(String key, String... aliases) {
        if (payload.get(key) != null) {
            return key;
        }
        for (String alias : aliases) {
            if (payload.get(alias) != null) {
                return alias;
            }
        }
        return null;
    }

    private BigDecimal decimal(String key) {
        Object value = payload.get(key);
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number || value instanceof String) {
            try {
                return new BigDecimal(value.toString().trim());
            } catch (NumberFormatException e) {
                throw notANumber(key);
            }
        }
        throw notANumber(key);
    }

    private static DomainRuleViolationException notANumber(String key) {
        return new DomainRuleViolationException("Field '" + key + "' must be a number");
    }

    private static BigDecimal nonNegative(String key, BigDecimal value) {
        if (value.signum() < 0) {
            throw new DomainRuleViolationException("Field '" + key + "' must not be negative");
        }
        return value;
    }
}
