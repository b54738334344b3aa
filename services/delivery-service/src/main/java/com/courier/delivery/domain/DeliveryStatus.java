package com.courier.delivery.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle of a delivery. A delivered delivery still accepts budget changes. */
public enum DeliveryStatus {
    READY,
    ACTIVE,
    COLLECTED,
    DELIVERED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
