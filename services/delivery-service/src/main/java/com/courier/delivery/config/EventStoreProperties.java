package com.courier.delivery.config;

import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Event store settings, bound from {@code courier.event-store.*}.
 *
 * @param type backing store: {@code jdbc} (default) or {@code memory}
 * @param projectionCacheEnabled whether derived states are cached between reads, defaults to true
 */
@ConfigurationProperties(prefix = "courier.event-store")
@Validated
public record EventStoreProperties(
        @Pattern(regexp = "jdbc|memory", message = "must be 'jdbc' or 'memory'") String type,
        Boolean projectionCacheEnabled) {

    public static final String TYPE_JDBC = "jdbc";
    public static final String TYPE_MEMORY = "memory";

    public EventStoreProperties {
        if (type == null || type.isBlank()) {
            type = TYPE_JDBC;
        }
        if (projectionCacheEnabled == null) {
            projectionCacheEnabled = Boolean.TRUE;
        }
    }
}
