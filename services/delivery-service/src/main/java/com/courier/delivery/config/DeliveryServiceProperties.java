package com.courier.delivery.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code courier.service.*}:
 *
 * <pre>
 * courier:
 *   service:
 *     name: delivery-service
 *     environment: production
 *     description: Event-sourced delivery tracking
 * </pre>
 *
 * @param name service name used in logs and as the {@code service} metric tag. Required.
 * @param environment deployment environment, defaults to {@code development}
 * @param description human-readable description shown by {@code /api/v1/info}
 */
@ConfigurationProperties(prefix = "courier.service")
@Validated
public record DeliveryServiceProperties(@NotBlank String name, String environment, String description) {

    public DeliveryServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
    }
}
