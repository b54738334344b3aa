package com.courier.delivery.api;

import com.courier.delivery.config.DeliveryServiceProperties;
import com.courier.delivery.config.EventStoreProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Lightweight runtime info next to Actuator's {@code /actuator/info}. */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final DeliveryServiceProperties service;
    private final EventStoreProperties eventStore;

    public ServiceInfoController(DeliveryServiceProperties service, EventStoreProperties eventStore) {
        this.service = service;
        this.eventStore = eventStore;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", service.name(),
                "environment", service.environment(),
                "description", service.description(),
                "eventStore", eventStore.type(),
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
