package com.courier.delivery.api;

import com.courier.delivery.application.DeliveryService;
import com.courier.delivery.domain.DeliveryEventType;
import com.courier.delivery.domain.DeliveryState;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST ingress for deliveries. Failures are mapped to problem responses by the global exception
 * handler.
 */
@RestController
@RequestMapping("/api/v1")
public class DeliveryController {

    private final DeliveryService deliveries;

    public DeliveryController(DeliveryService deliveries) {
        this.deliveries = deliveries;
    }

    @PostMapping("/deliveries")
    public ResponseEntity<DeliveryState> create(@Valid @RequestBody CommandRequest request) {
        if (!DeliveryEventType.CREATE_DELIVERY.name().equals(request.type())) {
            throw new IllegalArgumentException(
                    "Only " + DeliveryEventType.CREATE_DELIVERY + " can create a delivery, got " + request.type());
        }
        DeliveryState state = deliveries.create(request.data());
        return ResponseEntity.created(URI.create("/api/v1/deliveries/" + state.id())).body(state);
    }

    @PostMapping("/deliveries/{deliveryId}/events")
    public DeliveryState apply(@PathVariable String deliveryId, @Valid @RequestBody CommandRequest request) {
        return deliveries.apply(deliveryId, request.type(), request.data());
    }

    /** Single-endpoint form: the target delivery travels as {@code data.delivery_id}. */
    @PostMapping("/events")
    public DeliveryState applyAddressedByPayload(@Valid @RequestBody CommandRequest request) {
        return deliveries.applyAddressedByPayload(request.type(), request.data());
    }

    @GetMapping("/deliveries/{deliveryId}/status")
    public DeliveryState status(@PathVariable String deliveryId) {
        return deliveries.status(deliveryId);
    }

    @GetMapping("/deliveries/{deliveryId}/events")
    public List<EventView> history(@PathVariable String deliveryId) {
        return deliveries.history(deliveryId).stream().map(EventView::of).toList();
    }
}
