package com.courier.delivery.application;

import com.courier.delivery.domain.DeliveryEventType;
import com.courier.delivery.domain.DeliveryState;
import com.courier.eventmodel.StoredEvent;
import com.courier.eventstore.AggregateNotFoundException;
import com.courier.eventstore.CommandDispatcher;
import com.courier.eventstore.EventLog;
import com.courier.eventstore.ProjectionService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Use cases behind the delivery endpoints. Commands go through the {@link CommandDispatcher},
 * status reads through the {@link ProjectionService}.
 */
@Service
public class DeliveryService {

    /** Payload key naming the target delivery in the single-endpoint command shape. */
    public static final String DELIVERY_ID_KEY = "delivery_id";

    private final CommandDispatcher<DeliveryState> dispatcher;
    private final ProjectionService<DeliveryState> projections;
    private final EventLog eventLog;

    public DeliveryService(
            CommandDispatcher<DeliveryState> dispatcher,
            ProjectionService<DeliveryState> projections,
            EventLog eventLog) {
        this.dispatcher = dispatcher;
        this.projections = projections;
        this.eventLog = eventLog;
    }

    /** Creates a delivery under a freshly generated id. */
    public DeliveryState create(Map<String, Object> data) {
        String id = UUID.randomUUID().toString();
        return dispatcher.dispatch(id, DeliveryEventType.CREATE_DELIVERY.name(), data);
    }

    public DeliveryState apply(String deliveryId, String type, Map<String, Object> data) {
        return dispatcher.dispatch(deliveryId, type, data);
    }

    /**
     * Applies a command whose target is named by {@value #DELIVERY_ID_KEY} inside the data. The key
     * is not stored with the event.
     */
    public DeliveryState applyAddressedByPayload(String type, Map<String, Object> data) {
        Object deliveryId = data == null ? null : data.get(DELIVERY_ID_KEY);
        if (deliveryId == null || deliveryId.toString().isBlank()) {
            throw new IllegalArgumentException("data." + DELIVERY_ID_KEY + " is required");
        }
        Map<String, Object> payload = new LinkedHashMap<>(data);
        payload.remove(DELIVERY_ID_KEY);
        return dispatcher.dispatch(deliveryId.toString(), type, payload);
    }

    public DeliveryState status(String deliveryId) {
        return projections.currentState(deliveryId);
    }

    /**
     * Returns the delivery's events in replay order.
     *
     * @throws AggregateNotFoundException if the delivery has no events
     */
    public List<StoredEvent> history(String deliveryId) {
        List<StoredEvent> events = eventLog.listByAggregate(deliveryId);
        if (events.isEmpty()) {
            throw new AggregateNotFoundException(deliveryId);
        }
        return events;
    }
}
