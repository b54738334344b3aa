package com.courier.delivery.domain;

/**
 * Event types a delivery accepts. The enum name is the wire value and the event log's type tag.
 */
public enum DeliveryEventType {
    CREATE_DELIVERY,
    START_DELIVERY,
    PICKUP_ORDER,
    DELIVER_PRODUCTS,
    INCREASE_BUDGET
}
