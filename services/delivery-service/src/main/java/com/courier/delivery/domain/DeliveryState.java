package com.courier.delivery.domain;

import java.math.BigDecimal;

/**
 * Current state of a delivery, derived by replaying its events.
 *
 * @param id            delivery id (the aggregate id)
 * @param status        lifecycle status
 * @param budget        money available to buy products
 * @param notes         free-form notes given at creation
 * @param quantity      products currently carried
 * @param purchasePrice unit price paid at the last pickup, null before any pickup
 * @param sellPrice     unit price received at the last delivery, null before any delivery
 */
public record DeliveryState(
        String id,
        DeliveryStatus status,
        BigDecimal budget,
        String notes,
        long quantity,
        BigDecimal purchasePrice,
        BigDecimal sellPrice) {

    public DeliveryState {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (status == null || budget == null || notes == null) {
            throw new IllegalArgumentException("status, budget and notes must not be null");
        }
    }

    static DeliveryState created(String id, BigDecimal budget, String notes) {
        return new DeliveryState(id, DeliveryStatus.READY, budget, notes, 0, null, null);
    }

    DeliveryState withStatus(DeliveryStatus next) {
        return new DeliveryState(id, next, budget, notes, quantity, purchasePrice, sellPrice);
    }

    DeliveryState withBudget(BigDecimal next) {
        return new DeliveryState(id, status, next, notes, quantity, purchasePrice, sellPrice);
    }

    DeliveryState collected(BigDecimal nextBudget, BigDecimal price, long collectedQuantity) {
        return new DeliveryState(
                id, DeliveryStatus.COLLECTED, nextBudget, notes, collectedQuantity, price, sellPrice);
    }

    DeliveryState delivered(BigDecimal nextBudget, BigDecimal price, long remainingQuantity) {
        return new DeliveryState(
                id, DeliveryStatus.DELIVERED, nextBudget, notes, remainingQuantity, purchasePrice, price);
    }
}
