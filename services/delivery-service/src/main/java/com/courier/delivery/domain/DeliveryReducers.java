package com.courier.delivery.domain;

import static com.courier.delivery.domain.DeliveryEventType.CREATE_DELIVERY;
import static com.courier.delivery.domain.DeliveryEventType.DELIVER_PRODUCTS;
import static com.courier.delivery.domain.DeliveryEventType.INCREASE_BUDGET;
import static com.courier.delivery.domain.DeliveryEventType.PICKUP_ORDER;
import static com.courier.delivery.domain.DeliveryEventType.START_DELIVERY;

import com.courier.eventmodel.DomainEvent;
import com.courier.eventstore.DomainRuleViolationException;
import com.courier.eventstore.ReducerRegistry;
import java.math.BigDecimal;

/**
 * The state transitions of a delivery, one pure function per {@link DeliveryEventType}.
 *
 * <p>Every reducer checks its precondition before computing the next state and throws {@link
 * DomainRuleViolationException} instead of coercing:
 *
 * <ul>
 *   <li>{@code CREATE_DELIVERY}: no prior state; starts {@code ready} with {@code budget} (default
 *       0) and {@code notes} (default empty)
 *   <li>{@code START_DELIVERY}: status must be {@code ready}; becomes {@code active}
 *   <li>{@code PICKUP_ORDER}: pays {@code price * quantity} out of the budget, which may not go
 *       negative; becomes {@code collected}
 *   <li>{@code DELIVER_PRODUCTS}: sells {@code quantity} units at {@code price}, never more than
 *       carried; becomes {@code delivered}
 *   <li>{@code INCREASE_BUDGET}: adds {@code amount} to the budget in any status
 * </ul>
 */
public final class DeliveryReducers {

    private DeliveryReducers() {
        // utility class
    }

    /** A registry holding the five delivery reducers. */
    public static ReducerRegistry<DeliveryState> registry() {
        return new ReducerRegistry<DeliveryState>()
                .registerCreation(CREATE_DELIVERY.name(), DeliveryReducers::createDelivery)
                .register(START_DELIVERY.name(), DeliveryReducers::startDelivery)
                .register(PICKUP_ORDER.name(), DeliveryReducers::pickupOrder)
                .register(DELIVER_PRODUCTS.name(), DeliveryReducers::deliverProducts)
                .register(INCREASE_BUDGET.name(), DeliveryReducers::increaseBudget);
    }

    static DeliveryState createDelivery(DeliveryState state, DomainEvent event) {
        if (state != null) {
            throw new DomainRuleViolationException("Delivery already exists");
        }
        var data = new PayloadReader(event.payload());
        return DeliveryState.created(
                event.aggregateId(),
                data.amountOrDefault("budget", BigDecimal.ZERO),
                data.text("notes", ""));
    }

    static DeliveryState startDelivery(DeliveryState state, DomainEvent event) {
        requireExisting(state);
        if (state.status() != DeliveryStatus.READY) {
            throw new DomainRuleViolationException("Delivery already started");
        }
        return state.withStatus(DeliveryStatus.ACTIVE);
    }

    static DeliveryState pickupOrder(DeliveryState state, DomainEvent event) {
        requireExisting(state);
        var data = new PayloadReader(event.payload());
        BigDecimal price = data.amount("price", "purchase_price");
        long quantity = data.count("quantity");

        BigDecimal budget = state.budget().subtract(price.multiply(BigDecimal.valueOf(quantity)));
        if (budget.signum() < 0) {
            throw new DomainRuleViolationException("Not enough budget");
        }
        return state.collected(budget, price, quantity);
    }

    static DeliveryState deliverProducts(DeliveryState state, DomainEvent event) {
        requireExisting(state);
        var data = new PayloadReader(event.payload());
        BigDecimal price = data.amount("price", "sell_price");
        long sold = data.count("quantity");

        long remaining = state.quantity() - sold;
        if (remaining < 0) {
            throw new DomainRuleViolationException("Not enough quantity");
        }
        BigDecimal budget = state.budget().add(price.multiply(BigDecimal.valueOf(sold)));
        return state.delivered(budget, price, remaining);
    }

    static DeliveryState increaseBudget(DeliveryState state, DomainEvent event) {
        requireExisting(state);
        BigDecimal amount = new PayloadReader(event.payload()).amount("amount", "budget");
        return state.withBudget(state.budget().add(amount));
    }

    // Replay of a log that starts without CREATE_DELIVERY ends up here.
    private static void requireExisting(DeliveryState state) {
        if (state == null) {
            throw new DomainRuleViolationException("Delivery does not exist");
        }
    }
}
