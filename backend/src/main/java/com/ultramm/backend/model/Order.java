package com.ultramm.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Locally tracked order. Every state change goes through {@link #transitionTo} so the
 * transition history stays complete. Callers synchronize on the instance when mutating it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    private static final double EPSILON = 1e-12;

    private String id;
    private String parentId;
    private String replacesOrderId;
    private String exchangeId;
    private String exchangeOrderId;
    private String symbol;
    private Side side;
    private OrderType type;
    private double price;
    private double size;
    private double filledSize;
    private double averageFillPrice;
    private boolean quote;
    private boolean iceberg;
    private boolean expiring;
    private int retryCount;

    @Builder.Default
    private OrderState state = OrderState.NEW;

    private Instant createdAt;
    private Instant submittedAt;
    private Instant updatedAt;

    @Builder.Default
    private List<OrderTransition> history = new ArrayList<>();

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public double remainingSize() {
        return Math.max(0.0, size - filledSize);
    }

    public boolean isFullyFilled() {
        return remainingSize() <= EPSILON;
    }

    public boolean canTransitionTo(OrderState target) {
        return state.canTransitionTo(target);
    }

    /**
     * Moves the order to {@code target} and records the transition.
     *
     * @throws IllegalStateException when the state machine forbids the transition
     */
    public OrderTransition transitionTo(OrderState target, String reason, Instant at) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Invalid order transition " + state + " -> " + target + " for " + id);
        }
        OrderTransition transition = new OrderTransition(state, target, at, reason);
        history.add(transition);
        state = target;
        updatedAt = at;
        if (target == OrderState.SUBMITTED && submittedAt == null) {
            submittedAt = at;
        }
        return transition;
    }

    /**
     * Records a fill and returns the quantity actually applied, capped at the remaining size.
     */
    public double applyFill(double quantity, double price) {
        double applied = Math.min(quantity, remainingSize());
        if (applied <= 0) {
            return 0.0;
        }
        double notional = averageFillPrice * filledSize + price * applied;
        filledSize += applied;
        averageFillPrice = notional / filledSize;
        return applied;
    }

    public void incrementRetryCount() {
        retryCount++;
    }
}
