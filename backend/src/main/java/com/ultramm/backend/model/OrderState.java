package com.ultramm.backend.model;

/**
 * Order lifecycle state machine.
 * Terminal states never transition again.
 */
public enum OrderState {
    NEW,               // Created locally, not yet acknowledged by the exchange
    SUBMITTED,         // Exchange acknowledged the order
    PARTIALLY_FILLED,  // At least one fill, remainder still working
    FILLED,            // Fully filled
    CANCELED,          // Canceled on request
    REJECTED,          // Refused by the exchange or retries exhausted
    EXPIRED;           // Canceled after exceeding the maximum order age

    public boolean isTerminal() {
        return this == FILLED || this == CANCELED || this == REJECTED || this == EXPIRED;
    }

    public boolean canTransitionTo(OrderState target) {
        if (target == null) return false;

        return switch (this) {
            case NEW -> target == SUBMITTED || target == REJECTED || target == CANCELED;
            case SUBMITTED -> target == PARTIALLY_FILLED || target == FILLED || target == CANCELED
                    || target == REJECTED || target == EXPIRED;
            case PARTIALLY_FILLED -> target == PARTIALLY_FILLED || target == FILLED || target == CANCELED
                    || target == EXPIRED;
            default -> false;
        };
    }
}
