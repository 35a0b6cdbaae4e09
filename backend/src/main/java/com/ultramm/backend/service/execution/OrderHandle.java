package com.ultramm.backend.service.execution;

import java.util.List;

/**
 * Orders created for one risk decision, plus the live quotes kept instead of being replaced.
 */
public record OrderHandle(
        String symbol,
        List<String> orderIds,
        List<String> keptOrderIds
) {

    public OrderHandle {
        orderIds = List.copyOf(orderIds);
        keptOrderIds = List.copyOf(keptOrderIds);
    }

    public static OrderHandle empty(String symbol) {
        return new OrderHandle(symbol, List.of(), List.of());
    }

    public boolean isEmpty() {
        return orderIds.isEmpty() && keptOrderIds.isEmpty();
    }
}
