package com.ultramm.backend.service.execution;

import java.time.Instant;
import java.util.List;

public record ReconcileReport(
        int exchangeOrdersChecked,
        List<String> unknownOrders,
        List<String> missingOrders,
        List<String> fillMismatches,
        Instant at
) {

    public boolean hasMismatch() {
        return !unknownOrders.isEmpty() || !missingOrders.isEmpty() || !fillMismatches.isEmpty();
    }
}
