package com.ultramm.backend.trading.pipeline;

import com.ultramm.backend.model.CombinedSignal;
import com.ultramm.backend.model.RiskDecision;
import com.ultramm.backend.service.execution.OrderHandle;

/**
 * Outcome of one evaluation of one symbol.
 */
public record PipelineResult(
        String symbol,
        Status status,
        int signalCount,
        CombinedSignal combined,
        RiskDecision decision,
        OrderHandle orders
) {
    public enum Status {
        SUBMITTED,
        NO_ACTION,
        REJECTED,
        STALE_DATA,
        DISABLED,
        FAILED
    }

    public static PipelineResult skipped(String symbol, Status status) {
        return new PipelineResult(symbol, status, 0, null, null, OrderHandle.empty(symbol));
    }
}
