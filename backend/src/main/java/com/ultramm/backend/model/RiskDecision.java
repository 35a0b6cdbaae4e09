package com.ultramm.backend.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of the risk gate for one combined signal. Approved decisions carry the order legs
 * to submit, already resized to the limits in force.
 */
public record RiskDecision(
        String symbol,
        RiskOutcome outcome,
        RiskReasonCode reason,
        List<OrderLeg> legs,
        CombinedSignal signal,
        String detail,
        Instant decidedAt
) {

    public RiskDecision {
        legs = legs == null ? List.of() : List.copyOf(legs);
    }

    public static RiskDecision reject(String symbol, RiskReasonCode reason, CombinedSignal signal, String detail,
                                      Instant decidedAt) {
        return new RiskDecision(symbol, RiskOutcome.REJECTED, reason, List.of(), signal, detail, decidedAt);
    }

    public boolean isApproved() {
        return outcome != RiskOutcome.REJECTED && !legs.isEmpty();
    }

    public boolean isQuote() {
        return outcome != RiskOutcome.FORCED_EXIT && signal != null && signal.side() == SignalSide.QUOTE;
    }
}
