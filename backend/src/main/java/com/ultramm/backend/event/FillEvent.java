package com.ultramm.backend.event;

import com.ultramm.backend.model.PositionSnapshot;
import com.ultramm.backend.model.Side;

import java.time.Instant;

/**
 * A fill applied to the position book. {@code realizedPnlDelta} includes the fee.
 */
public record FillEvent(
        String orderId,
        String symbol,
        Side side,
        double quantity,
        double price,
        double fee,
        double realizedPnlDelta,
        PositionSnapshot position,
        Instant at
) {

    /**
     * True when the fill reduced an existing position, so {@code realizedPnlDelta} carries trade profit.
     */
    public boolean isClosing() {
        double before = position.quantity() - side.sign() * quantity;
        return Math.abs(before) > 1e-12 && Math.signum(before) != side.sign();
    }
}
