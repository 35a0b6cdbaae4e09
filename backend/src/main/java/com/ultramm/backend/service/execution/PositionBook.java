package com.ultramm.backend.service.execution;

import com.ultramm.backend.model.PositionSnapshot;
import com.ultramm.backend.model.Side;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Net position per symbol. Fills are applied atomically per symbol; only the execution
 * coordinator applies fills, everything else reads snapshots.
 */
@Component
public class PositionBook {

    public record PositionChange(PositionSnapshot previous, PositionSnapshot current) {

        public double realizedPnlDelta() {
            return current.realizedPnl() - previous.realizedPnl();
        }
    }

    private final ConcurrentHashMap<String, PositionSnapshot> positions = new ConcurrentHashMap<>();

    public PositionSnapshot snapshot(String symbol) {
        PositionSnapshot position = positions.get(symbol);
        return position != null ? position : PositionSnapshot.flat(symbol);
    }

    public List<PositionSnapshot> all() {
        return List.copyOf(positions.values());
    }

    public PositionChange applyFill(String symbol, Side side, double quantity, double price, double fee) {
        PositionSnapshot[] previous = new PositionSnapshot[1];
        PositionSnapshot current = positions.compute(symbol, (key, existing) -> {
            PositionSnapshot base = existing != null ? existing : PositionSnapshot.flat(key);
            previous[0] = base;
            return base.applyFill(side, quantity, price, fee);
        });
        return new PositionChange(previous[0], current);
    }
}
