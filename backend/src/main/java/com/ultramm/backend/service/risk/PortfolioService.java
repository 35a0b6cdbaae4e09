package com.ultramm.backend.service.risk;

import com.ultramm.backend.config.RiskProperties;
import com.ultramm.backend.model.MarketSnapshot;
import com.ultramm.backend.model.PositionSnapshot;
import com.ultramm.backend.service.execution.PositionBook;
import com.ultramm.backend.service.marketdata.MarketDataCache;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Marks every position to the latest price and tracks peak equity for drawdown.
 */
@Service
@RequiredArgsConstructor
public class PortfolioService {

    public record EquitySnapshot(double equity, double realizedPnl, double unrealizedPnl, double peakEquity,
                                 double drawdownPercent, double maxDrawdownPercent) {}

    private final RiskProperties riskProperties;
    private final PositionBook positionBook;
    private final MarketDataCache marketDataCache;

    private double peakEquity = Double.NaN;
    private double maxDrawdownPercent;

    /**
     * Recomputes equity and updates the peak. Drawdown is measured from the highest equity seen.
     */
    public synchronized EquitySnapshot evaluate() {
        double realized = 0.0;
        double unrealized = 0.0;
        for (PositionSnapshot position : positionBook.all()) {
            realized += position.realizedPnl();
            if (!position.isFlat()) {
                double mark = marketDataCache.peek(position.symbol())
                        .map(MarketSnapshot::midPrice)
                        .orElse(position.averageEntryPrice());
                unrealized += position.unrealizedPnl(mark);
            }
        }
        double equity = riskProperties.getInitialCapital() + realized + unrealized;
        if (Double.isNaN(peakEquity) || equity > peakEquity) {
            peakEquity = equity;
        }
        double drawdown = peakEquity > 0 ? Math.max(0.0, (peakEquity - equity) / peakEquity * 100.0) : 0.0;
        maxDrawdownPercent = Math.max(maxDrawdownPercent, drawdown);
        return new EquitySnapshot(equity, realized, unrealized, peakEquity, drawdown, maxDrawdownPercent);
    }

    public double currentDrawdownPercent() {
        return evaluate().drawdownPercent();
    }

    /**
     * Starts a new drawdown measurement from current equity, used after a manual halt reset.
     */
    public synchronized void resetPeak() {
        peakEquity = Double.NaN;
        maxDrawdownPercent = 0.0;
        evaluate();
    }
}
