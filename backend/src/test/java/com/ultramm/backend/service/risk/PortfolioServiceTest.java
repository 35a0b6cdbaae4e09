package com.ultramm.backend.service.risk;

import com.ultramm.backend.config.DataProperties;
import com.ultramm.backend.config.RiskProperties;
import com.ultramm.backend.model.DepthEvent;
import com.ultramm.backend.model.DepthLevel;
import com.ultramm.backend.model.Side;
import com.ultramm.backend.service.execution.PositionBook;
import com.ultramm.backend.service.marketdata.MarketDataCache;
import com.ultramm.backend.util.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PortfolioServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final PositionBook positionBook = new PositionBook();
    private final MarketDataCache cache = new MarketDataCache(new DataProperties(), clock);
    private final PortfolioService portfolioService = new PortfolioService(new RiskProperties(), positionBook, cache);

    @Test
    void drawdownMeasuredFromPeakEquity() {
        positionBook.applyFill("BTC/USDT", Side.BUY, 1.0, 50000, 0.0);
        mark(50000);
        assertThat(portfolioService.evaluate().equity()).isCloseTo(10000, within(1e-9));

        mark(50500);
        assertThat(portfolioService.evaluate().peakEquity()).isCloseTo(10500, within(1e-9));

        mark(49975);
        PortfolioService.EquitySnapshot snapshot = portfolioService.evaluate();
        assertThat(snapshot.equity()).isCloseTo(9975, within(1e-9));
        assertThat(snapshot.drawdownPercent()).isCloseTo(5.0, within(1e-9));
        assertThat(snapshot.maxDrawdownPercent()).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void resetPeakStartsFromCurrentEquity() {
        positionBook.applyFill("BTC/USDT", Side.BUY, 1.0, 50000, 0.0);
        mark(50000);
        portfolioService.evaluate();
        mark(49000);
        assertThat(portfolioService.currentDrawdownPercent()).isCloseTo(10.0, within(1e-9));

        portfolioService.resetPeak();

        assertThat(portfolioService.currentDrawdownPercent()).isCloseTo(0.0, within(1e-9));
    }

    private void mark(double mid) {
        clock.advance(Duration.ofSeconds(1));
        cache.update(new DepthEvent("BTC/USDT", List.of(new DepthLevel(mid - 0.5, 1.0)),
                List.of(new DepthLevel(mid + 0.5, 1.0)), clock.instant()));
    }
}
