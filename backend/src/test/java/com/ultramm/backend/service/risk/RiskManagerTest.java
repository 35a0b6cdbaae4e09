package com.ultramm.backend.service.risk;

import com.ultramm.backend.config.RiskProperties;
import com.ultramm.backend.event.TradingHaltedEvent;
import com.ultramm.backend.model.CombinedSignal;
import com.ultramm.backend.model.IndicatorSet;
import com.ultramm.backend.model.OrderLeg;
import com.ultramm.backend.model.PositionSnapshot;
import com.ultramm.backend.model.RiskDecision;
import com.ultramm.backend.model.RiskOutcome;
import com.ultramm.backend.model.RiskReasonCode;
import com.ultramm.backend.model.Side;
import com.ultramm.backend.model.SignalSide;
import com.ultramm.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RiskManagerTest {

    private static final String BTC = "BTC/USDT";
    private static final String ETH = "ETH/USDT";
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private MutableClock clock;
    private RiskProperties riskProperties;
    private SuspensionRegistry suspensionRegistry;
    private PortfolioService portfolioService;
    private OpenOrderView openOrderView;
    private List<Object> events;
    private RiskManager riskManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        riskProperties = new RiskProperties();
        riskProperties.setMaxPositionBySymbol(Map.of(BTC, 1.0, ETH, 10.0));
        suspensionRegistry = new SuspensionRegistry(riskProperties, clock);
        portfolioService = mock(PortfolioService.class);
        openOrderView = mock(OpenOrderView.class);
        events = new ArrayList<>();
        ApplicationEventPublisher publisher = events::add;
        riskManager = new RiskManager(riskProperties, suspensionRegistry, portfolioService, openOrderView,
                publisher, clock);
    }

    @Test
    void approvesQuoteWithinLimits() {
        RiskDecision decision = riskManager.gate(BTC, quote(0.01), PositionSnapshot.flat(BTC), IndicatorSet.NEUTRAL);

        assertThat(decision.outcome()).isEqualTo(RiskOutcome.APPROVED);
        assertThat(decision.legs()).extracting(OrderLeg::side).containsExactly(Side.BUY, Side.SELL);
        assertThat(decision.isQuote()).isTrue();
    }

    @Test
    void rejectsBuyWhenPositionAtLimit() {
        PositionSnapshot atLimit = new PositionSnapshot(BTC, 1.0, 50000, 0, 0, 3);

        RiskDecision decision = riskManager.gate(BTC, directional(SignalSide.BUY, 0.01), atLimit, IndicatorSet.NEUTRAL);

        assertThat(decision.outcome()).isEqualTo(RiskOutcome.REJECTED);
        assertThat(decision.reason()).isEqualTo(RiskReasonCode.POSITION_LIMIT);
        assertThat(decision.reason().description()).isEqualTo("position limit");
        assertThat(decision.legs()).isEmpty();
    }

    @Test
    void quoteAtLimitKeepsOnlyReducingSide() {
        PositionSnapshot atLimit = new PositionSnapshot(BTC, 1.0, 50000, 0, 0, 3);

        RiskDecision decision = riskManager.gate(BTC, quote(0.01), atLimit, IndicatorSet.NEUTRAL);

        assertThat(decision.outcome()).isEqualTo(RiskOutcome.RESIZED);
        assertThat(decision.reason()).isEqualTo(RiskReasonCode.POSITION_LIMIT);
        assertThat(decision.legs()).extracting(OrderLeg::side).containsExactly(Side.SELL);
    }

    @Test
    void resizesToHeadroomIncludingPendingOrders() {
        when(openOrderView.pendingExposure(BTC, Side.BUY)).thenReturn(0.3);
        PositionSnapshot position = new PositionSnapshot(BTC, 0.5, 50000, 0, 0, 1);

        RiskDecision decision = riskManager.gate(BTC, directional(SignalSide.BUY, 0.5), position, IndicatorSet.NEUTRAL);

        assertThat(decision.outcome()).isEqualTo(RiskOutcome.RESIZED);
        assertThat(decision.legs().get(0).size()).isCloseTo(0.2, within(1e-12));
    }

    @Test
    void drawdownBreachHaltsEverySymbolOnce() {
        when(portfolioService.currentDrawdownPercent()).thenReturn(5.0);

        RiskDecision first = riskManager.gate(BTC, quote(0.01), PositionSnapshot.flat(BTC), IndicatorSet.NEUTRAL);
        RiskDecision second = riskManager.gate(ETH, quote(0.01), PositionSnapshot.flat(ETH), IndicatorSet.NEUTRAL);

        assertThat(first.reason()).isEqualTo(RiskReasonCode.DRAWDOWN_BREACH);
        assertThat(second.outcome()).isEqualTo(RiskOutcome.REJECTED);
        assertThat(suspensionRegistry.isGloballySuspended()).isTrue();
        assertThat(events).hasSize(1).first().isInstanceOf(TradingHaltedEvent.class);
        assertThat(((TradingHaltedEvent) events.get(0)).drawdownPercent()).isEqualTo(5.0);
    }

    @Test
    void drawdownBelowLimitKeepsTrading() {
        when(portfolioService.currentDrawdownPercent()).thenReturn(3.0);

        RiskDecision decision = riskManager.gate(BTC, quote(0.01), PositionSnapshot.flat(BTC), IndicatorSet.NEUTRAL);

        assertThat(decision.isApproved()).isTrue();
        assertThat(suspensionRegistry.isGloballySuspended()).isFalse();
        assertThat(events).isEmpty();
    }

    @Test
    void haltStaysUntilResetThenRestartsPeak() {
        when(portfolioService.currentDrawdownPercent()).thenReturn(6.0);
        riskManager.gate(BTC, quote(0.01), PositionSnapshot.flat(BTC), IndicatorSet.NEUTRAL);

        when(portfolioService.currentDrawdownPercent()).thenReturn(0.0);
        RiskDecision stillHalted = riskManager.gate(BTC, quote(0.01), PositionSnapshot.flat(BTC), IndicatorSet.NEUTRAL);
        assertThat(stillHalted.reason()).isEqualTo(RiskReasonCode.GLOBAL_SUSPENDED);

        suspensionRegistry.resetGlobal();
        RiskDecision resumed = riskManager.gate(BTC, quote(0.01), PositionSnapshot.flat(BTC), IndicatorSet.NEUTRAL);
        assertThat(resumed.isApproved()).isTrue();
        verify(portfolioService).resetPeak();
    }

    @Test
    void volatilityAnomalySuspendsSymbolForCooldown() {
        IndicatorSet stormy = new IndicatorSet(3.0, 4.0, 1.0, 0.0, 1.0, 1.0, 0.0, 30);

        RiskDecision anomaly = riskManager.gate(BTC, quote(0.01), PositionSnapshot.flat(BTC), stormy);
        RiskDecision during = riskManager.gate(BTC, quote(0.01), PositionSnapshot.flat(BTC), IndicatorSet.NEUTRAL);
        RiskDecision otherSymbol = riskManager.gate(ETH, quote(0.01), PositionSnapshot.flat(ETH), IndicatorSet.NEUTRAL);
        clock.advance(Duration.ofMinutes(5));
        RiskDecision after = riskManager.gate(BTC, quote(0.01), PositionSnapshot.flat(BTC), IndicatorSet.NEUTRAL);

        assertThat(anomaly.reason()).isEqualTo(RiskReasonCode.VOLATILITY_ANOMALY);
        assertThat(during.reason()).isEqualTo(RiskReasonCode.SYMBOL_SUSPENDED);
        assertThat(otherSymbol.isApproved()).isTrue();
        assertThat(after.isApproved()).isTrue();
    }

    @Test
    void volumeAndSpreadAnomaliesAreDetected() {
        IndicatorSet volumeSpike = new IndicatorSet(0.1, 1.0, 6.0, 0.0, 1.0, 1.0, 0.0, 30);
        IndicatorSet wideSpread = new IndicatorSet(0.1, 1.0, 1.0, 0.0, 1.0, 3.5, 0.0, 30);

        assertThat(riskManager.gate(BTC, quote(0.01), PositionSnapshot.flat(BTC), volumeSpike).reason())
                .isEqualTo(RiskReasonCode.VOLUME_SPIKE);
        assertThat(riskManager.gate(ETH, quote(0.01), PositionSnapshot.flat(ETH), wideSpread).reason())
                .isEqualTo(RiskReasonCode.SPREAD_ANOMALY);
    }

    @Test
    void stopLossForcesClosingOrderEvenWithoutSignal() {
        PositionSnapshot losing = new PositionSnapshot(BTC, 0.5, 50000, 0, 0, 2);
        CombinedSignal hold = CombinedSignal.hold(BTC, 48500, T0);

        RiskDecision decision = riskManager.gate(BTC, hold, losing, IndicatorSet.NEUTRAL);

        assertThat(decision.outcome()).isEqualTo(RiskOutcome.FORCED_EXIT);
        assertThat(decision.reason()).isEqualTo(RiskReasonCode.STOP_LOSS);
        assertThat(decision.legs()).containsExactly(new OrderLeg(Side.SELL, 48500, 0.5));
        assertThat(decision.isQuote()).isFalse();
    }

    @Test
    void stopLossDoesNotStackOnWorkingExit() {
        when(openOrderView.pendingExposure(BTC, Side.SELL)).thenReturn(2.0);
        PositionSnapshot losing = new PositionSnapshot(BTC, 1.0, 50000, 0, 0, 4);

        RiskDecision decision = riskManager.gate(BTC, CombinedSignal.hold(BTC, 45000, T0), losing,
                IndicatorSet.NEUTRAL);

        assertThat(decision.outcome()).isEqualTo(RiskOutcome.REJECTED);
        assertThat(decision.reason()).isEqualTo(RiskReasonCode.STOP_LOSS);
        assertThat(decision.legs()).isEmpty();
    }

    @Test
    void stopLossClosesOnlyUncoveredRemainder() {
        when(openOrderView.pendingExposure(BTC, Side.SELL)).thenReturn(0.3);
        PositionSnapshot losing = new PositionSnapshot(BTC, 0.5, 50000, 0, 0, 4);

        RiskDecision decision = riskManager.gate(BTC, CombinedSignal.hold(BTC, 45000, T0), losing,
                IndicatorSet.NEUTRAL);

        assertThat(decision.outcome()).isEqualTo(RiskOutcome.FORCED_EXIT);
        assertThat(decision.legs()).singleElement().satisfies(leg -> {
            assertThat(leg.side()).isEqualTo(Side.SELL);
            assertThat(leg.size()).isCloseTo(0.2, within(1e-12));
        });
        double worstCase = losing.quantity() - 0.3 - decision.legs().get(0).size();
        assertThat(Math.abs(worstCase)).isLessThanOrEqualTo(1.0);
    }

    @Test
    void takeProfitClosesShort() {
        PositionSnapshot winningShort = new PositionSnapshot(BTC, -0.2, 50000, 0, 0, 2);

        RiskDecision decision = riskManager.gate(BTC, CombinedSignal.hold(BTC, 47000, T0), winningShort,
                IndicatorSet.NEUTRAL);

        assertThat(decision.reason()).isEqualTo(RiskReasonCode.TAKE_PROFIT);
        assertThat(decision.legs().get(0).side()).isEqualTo(Side.BUY);
    }

    @Test
    void holdWithoutProtectiveExitIsNoSignal() {
        RiskDecision decision = riskManager.gate(BTC, CombinedSignal.hold(BTC, 50000, T0), PositionSnapshot.flat(BTC),
                IndicatorSet.NEUTRAL);

        assertThat(decision.reason()).isEqualTo(RiskReasonCode.NO_SIGNAL);
        assertThat(decision.isApproved()).isFalse();
    }

    @Test
    void openOrderLimitRejectsAndTrims() {
        riskProperties.setMaxOpenOrders(2);
        when(openOrderView.openOrderCount(BTC)).thenReturn(2);
        when(openOrderView.openOrderCount(ETH)).thenReturn(1);

        RiskDecision full = riskManager.gate(BTC, quote(0.01), PositionSnapshot.flat(BTC), IndicatorSet.NEUTRAL);
        RiskDecision trimmed = riskManager.gate(ETH, quote(0.01), PositionSnapshot.flat(ETH), IndicatorSet.NEUTRAL);

        assertThat(full.reason()).isEqualTo(RiskReasonCode.OPEN_ORDER_LIMIT);
        assertThat(trimmed.outcome()).isEqualTo(RiskOutcome.RESIZED);
        assertThat(trimmed.legs()).hasSize(1);
    }

    @Test
    void positionNeverExceedsLimitAcrossApprovedSequence() {
        Random random = new Random(11);
        PositionSnapshot position = PositionSnapshot.flat(BTC);
        double price = 50000;

        for (int i = 0; i < 2000; i++) {
            price *= 1 + random.nextGaussian() * 0.002;
            SignalSide side = switch (random.nextInt(3)) {
                case 0 -> SignalSide.BUY;
                case 1 -> SignalSide.SELL;
                default -> SignalSide.QUOTE;
            };
            double size = 0.05 + random.nextDouble() * 0.6;
            CombinedSignal signal = side == SignalSide.QUOTE
                    ? new CombinedSignal(BTC, side, price * 0.999, price * 1.001, size, 1.0, price, false, "mm",
                            Map.of(), T0)
                    : new CombinedSignal(BTC, side, price, price, size, 1.0, price, false, "dir", Map.of(), T0);

            RiskDecision decision = riskManager.gate(BTC, signal, position, IndicatorSet.NEUTRAL);
            if (decision.isApproved()) {
                // worst case: every leg on one side fills before the other
                for (OrderLeg leg : decision.legs()) {
                    position = position.applyFill(leg.side(), leg.size(), leg.price(), 0.0);
                    assertThat(Math.abs(position.quantity())).isLessThanOrEqualTo(1.0 + 1e-9);
                }
            }
        }
    }

    private static CombinedSignal quote(double size) {
        return new CombinedSignal(BTC, SignalSide.QUOTE, 49975, 50025, size, 1.0, 50000, false, "mm", Map.of(), T0);
    }

    private static CombinedSignal directional(SignalSide side, double size) {
        return new CombinedSignal(BTC, side, side == SignalSide.BUY ? 50000 : 0, side == SignalSide.SELL ? 50000 : 0,
                size, 1.0, 50000, false, "dir", Map.of(), T0);
    }
}
