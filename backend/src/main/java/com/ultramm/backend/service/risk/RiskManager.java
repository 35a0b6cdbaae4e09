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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Gate between the combiner and execution. Checks run in a fixed order:
 * <ol>
 *   <li>portfolio drawdown, which halts every symbol on breach</li>
 *   <li>symbol suspension and market anomalies, which suspend the symbol for a cooldown</li>
 *   <li>stop-loss and take-profit, which replace the strategy signal with a closing order</li>
 *   <li>position limit, counting pending open-order exposure, which resizes legs</li>
 *   <li>open-order limit</li>
 * </ol>
 * Every rejection is logged with its reason.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RiskManager {

    private static final double EPSILON = 1e-12;

    private final RiskProperties riskProperties;
    private final SuspensionRegistry suspensionRegistry;
    private final PortfolioService portfolioService;
    private final OpenOrderView openOrderView;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private volatile long observedResets;

    public RiskDecision gate(String symbol, CombinedSignal signal, PositionSnapshot position, IndicatorSet indicators) {
        Instant now = clock.instant();

        boolean halted = suspensionRegistry.isGloballySuspended();
        long resets = suspensionRegistry.globalResetCount();
        if (resets != observedResets) {
            observedResets = resets;
            portfolioService.resetPeak();
        }
        double drawdown = portfolioService.currentDrawdownPercent();
        if (drawdown >= riskProperties.getMaxDrawdownPercent()) {
            String detail = String.format("drawdown %.2f%% >= %.2f%%", drawdown, riskProperties.getMaxDrawdownPercent());
            if (suspensionRegistry.suspendAll(detail)) {
                eventPublisher.publishEvent(new TradingHaltedEvent(detail, drawdown, now));
            }
            return reject(symbol, RiskReasonCode.DRAWDOWN_BREACH, signal, detail, now);
        }
        if (halted) {
            return reject(symbol, RiskReasonCode.GLOBAL_SUSPENDED, signal, "trading halted", now);
        }
        if (suspensionRegistry.isSuspended(symbol)) {
            return reject(symbol, RiskReasonCode.SYMBOL_SUSPENDED, signal, "symbol in cooldown", now);
        }
        Optional<RiskReasonCode> anomaly = detectAnomaly(indicators);
        if (anomaly.isPresent()) {
            String detail = anomalyDetail(anomaly.get(), indicators);
            suspensionRegistry.suspend(symbol, riskProperties.getManipulation().getCooldown(), detail);
            return reject(symbol, anomaly.get(), signal, detail, now);
        }

        Optional<RiskDecision> protective = protectiveExit(symbol, signal, position, now);
        if (protective.isPresent()) {
            RiskDecision exit = protective.get();
            return exit.legs().isEmpty() ? exit : checkOpenOrders(exit, now);
        }
        if (signal.isHold()) {
            return RiskDecision.reject(symbol, RiskReasonCode.NO_SIGNAL, signal, "no signal", now);
        }

        List<OrderLeg> requested = legsFor(signal);
        List<OrderLeg> sized = new ArrayList<>();
        boolean resized = false;
        double maxPosition = riskProperties.maxPositionFor(symbol);
        for (OrderLeg leg : requested) {
            double headroom = headroom(symbol, leg.side(), position, maxPosition);
            double size = Math.min(leg.size(), headroom);
            if (size < leg.size() - EPSILON) {
                resized = true;
            }
            if (size > EPSILON) {
                sized.add(leg.withSize(size));
            }
        }
        if (sized.isEmpty()) {
            String detail = String.format("position %.8f at limit %.8f", position.quantity(), maxPosition);
            return reject(symbol, RiskReasonCode.POSITION_LIMIT, signal, detail, now);
        }
        RiskDecision decision = resized
                ? new RiskDecision(symbol, RiskOutcome.RESIZED, RiskReasonCode.POSITION_LIMIT, sized, signal,
                        "resized to position headroom", now)
                : new RiskDecision(symbol, RiskOutcome.APPROVED, RiskReasonCode.OK, sized, signal, null, now);
        if (resized) {
            log.info("Resized {} signal for {} to {}", signal.side(), symbol, sized);
        }
        return checkOpenOrders(decision, now);
    }

    /**
     * Remaining size that can be added on {@code side} before the absolute net position could
     * exceed {@code maxPosition}, assuming every working order on that side fills.
     */
    double headroom(String symbol, Side side, PositionSnapshot position, double maxPosition) {
        double pending = openOrderView.pendingExposure(symbol, side);
        double exposure = side == Side.BUY ? position.quantity() + pending : -position.quantity() + pending;
        return Math.max(0.0, maxPosition - exposure);
    }

    private Optional<RiskReasonCode> detectAnomaly(IndicatorSet indicators) {
        RiskProperties.Manipulation manipulation = riskProperties.getManipulation();
        if (!manipulation.isEnabled() || indicators == null) {
            return Optional.empty();
        }
        if (indicators.volatilityRatio() > manipulation.getVolatilityThreshold()) {
            return Optional.of(RiskReasonCode.VOLATILITY_ANOMALY);
        }
        if (indicators.volumeRatio() > manipulation.getVolumeSpikeThreshold()) {
            return Optional.of(RiskReasonCode.VOLUME_SPIKE);
        }
        if (indicators.spreadRatio() > manipulation.getSpreadAnomalyThreshold()) {
            return Optional.of(RiskReasonCode.SPREAD_ANOMALY);
        }
        return Optional.empty();
    }

    private String anomalyDetail(RiskReasonCode reason, IndicatorSet indicators) {
        return switch (reason) {
            case VOLATILITY_ANOMALY -> String.format("volatility ratio %.2f", indicators.volatilityRatio());
            case VOLUME_SPIKE -> String.format("volume ratio %.2f", indicators.volumeRatio());
            case SPREAD_ANOMALY -> String.format("spread ratio %.2f", indicators.spreadRatio());
            default -> reason.description();
        };
    }

    private Optional<RiskDecision> protectiveExit(String symbol, CombinedSignal signal, PositionSnapshot position,
                                                  Instant now) {
        double mark = signal.referencePrice();
        if (position.isFlat() || mark <= 0) {
            return Optional.empty();
        }
        double pnlPercent = position.unrealizedPnlPercent(mark);
        RiskReasonCode reason;
        if (pnlPercent <= -riskProperties.getStopLossPercent()) {
            reason = RiskReasonCode.STOP_LOSS;
        } else if (pnlPercent >= riskProperties.getTakeProfitPercent()) {
            reason = RiskReasonCode.TAKE_PROFIT;
        } else {
            return Optional.empty();
        }
        Side side = position.quantity() > 0 ? Side.SELL : Side.BUY;
        String detail = String.format("%s at %.2f%% (entry %.8f, mark %.8f)", reason.description(), pnlPercent,
                position.averageEntryPrice(), mark);
        // working orders on the exit side already close part of the position
        double uncovered = Math.abs(position.quantity()) - openOrderView.pendingExposure(symbol, side);
        double size = Math.min(uncovered, headroom(symbol, side, position, riskProperties.maxPositionFor(symbol)));
        if (size <= EPSILON) {
            log.info("Exit of {} {} already working: {}", position.quantity(), symbol, detail);
            return Optional.of(RiskDecision.reject(symbol, reason, signal, detail + ", exit already working", now));
        }
        OrderLeg leg = new OrderLeg(side, mark, size);
        log.warn("Forcing exit of {} of {} {}: {}", size, position.quantity(), symbol, detail);
        return Optional.of(new RiskDecision(symbol, RiskOutcome.FORCED_EXIT, reason, List.of(leg), signal, detail, now));
    }

    private RiskDecision checkOpenOrders(RiskDecision decision, Instant now) {
        int open = openOrderView.openOrderCount(decision.symbol());
        int max = riskProperties.getMaxOpenOrders();
        if (open >= max) {
            return reject(decision.symbol(), RiskReasonCode.OPEN_ORDER_LIMIT, decision.signal(),
                    open + " open orders, limit " + max, now);
        }
        if (open + decision.legs().size() > max) {
            List<OrderLeg> kept = decision.legs().subList(0, max - open);
            log.info("Trimmed {} legs for {} to stay within {} open orders", decision.legs().size() - kept.size(),
                    decision.symbol(), max);
            RiskOutcome outcome = decision.outcome() == RiskOutcome.FORCED_EXIT ? RiskOutcome.FORCED_EXIT : RiskOutcome.RESIZED;
            RiskReasonCode reason = outcome == RiskOutcome.FORCED_EXIT ? decision.reason() : RiskReasonCode.OPEN_ORDER_LIMIT;
            return new RiskDecision(decision.symbol(), outcome, reason, kept, decision.signal(), decision.detail(), now);
        }
        return decision;
    }

    private List<OrderLeg> legsFor(CombinedSignal signal) {
        if (signal.side() == SignalSide.QUOTE) {
            return List.of(
                    new OrderLeg(Side.BUY, signal.bidPrice(), signal.size()),
                    new OrderLeg(Side.SELL, signal.askPrice(), signal.size()));
        }
        return List.of(new OrderLeg(signal.side().toSide(), signal.limitPrice(), signal.size()));
    }

    private RiskDecision reject(String symbol, RiskReasonCode reason, CombinedSignal signal, String detail, Instant now) {
        log.warn("Rejected {} signal for {}: {} ({})", signal.side(), symbol, reason.description(), detail);
        return RiskDecision.reject(symbol, reason, signal, detail, now);
    }
}
