package com.ultramm.backend.service;

import com.ultramm.backend.event.CombinedSignalEvent;
import com.ultramm.backend.event.ExchangeHaltedEvent;
import com.ultramm.backend.event.FillEvent;
import com.ultramm.backend.event.OrderStateChangedEvent;
import com.ultramm.backend.event.PerformanceMetricsEvent;
import com.ultramm.backend.event.RiskDecisionEvent;
import com.ultramm.backend.event.TradingHaltedEvent;
import com.ultramm.backend.exception.TradingException;
import com.ultramm.backend.model.RiskDecision;
import com.ultramm.backend.model.RiskOutcome;
import com.ultramm.backend.service.execution.ExecutionCoordinator;
import com.ultramm.backend.service.execution.OrderHistoryCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Turns pipeline events into logs and metrics. Terminal orders are written to the audit log
 * as their JSON history.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MonitoringService {

    private static final Logger AUDIT = LoggerFactory.getLogger("ORDER_AUDIT");

    private final MetricsService metricsService;
    private final ExecutionCoordinator executionCoordinator;
    private final OrderHistoryCodec orderHistoryCodec;

    @EventListener
    public void onCombinedSignal(CombinedSignalEvent event) {
        if (event.signal().isHold()) {
            return;
        }
        metricsService.recordCombinedSignal(event.signal().symbol(), event.signal().side().name());
        log.debug("Combined {} {} size {} lead {} weights {}", event.signal().symbol(), event.signal().side(),
                event.signal().size(), event.signal().leadStrategyId(), event.signal().weights());
    }

    @EventListener
    public void onRiskDecision(RiskDecisionEvent event) {
        RiskDecision decision = event.decision();
        metricsService.recordRiskDecision(decision.outcome().name(), decision.reason().name());
        if (decision.outcome() == RiskOutcome.REJECTED) {
            metricsService.recordReject(decision.reason().name());
            log.info("Risk rejected {}: {} ({})", decision.symbol(), decision.reason().description(),
                    decision.detail());
        } else if (decision.outcome() != RiskOutcome.APPROVED) {
            log.info("Risk {} {}: {} ({})", decision.outcome(), decision.symbol(), decision.reason().description(),
                    decision.detail());
        }
    }

    @EventListener
    public void onOrderStateChanged(OrderStateChangedEvent event) {
        metricsService.recordOrderTransition(event.to().name());
        log.debug("Order {} {} -> {} ({})", event.orderId(), event.from(), event.to(), event.reason());
        if (event.to().isTerminal()) {
            executionCoordinator.order(event.orderId()).ifPresent(order -> {
                try {
                    AUDIT.info(orderHistoryCodec.encode(order));
                } catch (TradingException e) {
                    log.warn("Could not audit order {}: {}", event.orderId(), e.getMessage());
                }
            });
        }
    }

    @EventListener
    public void onFill(FillEvent event) {
        log.debug("Position {} now {} (realized {})", event.symbol(), event.position().quantity(),
                event.position().realizedPnl());
    }

    @EventListener
    public void onTradingHalted(TradingHaltedEvent event) {
        metricsService.recordHalt();
        log.error("TRADING HALTED: {} (drawdown {}%)", event.reason(), String.format("%.2f", event.drawdownPercent()));
    }

    @EventListener
    public void onExchangeHalted(ExchangeHaltedEvent event) {
        log.error("Exchange {} halted at {}: {}", event.exchangeId(), event.at(), event.reason());
    }

    @EventListener
    public void onPerformanceMetrics(PerformanceMetricsEvent event) {
        log.info("Performance: equity={} pnl={} sharpe={} drawdown={}% winRate={} trades={}",
                String.format("%.2f", event.metrics().equity()),
                String.format("%.2f", event.metrics().totalPnl()),
                String.format("%.3f", event.metrics().sharpeRatio()),
                String.format("%.2f", event.metrics().drawdownPercent()),
                String.format("%.2f", event.metrics().winRate()),
                event.metrics().trades());
    }
}
