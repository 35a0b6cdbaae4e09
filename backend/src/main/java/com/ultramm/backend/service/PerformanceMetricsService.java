package com.ultramm.backend.service;

import com.ultramm.backend.config.MonitoringProperties;
import com.ultramm.backend.dto.PerformanceMetrics;
import com.ultramm.backend.event.FillEvent;
import com.ultramm.backend.event.PerformanceMetricsEvent;
import com.ultramm.backend.service.risk.PortfolioService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Periodic P&L, Sharpe ratio, drawdown, win rate and volume. The Sharpe ratio is computed from
 * equity sampled once per metrics interval and annualized with the number of intervals per year.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PerformanceMetricsService {

    private final PortfolioService portfolioService;
    private final MonitoringProperties monitoringProperties;
    private final MetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Deque<Double> equitySamples = new ArrayDeque<>();
    private long wins;
    private long losses;
    private long trades;
    private double volume;
    private volatile PerformanceMetrics latest;

    @EventListener
    public synchronized void onFill(FillEvent event) {
        trades++;
        volume += event.quantity() * event.price();
        if (event.isClosing()) {
            if (event.realizedPnlDelta() > 0) {
                wins++;
            } else if (event.realizedPnlDelta() < 0) {
                losses++;
            }
        }
    }

    @Scheduled(fixedDelayString = "${monitoring.metrics-interval:PT60S}")
    public void publishScheduled() {
        try {
            publish();
        } catch (RuntimeException e) {
            log.error("Performance metrics computation failed", e);
        }
    }

    public PerformanceMetrics publish() {
        PerformanceMetrics metrics = snapshot();
        metricsService.updatePerformance(metrics.equity(), metrics.totalPnl(), metrics.drawdownPercent());
        eventPublisher.publishEvent(new PerformanceMetricsEvent(metrics));
        return metrics;
    }

    /**
     * Samples equity and returns current metrics. Each call adds one sample to the Sharpe window.
     */
    public synchronized PerformanceMetrics snapshot() {
        PortfolioService.EquitySnapshot equity = portfolioService.evaluate();
        equitySamples.addLast(equity.equity());
        while (equitySamples.size() > monitoringProperties.getEquityWindow()) {
            equitySamples.removeFirst();
        }
        long closed = wins + losses;
        latest = new PerformanceMetrics(
                equity.equity(),
                equity.realizedPnl() + equity.unrealizedPnl(),
                equity.realizedPnl(),
                equity.unrealizedPnl(),
                sharpeRatio(),
                equity.drawdownPercent(),
                equity.maxDrawdownPercent(),
                closed == 0 ? 0.0 : wins / (double) closed,
                volume,
                trades,
                clock.instant()
        );
        return latest;
    }

    public PerformanceMetrics latest() {
        PerformanceMetrics current = latest;
        return current != null ? current : snapshot();
    }

    double sharpeRatio() {
        if (equitySamples.size() < 3) {
            return 0.0;
        }
        int n = equitySamples.size() - 1;
        double[] returns = new double[n];
        Iterator<Double> iterator = equitySamples.iterator();
        double previous = iterator.next();
        for (int i = 0; i < n; i++) {
            double current = iterator.next();
            returns[i] = previous > 0 ? (current - previous) / previous : 0.0;
            previous = current;
        }
        double mean = 0.0;
        for (double r : returns) {
            mean += r;
        }
        mean /= n;
        double variance = 0.0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        variance /= (n - 1);
        double std = Math.sqrt(variance);
        if (std <= 1e-15) {
            return 0.0;
        }
        return mean / std * Math.sqrt(monitoringProperties.periodsPerYear());
    }
}
