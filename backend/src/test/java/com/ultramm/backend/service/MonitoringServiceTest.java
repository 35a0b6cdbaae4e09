package com.ultramm.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ultramm.backend.event.OrderStateChangedEvent;
import com.ultramm.backend.event.RiskDecisionEvent;
import com.ultramm.backend.event.TradingHaltedEvent;
import com.ultramm.backend.model.CombinedSignal;
import com.ultramm.backend.model.Order;
import com.ultramm.backend.model.OrderState;
import com.ultramm.backend.model.RiskDecision;
import com.ultramm.backend.model.RiskReasonCode;
import com.ultramm.backend.model.Side;
import com.ultramm.backend.service.execution.ExecutionCoordinator;
import com.ultramm.backend.service.execution.OrderHistoryCodec;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MonitoringServiceTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final MetricsService metricsService = mock(MetricsService.class);
    private final ExecutionCoordinator executionCoordinator = mock(ExecutionCoordinator.class);
    private final MonitoringService monitoringService = new MonitoringService(metricsService, executionCoordinator,
            new OrderHistoryCodec(new ObjectMapper().findAndRegisterModules()));

    @Test
    void terminalTransitionsAreAudited() {
        Order order = Order.builder().id("o-1").symbol("BTC/USDT").side(Side.BUY).price(50000).size(0.1).build();
        order.transitionTo(OrderState.CANCELED, "stop", T0);
        when(executionCoordinator.order("o-1")).thenReturn(Optional.of(order));

        monitoringService.onOrderStateChanged(new OrderStateChangedEvent("o-1", null, "BTC/USDT",
                OrderState.NEW, OrderState.CANCELED, "stop", T0));
        monitoringService.onOrderStateChanged(new OrderStateChangedEvent("o-2", null, "BTC/USDT",
                OrderState.NEW, OrderState.SUBMITTED, "acknowledged", T0));

        verify(executionCoordinator).order("o-1");
        verify(executionCoordinator, never()).order("o-2");
        verify(metricsService).recordOrderTransition("CANCELED");
    }

    @Test
    void riskRejectionsAndHaltsAreCounted() {
        CombinedSignal hold = CombinedSignal.hold("BTC/USDT", 50000, T0);
        monitoringService.onRiskDecision(new RiskDecisionEvent(
                RiskDecision.reject("BTC/USDT", RiskReasonCode.VOLUME_SPIKE, hold, "volume ratio 6.0", T0)));
        monitoringService.onTradingHalted(new TradingHaltedEvent("drawdown", 5.0, T0));

        verify(metricsService).recordReject("VOLUME_SPIKE");
        verify(metricsService).recordHalt();
        verify(metricsService, never()).recordCombinedSignal(anyString(), anyString());
    }
}
