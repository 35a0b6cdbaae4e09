package com.ultramm.backend.controller;

import com.ultramm.backend.dto.EngineStatus;
import com.ultramm.backend.dto.ExecutionStats;
import com.ultramm.backend.dto.PerformanceMetrics;
import com.ultramm.backend.exception.NotFoundException;
import com.ultramm.backend.model.PositionSnapshot;
import com.ultramm.backend.service.PerformanceMetricsService;
import com.ultramm.backend.service.TradingEngine;
import com.ultramm.backend.service.execution.ExecutionCoordinator;
import com.ultramm.backend.service.execution.OrderHistoryCodec;
import com.ultramm.backend.service.execution.PositionBook;
import com.ultramm.backend.service.risk.SuspensionRegistry;
import com.ultramm.backend.trading.pipeline.StrategyCombiner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/trading")
@RequiredArgsConstructor
public class TradingController {

    private final TradingEngine tradingEngine;
    private final PositionBook positionBook;
    private final ExecutionCoordinator executionCoordinator;
    private final OrderHistoryCodec orderHistoryCodec;
    private final PerformanceMetricsService performanceMetricsService;
    private final SuspensionRegistry suspensionRegistry;
    private final StrategyCombiner strategyCombiner;

    @GetMapping("/status")
    public ResponseEntity<EngineStatus> status() {
        return ResponseEntity.ok(tradingEngine.status());
    }

    @PostMapping("/start")
    public ResponseEntity<EngineStatus> start() {
        log.info("Starting trading engine on request");
        tradingEngine.start();
        return ResponseEntity.ok(tradingEngine.status());
    }

    @PostMapping("/stop")
    public ResponseEntity<EngineStatus> stop() {
        log.info("Stopping trading engine on request");
        tradingEngine.stop();
        return ResponseEntity.ok(tradingEngine.status());
    }

    @PostMapping("/symbols/stop")
    public ResponseEntity<Map<String, Object>> stopSymbol(@RequestParam String symbol) {
        boolean clean = tradingEngine.stopSymbol(symbol);
        return ResponseEntity.ok(Map.of("symbol", symbol, "stopped", true, "allOrdersConfirmed", clean));
    }

    @PostMapping("/symbols/start")
    public ResponseEntity<Map<String, Object>> startSymbol(@RequestParam String symbol) {
        tradingEngine.startSymbol(symbol);
        return ResponseEntity.ok(Map.of("symbol", symbol, "started", true));
    }

    @GetMapping("/positions")
    public ResponseEntity<List<PositionSnapshot>> positions() {
        return ResponseEntity.ok(positionBook.all());
    }

    @GetMapping("/weights")
    public ResponseEntity<Map<String, Double>> weights(@RequestParam String symbol) {
        return ResponseEntity.ok(strategyCombiner.weights(symbol));
    }

    @GetMapping("/metrics")
    public ResponseEntity<PerformanceMetrics> metrics() {
        return ResponseEntity.ok(performanceMetricsService.latest());
    }

    @GetMapping("/execution/stats")
    public ResponseEntity<ExecutionStats> executionStats() {
        return ResponseEntity.ok(executionCoordinator.stats());
    }

    @GetMapping("/orders/{orderId}/history")
    public ResponseEntity<OrderHistoryCodec.OrderHistory> orderHistory(@PathVariable String orderId) {
        return executionCoordinator.order(orderId)
                .map(orderHistoryCodec::toHistory)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("Order not found: " + orderId));
    }

    @PostMapping("/risk/reset")
    public ResponseEntity<SuspensionRegistry.Status> resetRisk() {
        log.warn("Global trading suspension reset on request");
        suspensionRegistry.resetGlobal();
        return ResponseEntity.ok(suspensionRegistry.status());
    }

    @PostMapping("/risk/reset-symbol")
    public ResponseEntity<SuspensionRegistry.Status> resetSymbol(@RequestParam String symbol) {
        log.warn("Suspension of {} reset on request", symbol);
        suspensionRegistry.reset(symbol);
        return ResponseEntity.ok(suspensionRegistry.status());
    }

    @PostMapping("/exchanges/{exchangeId}/resume")
    public ResponseEntity<EngineStatus> resumeExchange(@PathVariable String exchangeId) {
        executionCoordinator.resumeExchange(exchangeId);
        return ResponseEntity.ok(tradingEngine.status());
    }
}
