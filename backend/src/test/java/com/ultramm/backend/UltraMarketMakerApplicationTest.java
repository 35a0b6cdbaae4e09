package com.ultramm.backend;

import com.ultramm.backend.service.strategy.StrategyRegistry;
import com.ultramm.backend.service.strategy.TradingStrategy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "engine.auto-start=false")
@AutoConfigureMockMvc
class UltraMarketMakerApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private StrategyRegistry strategyRegistry;

    @Test
    void configuredStrategiesAreRegistered() {
        assertThat(strategyRegistry.all()).extracting(TradingStrategy::id)
                .containsExactly("basic-mm", "adaptive-mm", "stat-arb-btc-eth");
        assertThat(strategyRegistry.tradedSymbols()).containsExactlyInAnyOrder("BTC/USDT", "ETH/USDT", "SOL/USDT");
    }

    @Test
    void statusReportsStoppedEngine() throws Exception {
        mockMvc.perform(get("/api/trading/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.globallySuspended").value(false));
    }

    @Test
    void unknownSymbolAndOrderAreNotFound() throws Exception {
        mockMvc.perform(post("/api/trading/symbols/stop").param("symbol", "DOGE/USDT"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Symbol not traded: DOGE/USDT"));
        mockMvc.perform(get("/api/trading/orders/missing/history"))
                .andExpect(status().isNotFound());
    }

    @Test
    void missingParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/trading/weights"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void weightsStartEqual() throws Exception {
        mockMvc.perform(get("/api/trading/weights").param("symbol", "BTC/USDT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['basic-mm']").isNumber());
    }
}
