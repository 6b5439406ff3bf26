package com.optionengine.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.optionengine.api.controller.RiskController;
import com.optionengine.config.ApiResponseAdvice;
import com.optionengine.risk.CapitalRiskGovernor;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class RiskControllerTest {

    private MockMvc mockMvc;

    @Mock
    private CapitalRiskGovernor capitalRiskGovernor;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RiskController(capitalRiskGovernor))
                .setControllerAdvice(new ApiResponseAdvice("PAPER"))
                .build();
    }

    @Test
    @DisplayName("GET /api/risk returns capital, PnL and the trading flag")
    void getRiskStatus() throws Exception {
        when(capitalRiskGovernor.availableCapital()).thenReturn(new BigDecimal("99450"));
        when(capitalRiskGovernor.getRealizedPnl()).thenReturn(new BigDecimal("-550"));
        when(capitalRiskGovernor.canTakeNewTrade()).thenReturn(true);
        when(capitalRiskGovernor.getOpenPositionCount()).thenReturn(1);

        mockMvc.perform(get("/api/risk"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.mode").value("PAPER"))
                .andExpect(jsonPath("$.data.availableCapital").value(99450))
                .andExpect(jsonPath("$.data.realizedPnl").value(-550))
                .andExpect(jsonPath("$.data.tradingEnabled").value(true))
                .andExpect(jsonPath("$.data.openPositionCount").value(1));
    }

    @Test
    @DisplayName("GET /api/risk reports trading disabled after the kill switch")
    void killSwitchTripped() throws Exception {
        when(capitalRiskGovernor.availableCapital()).thenReturn(new BigDecimal("95000"));
        when(capitalRiskGovernor.getRealizedPnl()).thenReturn(new BigDecimal("-5000"));
        when(capitalRiskGovernor.canTakeNewTrade()).thenReturn(false);
        when(capitalRiskGovernor.getOpenPositionCount()).thenReturn(0);

        mockMvc.perform(get("/api/risk"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tradingEnabled").value(false));
    }
}
