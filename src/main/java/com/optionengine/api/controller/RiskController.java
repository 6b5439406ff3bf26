package com.optionengine.api.controller;

import com.optionengine.risk.CapitalRiskGovernor;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Risk status.
 *
 * <ul>
 *   <li>GET /api/risk -- available capital, realized PnL and whether new trades are allowed</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private final CapitalRiskGovernor capitalRiskGovernor;

    public RiskController(CapitalRiskGovernor capitalRiskGovernor) {
        this.capitalRiskGovernor = capitalRiskGovernor;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getRiskStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("availableCapital", capitalRiskGovernor.availableCapital());
        status.put("realizedPnl", capitalRiskGovernor.getRealizedPnl());
        status.put("tradingEnabled", capitalRiskGovernor.canTakeNewTrade());
        status.put("openPositionCount", capitalRiskGovernor.getOpenPositionCount());
        return ResponseEntity.ok(status);
    }
}
