package com.optionengine.api.controller;

import com.optionengine.ledger.PositionLedger;
import com.optionengine.oms.OrderExecutionController;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of open positions.
 *
 * <ul>
 *   <li>GET /api/positions -- open execution positions and the ledger's per-symbol aggregates</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private final OrderExecutionController orderExecutionController;
    private final PositionLedger positionLedger;

    public PositionController(OrderExecutionController orderExecutionController, PositionLedger positionLedger) {
        this.orderExecutionController = orderExecutionController;
        this.positionLedger = positionLedger;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getPositions() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("executions", orderExecutionController.openPositions());
        body.put("aggregates", positionLedger.openPositions());
        body.put("realizedPnl", positionLedger.totalRealizedPnl());
        return ResponseEntity.ok(body);
    }
}
