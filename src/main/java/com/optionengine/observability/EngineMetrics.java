package com.optionengine.observability;

import com.optionengine.event.OrderFillEvent;
import com.optionengine.event.OrderPlacedEvent;
import com.optionengine.event.OrderRejectedEvent;
import com.optionengine.event.PositionClosedEvent;
import com.optionengine.event.RiskEvent;
import com.optionengine.event.RiskEventType;
import com.optionengine.risk.CapitalRiskGovernor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the engine.
 *
 * <ul>
 *   <li><b>engine.orders.placed</b> (counter): entry and exit orders accepted by the broker</li>
 *   <li><b>engine.orders.rejected</b> (counter): orders rejected after submission</li>
 *   <li><b>engine.fills</b> (counter): fill callbacks received</li>
 *   <li><b>engine.exits</b> (counter, tag {@code reason}): finalized exits</li>
 *   <li><b>engine.entry.price.fallbacks</b> (counter): exits booked at zero PnL</li>
 *   <li><b>engine.kill.switch.trips</b> (counter)</li>
 *   <li><b>engine.realized.pnl</b>, <b>engine.open.positions</b> (gauges)</li>
 * </ul>
 *
 * <p>Listeners run after the core ones, at {@code @Order(20)}.
 */
@Service
public class EngineMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter ordersPlacedCounter;
    private final Counter ordersRejectedCounter;
    private final Counter fillsCounter;
    private final Counter entryPriceFallbackCounter;
    private final Counter killSwitchCounter;

    public EngineMetrics(MeterRegistry meterRegistry, CapitalRiskGovernor capitalRiskGovernor) {
        this.meterRegistry = meterRegistry;

        this.ordersPlacedCounter = Counter.builder("engine.orders.placed")
                .description("Orders accepted by the broker")
                .register(meterRegistry);

        this.ordersRejectedCounter = Counter.builder("engine.orders.rejected")
                .description("Orders rejected by the broker after submission")
                .register(meterRegistry);

        this.fillsCounter = Counter.builder("engine.fills")
                .description("Fill callbacks received")
                .register(meterRegistry);

        this.entryPriceFallbackCounter = Counter.builder("engine.entry.price.fallbacks")
                .description("Exits that had no entry price and booked zero PnL")
                .register(meterRegistry);

        this.killSwitchCounter = Counter.builder("engine.kill.switch.trips")
                .description("Times the daily loss limit disabled trading")
                .register(meterRegistry);

        meterRegistry.gauge("engine.realized.pnl", capitalRiskGovernor, governor -> governor.getRealizedPnl()
                .doubleValue());
        meterRegistry.gauge("engine.open.positions", capitalRiskGovernor, CapitalRiskGovernor::getOpenPositionCount);
    }

    @EventListener
    @Order(20)
    public void onOrderPlaced(OrderPlacedEvent event) {
        ordersPlacedCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onOrderRejected(OrderRejectedEvent event) {
        ordersRejectedCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onOrderFill(OrderFillEvent event) {
        fillsCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onPositionClosed(PositionClosedEvent event) {
        Counter.builder("engine.exits")
                .description("Finalized exits by reason")
                .tag("reason", event.getReason().name())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.KILL_SWITCH_TRIGGERED) {
            killSwitchCounter.increment();
        } else if (event.getEventType() == RiskEventType.ENTRY_PRICE_FALLBACK) {
            entryPriceFallbackCounter.increment();
        }
    }
}
