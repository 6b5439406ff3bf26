package com.optionengine.marketdata;

import com.optionengine.calendar.MarketClock;
import com.optionengine.domain.enums.Signal;
import com.optionengine.domain.model.Candle;
import com.optionengine.domain.model.Tick;
import com.optionengine.event.CandleCloseEvent;
import com.optionengine.event.SignalEvent;
import com.optionengine.event.TickEvent;
import com.optionengine.exit.ExitController;
import com.optionengine.ledger.PositionLedger;
import com.optionengine.oms.OrderExecutionController;
import com.optionengine.signal.CandleAggregator;
import com.optionengine.signal.EmaCrossoverStrategy;
import com.optionengine.signal.SignalConfig;
import com.optionengine.simulator.SimulatedMatchingEngine;
import java.util.Optional;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Fans market data out to the engine in a fixed order.
 *
 * <p>Per tick: paper broker matching (PAPER mode only), exit checks, ledger mark-to-market,
 * then candle aggregation for the underlying. A closed candle adjusts stops first and then
 * feeds the strategy while the market is open. Signals are executed on the signal executor
 * so the tick thread never waits on LTP polling.
 */
@Component
public class MarketDataRouter {

    private static final Logger log = LoggerFactory.getLogger(MarketDataRouter.class);

    private final Optional<SimulatedMatchingEngine> simulatedMatchingEngine;
    private final ExitController exitController;
    private final PositionLedger positionLedger;
    private final CandleAggregator candleAggregator;
    private final EmaCrossoverStrategy emaCrossoverStrategy;
    private final OrderExecutionController orderExecutionController;
    private final MarketClock marketClock;
    private final SignalConfig signalConfig;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Executor signalExecutor;

    public MarketDataRouter(
            Optional<SimulatedMatchingEngine> simulatedMatchingEngine,
            ExitController exitController,
            PositionLedger positionLedger,
            CandleAggregator candleAggregator,
            EmaCrossoverStrategy emaCrossoverStrategy,
            OrderExecutionController orderExecutionController,
            MarketClock marketClock,
            SignalConfig signalConfig,
            ApplicationEventPublisher applicationEventPublisher,
            @Qualifier("signalExecutor") Executor signalExecutor) {
        this.simulatedMatchingEngine = simulatedMatchingEngine;
        this.exitController = exitController;
        this.positionLedger = positionLedger;
        this.candleAggregator = candleAggregator;
        this.emaCrossoverStrategy = emaCrossoverStrategy;
        this.orderExecutionController = orderExecutionController;
        this.marketClock = marketClock;
        this.signalConfig = signalConfig;
        this.applicationEventPublisher = applicationEventPublisher;
        this.signalExecutor = signalExecutor;
    }

    @EventListener
    public void onTick(TickEvent event) {
        Tick tick = event.getTick();
        try {
            simulatedMatchingEngine.ifPresent(engine -> engine.onTick(tick));
            exitController.onTick(tick);
            positionLedger.markToMarket(tick.getInstrumentToken(), tick.getLastPrice());
        } catch (RuntimeException e) {
            log.error("Tick processing failed for {}: {}", tick.getInstrumentToken(), e.getMessage(), e);
        }

        if (tick.getInstrumentToken() == signalConfig.getUnderlyingToken()) {
            candleAggregator
                    .onTick(tick)
                    .ifPresent(candle -> applicationEventPublisher.publishEvent(new CandleCloseEvent(this, candle)));
        }
    }

    @EventListener
    public void onCandleClose(CandleCloseEvent event) {
        Candle candle = event.getCandle();
        exitController.onCandleClose(candle);
        if (!marketClock.isMarketOpen()) {
            log.debug("Market closed, candle {} not evaluated", candle.getCloseTime());
            return;
        }
        emaCrossoverStrategy
                .onCandle(candle)
                .ifPresent(signal ->
                        applicationEventPublisher.publishEvent(new SignalEvent(this, signal, candle.getClose())));
    }

    @EventListener
    public void onSignal(SignalEvent event) {
        Signal signal = event.getSignal();
        signalExecutor.execute(() -> {
            try {
                orderExecutionController.onSignal(signal, event.getSpotPrice());
            } catch (RuntimeException e) {
                log.error("Signal {} failed: {}", signal, e.getMessage(), e);
            }
        });
    }
}
