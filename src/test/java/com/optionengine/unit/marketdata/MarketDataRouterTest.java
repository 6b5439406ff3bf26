package com.optionengine.unit.marketdata;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.optionengine.calendar.MarketClock;
import com.optionengine.domain.enums.Signal;
import com.optionengine.domain.model.Candle;
import com.optionengine.domain.model.Tick;
import com.optionengine.event.CandleCloseEvent;
import com.optionengine.event.SignalEvent;
import com.optionengine.event.TickEvent;
import com.optionengine.exit.ExitController;
import com.optionengine.ledger.PositionLedger;
import com.optionengine.marketdata.MarketDataRouter;
import com.optionengine.oms.OrderExecutionController;
import com.optionengine.signal.CandleAggregator;
import com.optionengine.signal.EmaCrossoverStrategy;
import com.optionengine.signal.SignalConfig;
import com.optionengine.simulator.SimulatedMatchingEngine;
import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

class MarketDataRouterTest {

    private static final long NIFTY = 256265L;
    private static final long OPTION = 1001L;

    private SimulatedMatchingEngine simulatedMatchingEngine;
    private ExitController exitController;
    private PositionLedger positionLedger;
    private CandleAggregator candleAggregator;
    private EmaCrossoverStrategy emaCrossoverStrategy;
    private OrderExecutionController orderExecutionController;
    private MarketClock marketClock;
    private ApplicationEventPublisher eventPublisher;
    private MarketDataRouter router;

    @BeforeEach
    void setUp() {
        simulatedMatchingEngine = mock(SimulatedMatchingEngine.class);
        exitController = mock(ExitController.class);
        positionLedger = mock(PositionLedger.class);
        candleAggregator = mock(CandleAggregator.class);
        emaCrossoverStrategy = mock(EmaCrossoverStrategy.class);
        orderExecutionController = mock(OrderExecutionController.class);
        marketClock = mock(MarketClock.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        router = new MarketDataRouter(
                Optional.of(simulatedMatchingEngine),
                exitController,
                positionLedger,
                candleAggregator,
                emaCrossoverStrategy,
                orderExecutionController,
                marketClock,
                new SignalConfig(),
                eventPublisher,
                Runnable::run);
    }

    private static TickEvent tick(long token, String price) {
        return new TickEvent(MarketDataRouterTest.class, Tick.builder()
                .instrumentToken(token)
                .lastPrice(new BigDecimal(price))
                .build());
    }

    private static Candle candle() {
        return Candle.builder().instrumentToken(NIFTY).close(new BigDecimal("24010")).build();
    }

    @Nested
    @DisplayName("Ticks")
    class Ticks {

        @Test
        @DisplayName("Feeds option ticks to matching, exits and the ledger only")
        void optionTick() {
            TickEvent event = tick(OPTION, "101");

            router.onTick(event);

            verify(simulatedMatchingEngine).onTick(event.getTick());
            verify(exitController).onTick(event.getTick());
            verify(positionLedger).markToMarket(OPTION, new BigDecimal("101"));
            verify(candleAggregator, never()).onTick(any());
        }

        @Test
        @DisplayName("Publishes a candle close from underlying ticks")
        void underlyingTick() {
            Candle candle = candle();
            when(candleAggregator.onTick(any(Tick.class))).thenReturn(Optional.of(candle));

            router.onTick(tick(NIFTY, "24010"));

            verify(eventPublisher).publishEvent(any(CandleCloseEvent.class));
        }

        @Test
        @DisplayName("Keeps aggregating candles when tick processing fails")
        void tickFailure() {
            doThrow(new IllegalStateException("boom")).when(simulatedMatchingEngine).onTick(any());
            when(candleAggregator.onTick(any(Tick.class))).thenReturn(Optional.empty());

            router.onTick(tick(NIFTY, "24010"));

            verify(candleAggregator).onTick(any(Tick.class));
        }
    }

    @Nested
    @DisplayName("Candles and signals")
    class CandlesAndSignals {

        @Test
        @DisplayName("Adjusts stops but skips the strategy while the market is closed")
        void marketClosed() {
            when(marketClock.isMarketOpen()).thenReturn(false);
            Candle candle = candle();

            router.onCandleClose(new CandleCloseEvent(this, candle));

            verify(exitController).onCandleClose(candle);
            verify(emaCrossoverStrategy, never()).onCandle(any());
        }

        @Test
        @DisplayName("Publishes the strategy signal with the candle close as spot")
        void signalPublished() {
            when(marketClock.isMarketOpen()).thenReturn(true);
            Candle candle = candle();
            when(emaCrossoverStrategy.onCandle(candle)).thenReturn(Optional.of(Signal.BUY_CE));

            router.onCandleClose(new CandleCloseEvent(this, candle));

            verify(exitController).onCandleClose(candle);
            verify(eventPublisher).publishEvent(any(SignalEvent.class));
        }

        @Test
        @DisplayName("Executes signals on the signal executor")
        void signalExecuted() {
            router.onSignal(new SignalEvent(this, Signal.BUY_PE, new BigDecimal("24010")));

            verify(orderExecutionController).onSignal(Signal.BUY_PE, new BigDecimal("24010"));
        }
    }
}
