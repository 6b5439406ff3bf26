package com.optionengine.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.optionengine.domain.enums.OrderSide;
import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.enums.OrderType;
import com.optionengine.domain.model.Contract;
import com.optionengine.domain.model.OrderRequest;
import com.optionengine.domain.model.Tick;
import com.optionengine.event.OrderFillEvent;
import com.optionengine.event.OrderRejectedEvent;
import com.optionengine.simulator.SimulatedMatchingEngine;
import com.optionengine.simulator.SimulatorConfig;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

class SimulatedMatchingEngineTest {

    private static final Contract CONTRACT = Contract.builder()
            .symbol("NIFTY24D1924000CE")
            .exchange("NFO")
            .instrumentToken(1001L)
            .lotSize(25)
            .build();

    private ApplicationEventPublisher applicationEventPublisher;
    private TaskScheduler taskScheduler;
    private Random random;
    private SimulatorConfig simulatorConfig;
    private SimulatedMatchingEngine engine;
    private int sequence;

    @BeforeEach
    void setUp() {
        applicationEventPublisher = mock(ApplicationEventPublisher.class);
        taskScheduler = mock(TaskScheduler.class);
        random = mock(Random.class);
        when(random.nextInt(3)).thenReturn(2);
        when(random.nextDouble()).thenReturn(0.5);

        simulatorConfig = new SimulatorConfig();
        simulatorConfig.setStartingCapital(new BigDecimal("100000"));
        simulatorConfig.setSliceThreshold(50);
        simulatorConfig.setLimitCheckCount(3);
        simulatorConfig.setLimitCheckInterval(Duration.ofSeconds(1));

        engine = newEngine();
    }

    private SimulatedMatchingEngine newEngine() {
        Clock clock = Clock.fixed(Instant.parse("2024-12-16T05:00:00Z"), ZoneId.of("Asia/Kolkata"));
        return new SimulatedMatchingEngine(
                applicationEventPublisher, simulatorConfig, taskScheduler, Runnable::run, random, clock);
    }

    private String place(OrderSide side, OrderType type, int quantity, String price) {
        sequence++;
        return engine.placeOrder(OrderRequest.builder()
                .clientOrderId("OX" + sequence)
                .contract(CONTRACT)
                .side(side)
                .type(type)
                .quantity(quantity)
                .price(price != null ? new BigDecimal(price) : null)
                .triggerPrice(type == OrderType.STOP && price != null ? new BigDecimal(price) : null)
                .build());
    }

    private void tick(String price) {
        engine.onTick(Tick.builder()
                .instrumentToken(CONTRACT.getInstrumentToken())
                .lastPrice(new BigDecimal(price))
                .build());
    }

    private List<Object> publishedEvents() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(applicationEventPublisher, atLeastOnce()).publishEvent(captor.capture());
        return captor.getAllValues();
    }

    private List<OrderFillEvent> fillEvents() {
        return publishedEvents().stream()
                .filter(OrderFillEvent.class::isInstance)
                .map(OrderFillEvent.class::cast)
                .toList();
    }

    @Nested
    @DisplayName("MARKET orders")
    class MarketOrders {

        @Test
        @DisplayName("Small BUY fills in one slice at the LTP")
        void smallBuySingleSlice() {
            tick("100");

            String orderId = place(OrderSide.BUY, OrderType.MARKET, 25, null);

            assertThat(engine.getOrderStatus(orderId)).isEqualTo(OrderStatus.FILLED);
            assertThat(engine.getFilledQuantity(orderId)).isEqualTo(25);
            assertThat(engine.getAverageFillPrice(orderId)).isEqualByComparingTo("100");
            assertThat(engine.getAccountBalance()).isEqualByComparingTo("97500");
            assertThat(engine.getHolding(CONTRACT.getInstrumentToken())).isEqualTo(25);

            List<OrderFillEvent> fills = fillEvents();
            assertThat(fills).hasSize(1);
            assertThat(fills.get(0).getFilledQuantity()).isEqualTo(25);
            assertThat(fills.get(0).isPartial()).isFalse();
        }

        @Test
        @DisplayName("Large BUY fills in several slices with cumulative events")
        void largeBuySliced() {
            tick("100");

            String orderId = place(OrderSide.BUY, OrderType.MARKET, 100, null);

            // 3 slices: 50, 25, 25
            List<OrderFillEvent> fills = fillEvents();
            assertThat(fills).extracting(OrderFillEvent::getFilledQuantity).containsExactly(50, 75, 100);
            assertThat(fills).extracting(OrderFillEvent::isPartial).containsExactly(true, true, false);
            assertThat(engine.getOrderStatus(orderId)).isEqualTo(OrderStatus.FILLED);
            assertThat(engine.getAccountBalance()).isEqualByComparingTo("90000");
        }

        @Test
        @DisplayName("BUY stops at the cash limit and stays PARTIAL")
        void cashLimitedBuy() {
            simulatorConfig.setStartingCapital(new BigDecimal("6000"));
            engine = newEngine();
            tick("100");

            String orderId = place(OrderSide.BUY, OrderType.MARKET, 100, null);

            assertThat(engine.getFilledQuantity(orderId)).isEqualTo(50);
            assertThat(engine.getOrderStatus(orderId)).isEqualTo(OrderStatus.PARTIAL);
            List<OrderFillEvent> fills = fillEvents();
            assertThat(fills).hasSize(1);
            assertThat(fills.get(0).isPartial()).isTrue();
            assertThat(engine.getAccountBalance()).isEqualByComparingTo("1000");
        }

        @Test
        @DisplayName("BUY with no affordable slice is rejected")
        void rejectedWhenNoCash() {
            simulatorConfig.setStartingCapital(new BigDecimal("10"));
            engine = newEngine();
            tick("100");

            String orderId = place(OrderSide.BUY, OrderType.MARKET, 25, null);

            assertThat(engine.getOrderStatus(orderId)).isEqualTo(OrderStatus.REJECTED);
            assertThat(publishedEvents()).hasAtLeastOneElementOfType(OrderRejectedEvent.class);
            assertThat(engine.getOrder(orderId).getRejectionReason()).contains("Insufficient cash");
        }

        @Test
        @DisplayName("Order without a known price waits for the first tick")
        void awaitsFirstPrice() {
            String orderId = place(OrderSide.BUY, OrderType.MARKET, 25, null);

            assertThat(engine.getOrderStatus(orderId)).isEqualTo(OrderStatus.PENDING);
            verify(applicationEventPublisher, never()).publishEvent(any(Object.class));

            tick("80");

            assertThat(engine.getOrderStatus(orderId)).isEqualTo(OrderStatus.FILLED);
            assertThat(engine.getAverageFillPrice(orderId)).isEqualByComparingTo("80");
        }

        @Test
        @DisplayName("SELL fills whole at the LTP and credits cash")
        void sellCreditsCash() {
            tick("100");
            place(OrderSide.BUY, OrderType.MARKET, 25, null);
            tick("120");

            String sellId = place(OrderSide.SELL, OrderType.MARKET, 25, null);

            assertThat(engine.getOrderStatus(sellId)).isEqualTo(OrderStatus.FILLED);
            assertThat(engine.getAccountBalance()).isEqualByComparingTo("100500");
            assertThat(engine.getHolding(CONTRACT.getInstrumentToken())).isZero();
        }
    }

    @Nested
    @DisplayName("LIMIT orders")
    class LimitOrders {

        @Test
        @DisplayName("BUY rests above the market and fills when the price drops to the limit")
        void restsUntilFavourable() {
            tick("100");

            String orderId = place(OrderSide.BUY, OrderType.LIMIT, 25, "95");

            assertThat(engine.getOrderStatus(orderId)).isEqualTo(OrderStatus.PENDING);
            verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));

            tick("94");

            assertThat(engine.getOrderStatus(orderId)).isEqualTo(OrderStatus.FILLED);
            assertThat(engine.getAverageFillPrice(orderId)).isEqualByComparingTo("94");
        }

        @Test
        @DisplayName("Fills immediately when already favourable")
        void immediateFill() {
            tick("90");

            String orderId = place(OrderSide.BUY, OrderType.LIMIT, 25, "95");

            assertThat(engine.getOrderStatus(orderId)).isEqualTo(OrderStatus.FILLED);
            assertThat(engine.getAverageFillPrice(orderId)).isEqualByComparingTo("90");
            verify(taskScheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
        }

        @Test
        @DisplayName("Does not fill without a known price")
        void noPriceNoFill() {
            String orderId = place(OrderSide.BUY, OrderType.LIMIT, 25, "95");

            assertThat(engine.getOrderStatus(orderId)).isEqualTo(OrderStatus.PENDING);
        }

        @Test
        @DisplayName("Monitor cancels the order once its checks run out")
        void monitorCancels() {
            tick("100");
            String orderId = place(OrderSide.BUY, OrderType.LIMIT, 25, "95");

            ArgumentCaptor<Runnable> monitor = ArgumentCaptor.forClass(Runnable.class);
            verify(taskScheduler).scheduleAtFixedRate(monitor.capture(), any(Duration.class));
            monitor.getValue().run();
            monitor.getValue().run();
            assertThat(engine.getOrderStatus(orderId)).isEqualTo(OrderStatus.PENDING);

            monitor.getValue().run();

            assertThat(engine.getOrderStatus(orderId)).isEqualTo(OrderStatus.CANCELLED);
        }
    }

    @Nested
    @DisplayName("STOP orders")
    class StopOrders {

        @Test
        @DisplayName("SELL triggers at or below the trigger and fills at the LTP")
        void sellStopTriggers() {
            tick("100");
            String stopId = place(OrderSide.SELL, OrderType.STOP, 25, "95");

            tick("96");
            assertThat(engine.getOrderStatus(stopId)).isEqualTo(OrderStatus.PENDING);

            tick("94.50");
            assertThat(engine.getOrderStatus(stopId)).isEqualTo(OrderStatus.FILLED);
            assertThat(engine.getAverageFillPrice(stopId)).isEqualByComparingTo("94.50");
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Cancels a resting order once")
        void cancelOnce() {
            String stopId = place(OrderSide.SELL, OrderType.STOP, 25, "95");

            assertThat(engine.cancelOrder(stopId)).isTrue();
            assertThat(engine.cancelOrder(stopId)).isFalse();
            assertThat(engine.getOrderStatus(stopId)).isEqualTo(OrderStatus.CANCELLED);

            tick("90");
            assertThat(engine.getOrderStatus(stopId)).isEqualTo(OrderStatus.CANCELLED);
        }

        @Test
        @DisplayName("Filled and unknown orders cannot be cancelled")
        void cannotCancelFilled() {
            tick("100");
            String orderId = place(OrderSide.BUY, OrderType.MARKET, 25, null);

            assertThat(engine.cancelOrder(orderId)).isFalse();
            assertThat(engine.cancelOrder("missing")).isFalse();
            assertThat(engine.getOrderStatus("missing")).isEqualTo(OrderStatus.PENDING);
        }
    }

    @Test
    @DisplayName("Reset restores the starting capital and clears the books")
    void reset() {
        tick("100");
        place(OrderSide.BUY, OrderType.MARKET, 25, null);

        engine.reset();

        assertThat(engine.getAccountBalance()).isEqualByComparingTo("100000");
        assertThat(engine.getLtp(CONTRACT)).isEqualByComparingTo("0");
        assertThat(engine.getHolding(CONTRACT.getInstrumentToken())).isZero();
    }
}
