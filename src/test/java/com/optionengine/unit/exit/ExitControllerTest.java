package com.optionengine.unit.exit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.optionengine.broker.Broker;
import com.optionengine.calendar.MarketClock;
import com.optionengine.domain.enums.ExitReason;
import com.optionengine.domain.enums.OptionType;
import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.enums.OrderType;
import com.optionengine.domain.model.Candle;
import com.optionengine.domain.model.Contract;
import com.optionengine.domain.model.ExitState;
import com.optionengine.domain.model.OpenPosition;
import com.optionengine.domain.model.OrderRequest;
import com.optionengine.domain.model.Tick;
import com.optionengine.event.PositionClosedEvent;
import com.optionengine.exception.BrokerException;
import com.optionengine.exception.InvalidStateException;
import com.optionengine.exit.ExitConfig;
import com.optionengine.exit.ExitController;
import com.optionengine.ledger.PositionLedger;
import com.optionengine.ledger.PositionStore;
import com.optionengine.oms.OrderExecutionController;
import com.optionengine.risk.CapitalRiskGovernor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

class ExitControllerTest {

    private static final String ORDER_ID = "OX0000000000000001";

    private static final Contract CONTRACT = Contract.builder()
            .symbol("NIFTY24D1924000CE")
            .exchange("NFO")
            .instrumentToken(1001L)
            .lotSize(25)
            .optionType(OptionType.CE)
            .strike(new BigDecimal("24000"))
            .build();

    private static final String SECOND_ORDER_ID = "OX0000000000000002";

    private static final Contract SECOND_CONTRACT = Contract.builder()
            .symbol("NIFTY24D1924000PE")
            .exchange("NFO")
            .instrumentToken(1002L)
            .lotSize(25)
            .optionType(OptionType.PE)
            .strike(new BigDecimal("24000"))
            .build();

    private Broker broker;
    private OrderExecutionController orderExecutionController;
    private CapitalRiskGovernor capitalRiskGovernor;
    private PositionLedger positionLedger;
    private PositionStore positionStore;
    private MarketClock marketClock;
    private ApplicationEventPublisher eventPublisher;
    private ExitConfig exitConfig;
    private ExitController exitController;

    @BeforeEach
    void setUp() {
        broker = mock(Broker.class);
        orderExecutionController = mock(OrderExecutionController.class);
        capitalRiskGovernor = mock(CapitalRiskGovernor.class);
        positionLedger = mock(PositionLedger.class);
        positionStore = mock(PositionStore.class);
        marketClock = mock(MarketClock.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        exitConfig = new ExitConfig();

        Clock clock = Clock.fixed(Instant.parse("2024-12-16T05:00:00Z"), ZoneId.of("Asia/Kolkata"));
        exitController = new ExitController(
                broker,
                orderExecutionController,
                capitalRiskGovernor,
                positionLedger,
                positionStore,
                exitConfig,
                marketClock,
                eventPublisher,
                clock);

        when(broker.placeOrder(any(OrderRequest.class)))
                .thenAnswer(invocation -> invocation.getArgument(0, OrderRequest.class).getClientOrderId());
    }

    private OpenPosition filled(String averagePrice, int quantity) {
        return OpenPosition.builder()
                .orderId(ORDER_ID)
                .contract(CONTRACT)
                .orderType(OrderType.MARKET)
                .requestedQuantity(50)
                .filledQuantity(quantity)
                .averagePrice(new BigDecimal(averagePrice))
                .status(quantity >= 50 ? OrderStatus.FILLED : OrderStatus.PARTIAL)
                .build();
    }

    private OpenPosition secondPosition() {
        return OpenPosition.builder()
                .orderId(SECOND_ORDER_ID)
                .contract(SECOND_CONTRACT)
                .orderType(OrderType.MARKET)
                .requestedQuantity(25)
                .filledQuantity(25)
                .averagePrice(new BigDecimal("80"))
                .status(OrderStatus.FILLED)
                .build();
    }

    private Tick tick(String price) {
        return Tick.builder().instrumentToken(1001L).lastPrice(new BigDecimal(price)).build();
    }

    private Candle candle() {
        return Candle.builder().instrumentToken(256265L).close(new BigDecimal("24050")).build();
    }

    private ExitState state() {
        return exitController.findState(ORDER_ID).orElseThrow();
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Derives stop and target from the entry price")
        void initialLevels() {
            exitController.registerPosition(filled("100", 50));

            assertThat(state().getSlPrice()).isEqualByComparingTo("95.00");
            assertThat(state().getTpPrice()).isEqualByComparingTo("110.00");
            assertThat(exitController.trackedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Leaves the target unset when target exits are disabled")
        void targetDisabled() {
            exitConfig.setTpExitEnabled(false);

            exitController.registerPosition(filled("100", 50));

            assertThat(state().getTpPrice()).isNull();
        }

        @Test
        @DisplayName("Rejects a position without a positive entry price")
        void requiresEntryPrice() {
            assertThatThrownBy(() -> exitController.registerPosition(filled("0", 50)))
                    .isInstanceOf(InvalidStateException.class);
            assertThat(exitController.trackedCount()).isZero();
        }

        @Test
        @DisplayName("Refreshes quantity and entry on a later fill")
        void refreshOnFill() {
            exitController.registerPosition(filled("100", 30));
            exitController.registerPosition(filled("104", 50));

            assertThat(state().getQuantity()).isEqualTo(50);
            assertThat(state().getEntryPrice()).isEqualByComparingTo("104");
            assertThat(state().getSlPrice()).isEqualByComparingTo("98.80");
            assertThat(exitController.trackedCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Tick checks")
    class TickChecks {

        @Test
        @DisplayName("Exits at the stop")
        void stopLoss() {
            exitController.registerPosition(filled("100", 50));

            exitController.onTick(tick("95"));

            assertThat(exitController.trackedCount()).isZero();
            verify(capitalRiskGovernor).onPositionClosed(eq(ORDER_ID), argThat(p -> p.compareTo(new BigDecimal("95")) == 0), eq(50), argThat(p -> p.compareTo(new BigDecimal("100")) == 0));
            verify(positionLedger).applyExitFill(eq(CONTRACT), anyString(), eq(50), any(BigDecimal.class), eq(ExitReason.SL));
            verify(orderExecutionController).onOrderExit(eq(ORDER_ID), eq(50), argThat(p -> p.compareTo(new BigDecimal("100")) == 0));
        }

        @Test
        @DisplayName("Exits at the target with a MARKET SELL")
        void target() {
            exitController.registerPosition(filled("100", 50));

            exitController.onTick(tick("110.50"));

            ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
            verify(broker).placeOrder(captor.capture());
            assertThat(captor.getValue().getType()).isEqualTo(OrderType.MARKET);
            assertThat(captor.getValue().getQuantity()).isEqualTo(50);
            ArgumentCaptor<ApplicationEvent> events = ArgumentCaptor.forClass(ApplicationEvent.class);
            verify(eventPublisher, atLeastOnce()).publishEvent(events.capture());
            PositionClosedEvent closed = events.getAllValues().stream()
                    .filter(PositionClosedEvent.class::isInstance)
                    .map(PositionClosedEvent.class::cast)
                    .findFirst()
                    .orElseThrow();
            assertThat(closed.getReason()).isEqualTo(ExitReason.TP);
            assertThat(closed.getPnl()).isEqualByComparingTo("525");
        }

        @Test
        @DisplayName("Ignores prices between the levels and other instruments")
        void noExit() {
            exitController.registerPosition(filled("100", 50));

            exitController.onTick(tick("101"));
            exitController.onTick(Tick.builder().instrumentToken(2002L).lastPrice(new BigDecimal("1")).build());

            assertThat(exitController.trackedCount()).isEqualTo(1);
            assertThat(state().getHighestPrice()).isEqualByComparingTo("101");
        }

        @Test
        @DisplayName("Books the exit even when the exit order fails")
        void exitOrderFailure() {
            when(broker.placeOrder(any(OrderRequest.class)))
                    .thenThrow(new BrokerException("down"));
            exitController.registerPosition(filled("100", 50));

            exitController.onTick(tick("90"));

            assertThat(exitController.trackedCount()).isZero();
            verify(capitalRiskGovernor).onPositionClosed(eq(ORDER_ID), any(), eq(50), any());
        }
    }

    @Nested
    @DisplayName("Candle adjustments")
    class CandleAdjustments {

        @Test
        @DisplayName("Trails the stop upwards and exits on the trailed stop")
        void trailing() {
            exitConfig.setTrailingSl(true);
            exitController.registerPosition(filled("100", 50));
            when(broker.getLtp(CONTRACT)).thenReturn(new BigDecimal("120"));

            exitController.onCandleClose(candle());
            assertThat(state().getSlPrice()).isEqualByComparingTo("114.00");

            exitController.onTick(tick("113"));

            assertThat(exitController.trackedCount()).isZero();
            verify(capitalRiskGovernor).onPositionClosed(eq(ORDER_ID), argThat(p -> p.compareTo(new BigDecimal("113")) == 0), eq(50), argThat(p -> p.compareTo(new BigDecimal("100")) == 0));
        }

        @Test
        @DisplayName("Never lowers a trailed stop")
        void trailingNeverLowers() {
            exitConfig.setTrailingSl(true);
            exitConfig.setTpExitEnabled(false);
            exitController.registerPosition(filled("100", 50));
            when(broker.getLtp(CONTRACT)).thenReturn(new BigDecimal("120"), new BigDecimal("116"));

            exitController.onCandleClose(candle());
            exitController.onCandleClose(candle());

            assertThat(state().getSlPrice()).isEqualByComparingTo("114.00");
        }

        @Test
        @DisplayName("Moves the stop to entry once breakeven triggers, then stops trailing")
        void breakeven() {
            exitConfig.setBreakevenEnabled(true);
            exitConfig.setTrailingSl(true);
            exitConfig.setTpExitEnabled(false);
            exitController.registerPosition(filled("100", 50));
            when(broker.getLtp(CONTRACT)).thenReturn(new BigDecimal("111"), new BigDecimal("130"));

            exitController.onCandleClose(candle());
            assertThat(state().isBreakevenEngaged()).isTrue();
            assertThat(state().getSlPrice()).isEqualByComparingTo("100");

            exitController.onCandleClose(candle());
            assertThat(state().getSlPrice()).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("Leaves the stop alone without trailing or breakeven")
        void staticStop() {
            exitController.registerPosition(filled("100", 50));
            when(broker.getLtp(CONTRACT)).thenReturn(new BigDecimal("150"));

            exitController.onCandleClose(candle());

            assertThat(state().getSlPrice()).isEqualByComparingTo("95.00");
        }
    }

    @Nested
    @DisplayName("Broker-side exit orders")
    class BrokerExitOrders {

        @Test
        @DisplayName("Rests a STOP and a LIMIT SELL and exits when the stop fills")
        void restingOrders() {
            exitConfig.setUseBrokerSlOrders(true);
            exitController.registerPosition(filled("100", 50));

            ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
            verify(broker, times(2)).placeOrder(captor.capture());
            List<OrderRequest> requests = captor.getAllValues();
            OrderRequest stop = requests.get(0);
            OrderRequest target = requests.get(1);
            assertThat(stop.getType()).isEqualTo(OrderType.STOP);
            assertThat(stop.getTriggerPrice()).isEqualByComparingTo("95.00");
            assertThat(target.getType()).isEqualTo(OrderType.LIMIT);
            assertThat(target.getPrice()).isEqualByComparingTo("110.00");
            assertThat(exitController.ownsOrder(stop.getClientOrderId())).isTrue();

            exitController.onTick(tick("94"));
            assertThat(exitController.trackedCount()).isEqualTo(1);

            exitController.onExitOrderFilled(stop.getClientOrderId(), new BigDecimal("94.50"));

            assertThat(exitController.trackedCount()).isZero();
            verify(broker).cancelOrder(target.getClientOrderId());
            verify(broker, never()).cancelOrder(stop.getClientOrderId());
            verify(positionLedger).applyExitFill(eq(CONTRACT), eq(stop.getClientOrderId()), eq(50), any(BigDecimal.class), eq(ExitReason.SL));
        }

        @Test
        @DisplayName("Falls back to software monitoring when a resting order is rejected")
        void rejectedRestingOrder() {
            exitConfig.setUseBrokerSlOrders(true);
            exitController.registerPosition(filled("100", 50));
            String stopId = state().getStopOrderId();

            exitController.onExitOrderRejected(stopId, "trigger price out of range");

            assertThat(state().isBrokerOrdersActive()).isFalse();
            exitController.onTick(tick("95"));
            assertThat(exitController.trackedCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Exit paths")
    class ExitPaths {

        @Test
        @DisplayName("Claims an exit only once")
        void exitOnce() {
            exitController.registerPosition(filled("100", 50));

            assertThat(exitController.exitPosition(ORDER_ID, new BigDecimal("105"), ExitReason.SL)).isTrue();
            assertThat(exitController.exitPosition(ORDER_ID, new BigDecimal("105"), ExitReason.SL)).isFalse();

            verify(capitalRiskGovernor, times(1)).onPositionClosed(anyString(), any(), anyInt(), any());
        }

        @Test
        @DisplayName("Squares off at the configured time")
        void squareoff() {
            exitController.registerPosition(filled("100", 50));
            when(marketClock.isSquareoffTime()).thenReturn(true);
            when(broker.getLtp(CONTRACT)).thenReturn(new BigDecimal("105"));

            exitController.checkSquareoff();

            verify(positionLedger).applyExitFill(eq(CONTRACT), anyString(), eq(50), any(BigDecimal.class), eq(ExitReason.SQUAREOFF));
        }

        @Test
        @DisplayName("Does nothing before the square-off time")
        void beforeSquareoff() {
            exitController.registerPosition(filled("100", 50));
            when(marketClock.isSquareoffTime()).thenReturn(false);

            exitController.checkSquareoff();

            assertThat(exitController.trackedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Close-all uses the entry price when no LTP is known")
        void closeAllWithoutPrice() {
            exitController.registerPosition(filled("100", 50));
            when(broker.getLtp(CONTRACT)).thenReturn(BigDecimal.ZERO);

            assertThat(exitController.closeAllPositions(ExitReason.SYSTEM_SHUTDOWN)).isEqualTo(1);

            verify(capitalRiskGovernor).onPositionClosed(eq(ORDER_ID), argThat(p -> p.compareTo(new BigDecimal("100")) == 0), eq(50), any());
        }
    
        @Test
        @DisplayName("Close-all books every position when LTP lookups fail")
        void closeAllWithFailingLtp() {
            exitController.registerPosition(filled("100", 50));
            exitController.registerPosition(secondPosition());
            when(broker.getLtp(any(Contract.class))).thenThrow(new BrokerException("LTP fetch failed: timeout"));

            assertThat(exitController.closeAllPositions(ExitReason.SYSTEM_SHUTDOWN)).isEqualTo(2);

            assertThat(exitController.trackedCount()).isZero();
            verify(capitalRiskGovernor).onPositionClosed(eq(ORDER_ID), argThat(p -> p.compareTo(new BigDecimal("100")) == 0), eq(50), any());
            verify(capitalRiskGovernor).onPositionClosed(eq(SECOND_ORDER_ID), argThat(p -> p.compareTo(new BigDecimal("80")) == 0), eq(25), any());
        }

        @Test
        @DisplayName("Square-off skips a position whose LTP lookup fails until the next run")
        void squareoffWithFailingLtp() {
            exitController.registerPosition(filled("100", 50));
            exitController.registerPosition(secondPosition());
            when(marketClock.isSquareoffTime()).thenReturn(true);
            when(broker.getLtp(CONTRACT)).thenThrow(new BrokerException("LTP fetch failed: timeout"));
            when(broker.getLtp(SECOND_CONTRACT)).thenReturn(new BigDecimal("82"));

            exitController.checkSquareoff();

            assertThat(exitController.findState(ORDER_ID)).isPresent();
            assertThat(exitController.findState(SECOND_ORDER_ID)).isEmpty();
            verify(positionLedger).applyExitFill(eq(SECOND_CONTRACT), anyString(), eq(25), any(BigDecimal.class), eq(ExitReason.SQUAREOFF));
        }
    }
}
