package com.optionengine.oms;

import com.optionengine.broker.Broker;
import com.optionengine.domain.enums.OrderSide;
import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.enums.OrderType;
import com.optionengine.domain.enums.Signal;
import com.optionengine.domain.enums.TradeType;
import com.optionengine.domain.model.Contract;
import com.optionengine.domain.model.OpenPosition;
import com.optionengine.domain.model.Order;
import com.optionengine.domain.model.OrderRequest;
import com.optionengine.domain.model.TradeRecord;
import com.optionengine.event.OrderFillEvent;
import com.optionengine.event.OrderPlacedEvent;
import com.optionengine.exception.BrokerException;
import com.optionengine.exception.PriceUnavailableException;
import com.optionengine.exception.StaleCancelRaceException;
import com.optionengine.ledger.PositionLedger;
import com.optionengine.ledger.PositionStore;
import com.optionengine.marketdata.MarketDataFeed;
import com.optionengine.risk.CapitalRiskGovernor;
import com.optionengine.signal.ContractSelector;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Turns entry signals into broker orders and tracks each entry order until its position
 * is exited.
 *
 * <p>Order state machine: {@code PENDING -> PARTIAL* -> FILLED}, or
 * {@code PENDING -> CANCELLED | REJECTED}. Fill events carry cumulative quantity and average
 * price; only the delta beyond what was already pushed to the ledger is applied, so replayed
 * or reordered events are harmless.
 *
 * <p>{@link #onSignal} blocks while it waits for a first price. Callers run it off the tick
 * thread.
 */
@Service
public class OrderExecutionController {

    private static final Logger log = LoggerFactory.getLogger(OrderExecutionController.class);

    private static final int LIMIT_PRICE_SCALE = 2;
    private static final int FILL_PRICE_SCALE = 6;

    private final Broker broker;
    private final CapitalRiskGovernor capitalRiskGovernor;
    private final ContractSelector contractSelector;
    private final MarketDataFeed marketDataFeed;
    private final PositionLedger positionLedger;
    private final PositionStore positionStore;
    private final OrderTimeoutWatchdog orderTimeoutWatchdog;
    private final ExecutionConfig executionConfig;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /** Entry orders keyed by client order id. */
    private final Map<String, OpenPosition> positions = new ConcurrentHashMap<>();

    public OrderExecutionController(
            Broker broker,
            CapitalRiskGovernor capitalRiskGovernor,
            ContractSelector contractSelector,
            MarketDataFeed marketDataFeed,
            PositionLedger positionLedger,
            PositionStore positionStore,
            OrderTimeoutWatchdog orderTimeoutWatchdog,
            ExecutionConfig executionConfig,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.broker = broker;
        this.capitalRiskGovernor = capitalRiskGovernor;
        this.contractSelector = contractSelector;
        this.marketDataFeed = marketDataFeed;
        this.positionLedger = positionLedger;
        this.positionStore = positionStore;
        this.orderTimeoutWatchdog = orderTimeoutWatchdog;
        this.executionConfig = executionConfig;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    // ---- Signal intake ----

    /**
     * Places an entry order for the signal.
     *
     * @return the client order id, or empty if the signal was dropped
     */
    public Optional<String> onSignal(Signal signal, BigDecimal spotPrice) {
        if (!executionConfig.isTradingEnabled()) {
            log.warn("Trading disabled, ignoring signal {}", signal);
            return Optional.empty();
        }
        if (signal == null) {
            log.warn("Unrecognized signal, ignoring");
            return Optional.empty();
        }
        if (!capitalRiskGovernor.canTakeNewTrade()) {
            log.warn("Risk governor blocked signal {}", signal);
            return Optional.empty();
        }

        Contract contract;
        try {
            contract = contractSelector.select(signal, spotPrice).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Contract selection failed for {} at spot {}: {}", signal, spotPrice, e.getMessage());
            return Optional.empty();
        }
        if (contract == null) {
            log.warn("No contract found for {} at spot {}", signal, spotPrice);
            return Optional.empty();
        }
        log.info("Selected {} for {} at spot {}", contract.getSymbol(), signal, spotPrice);

        try {
            subscribe(contract);
            BigDecimal ltp = awaitLtp(contract);
            return placeEntry(signal, contract, ltp);
        } catch (PriceUnavailableException e) {
            log.warn("Dropping {}: {}", signal, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while preparing entry for {}", contract.getSymbol());
            return Optional.empty();
        }
    }

    private void subscribe(Contract contract) throws InterruptedException {
        try {
            marketDataFeed.subscribe(contract.getInstrumentToken());
        } catch (RuntimeException e) {
            log.warn("Subscribe failed for {}: {}", contract.getSymbol(), e.getMessage());
        }
        pause(executionConfig.getSubscribeSettle());
    }

    private BigDecimal awaitLtp(Contract contract) throws InterruptedException {
        int attempts = executionConfig.getLtpRetries();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            BigDecimal ltp = broker.getLtp(contract);
            if (ltp != null && ltp.signum() > 0) {
                log.info("LTP for {} after {} attempt(s): {}", contract.getSymbol(), attempt, ltp);
                return ltp;
            }
            if (attempt < attempts) {
                pause(executionConfig.getLtpRetryInterval());
            }
        }
        throw new PriceUnavailableException(contract.getSymbol(), attempts);
    }

    private Optional<String> placeEntry(Signal signal, Contract contract, BigDecimal ltp) {
        int quantity = capitalRiskGovernor.sizeOrder(ltp, contract.getLotSize());
        if (quantity <= 0) {
            log.warn(
                    "Sized quantity {} for {} @ {} (capital {}), dropping signal",
                    quantity,
                    contract.getSymbol(),
                    ltp,
                    capitalRiskGovernor.availableCapital());
            return Optional.empty();
        }

        OrderType orderType = executionConfig.getOrderType();
        BigDecimal limitPrice = orderType == OrderType.LIMIT
                ? ltp.multiply(BigDecimal.ONE.add(
                                executionConfig.getPriceTolerancePct().movePointLeft(2)))
                        .setScale(LIMIT_PRICE_SCALE, RoundingMode.HALF_UP)
                : null;

        String orderId = ClientOrderIds.next();
        LocalDateTime placedAt = LocalDateTime.now(clock);
        OpenPosition position = OpenPosition.builder()
                .orderId(orderId)
                .contract(contract)
                .signal(signal)
                .orderType(orderType)
                .requestedQuantity(quantity)
                .status(OrderStatus.PENDING)
                .limitPrice(limitPrice)
                .placedAt(placedAt)
                .build();
        OrderRequest request = OrderRequest.builder()
                .clientOrderId(orderId)
                .contract(contract)
                .side(OrderSide.BUY)
                .type(orderType)
                .quantity(quantity)
                .price(limitPrice)
                .build();

        // Registered before placement: a synchronous fill callback must find it.
        positions.put(orderId, position);
        recordOrder(request, OrderStatus.PENDING, placedAt, null);

        log.info("Placing {} BUY {} x{} ltp={} limit={} ({})", orderType, contract.getSymbol(), quantity, ltp, limitPrice, orderId);
        try {
            broker.placeOrder(request);
        } catch (BrokerException e) {
            log.error("Entry order {} rejected by broker: {}", orderId, e.getMessage());
            positions.remove(orderId);
            recordOrder(request, OrderStatus.REJECTED, placedAt, e.getMessage());
            return Optional.empty();
        }
        applicationEventPublisher.publishEvent(
                new OrderPlacedEvent(this, orderId, contract.getSymbol(), OrderSide.BUY, orderType, quantity));

        OpenPosition current = positions.get(orderId);
        if (orderType == OrderType.LIMIT && current != null && !isFilled(current)) {
            orderTimeoutWatchdog.watch(orderId, contract, limitPrice, placedAt, this::onEntryCancelled);
        }
        return Optional.of(orderId);
    }

    // ---- Broker callbacks ----

    /**
     * Applies the new part of a cumulative fill report.
     *
     * @return a snapshot of the position when a delta was applied, empty for replays and
     *     unknown orders
     */
    public Optional<OpenPosition> onOrderFilled(OrderFillEvent event) {
        String orderId = event.getOrderId();
        OpenPosition position = positions.get(orderId);
        if (position == null) {
            log.warn("Fill for unknown order {} ({} @ {}), ignoring", orderId, event.getFilledQuantity(), event.getFillPrice());
            return Optional.empty();
        }

        int delta;
        BigDecimal deltaPrice;
        int fillNumber;
        OpenPosition snapshot;
        synchronized (position) {
            int cumulative = event.getFilledQuantity();
            delta = cumulative - position.getAppliedQuantity();
            if (delta <= 0) {
                log.debug("Fill for {} at {} already applied ({}), ignoring", orderId, cumulative, position.getAppliedQuantity());
                return Optional.empty();
            }
            BigDecimal cumulativeNotional = event.getFillPrice().multiply(BigDecimal.valueOf(cumulative));
            deltaPrice = cumulativeNotional
                    .subtract(position.getAppliedNotional())
                    .divide(BigDecimal.valueOf(delta), FILL_PRICE_SCALE, RoundingMode.HALF_UP);
            if (deltaPrice.signum() <= 0) {
                deltaPrice = event.getFillPrice();
            }

            position.setAppliedQuantity(cumulative);
            position.setAppliedNotional(cumulativeNotional);
            position.setFilledQuantity(cumulative);
            position.setAveragePrice(event.getFillPrice());
            position.setFillCount(position.getFillCount() + 1);
            if (position.getStatus() != OrderStatus.CANCELLED) {
                position.setStatus(cumulative >= position.getRequestedQuantity() ? OrderStatus.FILLED : OrderStatus.PARTIAL);
            }
            fillNumber = position.getFillCount();
            snapshot = position.getExitedQuantity() > 0 ? remainderOf(position) : position.snapshot();
        }

        Contract contract = snapshot.getContract();
        log.info(
                "Entry fill {} #{}: +{} @ {} -> {}/{} avg={} {}",
                orderId,
                fillNumber,
                delta,
                deltaPrice,
                snapshot.getFilledQuantity(),
                snapshot.getRequestedQuantity(),
                snapshot.getAveragePrice(),
                snapshot.getStatus());

        positionLedger.applyEntryFill(contract, orderId, delta, deltaPrice);
        recordTrade(TradeRecord.builder()
                .id(UUID.randomUUID().toString())
                .orderId(orderId)
                .tradeType(TradeType.ENTRY)
                .fillNumber(fillNumber)
                .symbol(contract.getSymbol())
                .side(OrderSide.BUY)
                .quantity(delta)
                .price(deltaPrice)
                .executedAt(LocalDateTime.now(clock))
                .build());
        recordOrder(snapshot);

        if (snapshot.getStatus() == OrderStatus.FILLED) {
            orderTimeoutWatchdog.stop(orderId);
        }
        capitalRiskGovernor.onPositionOpened(orderId, snapshot);
        return Optional.of(snapshot);
    }

    /** A rejection after submission. Removes the position when nothing was filled. */
    public void onOrderRejected(String orderId, String reason) {
        OpenPosition position = positions.get(orderId);
        if (position == null) {
            log.debug("Rejection for untracked order {}: {}", orderId, reason);
            return;
        }
        orderTimeoutWatchdog.stop(orderId);
        synchronized (position) {
            if (position.getFilledQuantity() > 0) {
                log.warn("Order {} rejected after {} filled, keeping position: {}", orderId, position.getFilledQuantity(), reason);
                return;
            }
            position.setStatus(OrderStatus.REJECTED);
        }
        positions.remove(orderId);
        log.warn("Entry order {} rejected: {}", orderId, reason);
        recordOrder(position.snapshot());
    }

    /**
     * The exit controller closed {@code quantity} of the position at an entry cost of
     * {@code entryPrice}. A remainder still working at the broker is cancelled; the position
     * stays tracked until then so that a fill racing the cancel reaches the ledger and is
     * registered for exits again.
     */
    public void onOrderExit(String orderId, int quantity, BigDecimal entryPrice) {
        orderTimeoutWatchdog.stop(orderId);
        OpenPosition position = positions.get(orderId);
        if (position == null) {
            return;
        }
        boolean remainderWorking;
        int held;
        synchronized (position) {
            position.setExitedQuantity(position.getExitedQuantity() + quantity);
            position.setExitedNotional(
                    position.getExitedNotional().add(entryPrice.multiply(BigDecimal.valueOf(quantity))));
            remainderWorking = (position.getStatus() == OrderStatus.PENDING || position.getStatus() == OrderStatus.PARTIAL)
                    && position.getFilledQuantity() < position.getRequestedQuantity();
            held = position.heldQuantity();
        }
        if (remainderWorking) {
            cancelRemainder(position);
        } else if (held <= 0) {
            positions.remove(orderId);
            log.debug("Position {} released after exit", orderId);
        }
    }

    private void cancelRemainder(OpenPosition position) {
        String orderId = position.getOrderId();
        try {
            if (!broker.cancelOrder(orderId)) {
                throw new StaleCancelRaceException(orderId);
            }
            synchronized (position) {
                position.setStatus(OrderStatus.CANCELLED);
            }
            log.info("Cancelled unfilled remainder of {} after exit", orderId);
            recordOrder(position.snapshot());
        } catch (StaleCancelRaceException e) {
            log.info("Remainder of {} completed before the cancel, late fills will be re-registered", orderId);
        } catch (RuntimeException e) {
            log.error("Could not cancel remainder of {}, late fills will be re-registered: {}", orderId, e.getMessage(), e);
        }
    }

    void onEntryCancelled(String orderId) {
        OpenPosition position = positions.get(orderId);
        if (position == null) {
            return;
        }
        boolean remove;
        synchronized (position) {
            position.setStatus(OrderStatus.CANCELLED);
            remove = position.getFilledQuantity() == 0;
        }
        if (remove) {
            positions.remove(orderId);
            log.info("Entry {} cancelled unfilled, position removed", orderId);
        } else {
            log.info("Entry {} cancelled with {} filled, keeping position", orderId, position.getFilledQuantity());
        }
        recordOrder(position.snapshot());
    }

    // ---- Queries ----

    public Optional<OpenPosition> findPosition(String orderId) {
        OpenPosition position = positions.get(orderId);
        if (position == null) {
            return Optional.empty();
        }
        synchronized (position) {
            return Optional.of(position.snapshot());
        }
    }

    /** Entry orders that are still pending or hold an unexited quantity. */
    public List<OpenPosition> openPositions() {
        return positions.values().stream()
                .map(position -> {
                    synchronized (position) {
                        return position.snapshot();
                    }
                })
                .filter(position -> position.getExitedQuantity() == 0 || position.heldQuantity() > 0)
                .toList();
    }

    // ---- Helpers ----

    /** Snapshot of the part of a partly exited position that is still held, at its own entry cost. */
    private OpenPosition remainderOf(OpenPosition position) {
        int held = position.heldQuantity();
        BigDecimal average = position.getAppliedNotional()
                .subtract(position.getExitedNotional())
                .divide(BigDecimal.valueOf(held), FILL_PRICE_SCALE, RoundingMode.HALF_UP);
        if (average.signum() <= 0) {
            average = position.getAveragePrice();
        }
        log.warn("Late fill for exited order {}: {} held at {}, registering for exit", position.getOrderId(), held, average);
        return position.toBuilder()
                .filledQuantity(held)
                .averagePrice(average)
                .exitedQuantity(0)
                .exitedNotional(BigDecimal.ZERO)
                .build();
    }

    private boolean isFilled(OpenPosition position) {
        synchronized (position) {
            return position.getStatus() == OrderStatus.FILLED;
        }
    }

    private void pause(Duration duration) throws InterruptedException {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    }

    private void recordOrder(OrderRequest request, OrderStatus status, LocalDateTime placedAt, String reason) {
        recordOrder(Order.builder()
                .id(request.getClientOrderId())
                .contract(request.getContract())
                .side(request.getSide())
                .type(request.getType())
                .quantity(request.getQuantity())
                .price(request.getPrice())
                .status(status)
                .rejectionReason(reason)
                .placedAt(placedAt)
                .updatedAt(LocalDateTime.now(clock))
                .build());
    }

    private void recordOrder(OpenPosition position) {
        recordOrder(Order.builder()
                .id(position.getOrderId())
                .contract(position.getContract())
                .side(OrderSide.BUY)
                .type(position.getOrderType())
                .quantity(position.getRequestedQuantity())
                .price(position.getLimitPrice())
                .status(position.getStatus())
                .filledQuantity(position.getFilledQuantity())
                .averageFillPrice(position.getAveragePrice())
                .placedAt(position.getPlacedAt())
                .updatedAt(LocalDateTime.now(clock))
                .build());
    }

    private void recordOrder(Order order) {
        try {
            positionStore.recordOrder(order);
        } catch (RuntimeException e) {
            log.error("Failed to record order {}: {}", order.getId(), e.getMessage());
        }
    }

    private void recordTrade(TradeRecord tradeRecord) {
        try {
            positionStore.recordTrade(tradeRecord);
        } catch (RuntimeException e) {
            log.error("Failed to record trade for {}: {}", tradeRecord.getOrderId(), e.getMessage());
        }
    }
}
