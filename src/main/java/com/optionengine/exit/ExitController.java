package com.optionengine.exit;

import com.optionengine.broker.Broker;
import com.optionengine.calendar.MarketClock;
import com.optionengine.domain.enums.ExitReason;
import com.optionengine.domain.enums.OrderSide;
import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.enums.OrderType;
import com.optionengine.domain.enums.TradeType;
import com.optionengine.domain.model.AggregatePosition;
import com.optionengine.domain.model.Candle;
import com.optionengine.domain.model.Contract;
import com.optionengine.domain.model.ExitState;
import com.optionengine.domain.model.OpenPosition;
import com.optionengine.domain.model.Order;
import com.optionengine.domain.model.OrderRequest;
import com.optionengine.domain.model.Tick;
import com.optionengine.domain.model.TradeRecord;
import com.optionengine.event.OrderPlacedEvent;
import com.optionengine.event.PositionClosedEvent;
import com.optionengine.event.RiskEvent;
import com.optionengine.event.RiskEventType;
import com.optionengine.event.RiskLevel;
import com.optionengine.exception.BrokerException;
import com.optionengine.exception.InvalidStateException;
import com.optionengine.ledger.PositionLedger;
import com.optionengine.ledger.PositionStore;
import com.optionengine.oms.ClientOrderIds;
import com.optionengine.oms.OrderExecutionController;
import com.optionengine.risk.CapitalRiskGovernor;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Owns every filled position from registration until exit.
 *
 * <p>Initial levels: {@code SL = entry * (1 - sl%/100)} and {@code TP = entry * (1 + tp%/100)},
 * with a null TP when target exits are disabled. Hard stops are checked on every tick in
 * software mode; with broker orders enabled, a resting STOP SELL and LIMIT SELL do the work
 * and their fills come back through {@link #onExitOrderFilled}.
 *
 * <p>Stop adjustments run on candle close, in priority order:
 * <ol>
 *   <li>breakeven: once profit reaches the trigger, the stop moves up to the original entry
 *       and the latch stays set for the life of the position;</li>
 *   <li>trailing: only while breakeven is not engaged, the stop is raised towards
 *       {@code ltp * (1 - sl%/100)}; it is never lowered.</li>
 * </ol>
 *
 * <p>Every exit path funnels into {@link #exitPosition}, which claims the position by
 * removing its state; a second caller finds nothing and returns false.
 */
@Service
public class ExitController {

    private static final Logger log = LoggerFactory.getLogger(ExitController.class);

    private static final int LEVEL_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Broker broker;
    private final OrderExecutionController orderExecutionController;
    private final CapitalRiskGovernor capitalRiskGovernor;
    private final PositionLedger positionLedger;
    private final PositionStore positionStore;
    private final ExitConfig exitConfig;
    private final MarketClock marketClock;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /** Tracked positions keyed by entry order id. */
    private final Map<String, ExitState> states = new ConcurrentHashMap<>();

    /** Resting broker SL/TP order id to the entry order it protects. */
    private final Map<String, String> brokerOrderOwners = new ConcurrentHashMap<>();

    /** MARKET SELL orders placed by exits, so their fills are not mistaken for entries. */
    private final Set<String> exitOrderIds = ConcurrentHashMap.newKeySet();

    public ExitController(
            Broker broker,
            OrderExecutionController orderExecutionController,
            CapitalRiskGovernor capitalRiskGovernor,
            PositionLedger positionLedger,
            PositionStore positionStore,
            ExitConfig exitConfig,
            MarketClock marketClock,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.broker = broker;
        this.orderExecutionController = orderExecutionController;
        this.capitalRiskGovernor = capitalRiskGovernor;
        this.positionLedger = positionLedger;
        this.positionStore = positionStore;
        this.exitConfig = exitConfig;
        this.marketClock = marketClock;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    // ---- Registration ----

    /**
     * Starts tracking a filled position, or refreshes quantity and entry of one already
     * tracked.
     *
     * @throws InvalidStateException if the position has no positive entry price
     */
    public void registerPosition(OpenPosition position) {
        BigDecimal entry = position.getAveragePrice();
        if (entry == null || entry.signum() <= 0) {
            throw new InvalidStateException(
                    "Cannot register " + position.getOrderId() + " without a positive entry price",
                    Map.of("orderId", position.getOrderId(), "entryPrice", String.valueOf(entry)));
        }

        ExitState existing = states.get(position.getOrderId());
        if (existing != null) {
            refresh(existing, position.getFilledQuantity(), entry);
            return;
        }

        ExitState state = ExitState.builder()
                .orderId(position.getOrderId())
                .contract(position.getContract())
                .quantity(position.getFilledQuantity())
                .entryPrice(entry)
                .originalEntryPrice(entry)
                .slPrice(initialStop(entry))
                .tpPrice(initialTarget(entry))
                .highestPrice(entry)
                .lowestPrice(entry)
                .build();
        if (states.putIfAbsent(state.getOrderId(), state) != null) {
            refresh(states.get(state.getOrderId()), position.getFilledQuantity(), entry);
            return;
        }
        log.info(
                "Registered {} {} x{} entry={} sl={} tp={}",
                state.getOrderId(),
                state.getContract().getSymbol(),
                state.getQuantity(),
                entry,
                state.getSlPrice(),
                state.getTpPrice() != null ? state.getTpPrice() : "off");

        if (exitConfig.isUseBrokerSlOrders()) {
            synchronized (state) {
                placeBrokerExitOrders(state);
            }
        }
    }

    private void refresh(ExitState state, int quantity, BigDecimal entry) {
        synchronized (state) {
            if (!states.containsKey(state.getOrderId())) {
                return;
            }
            state.setQuantity(quantity);
            state.setEntryPrice(entry);
            state.setOriginalEntryPrice(entry);
            if (!state.isBreakevenEngaged()) {
                state.setSlPrice(state.getSlPrice().max(initialStop(entry)));
            }
            state.setTpPrice(initialTarget(entry));
            log.info(
                    "Refreshed {}: qty={} entry={} sl={} tp={}",
                    state.getOrderId(),
                    quantity,
                    entry,
                    state.getSlPrice(),
                    state.getTpPrice());
            if (state.isBrokerOrdersActive()) {
                cancelBrokerExitOrders(state);
                placeBrokerExitOrders(state);
            }
        }
    }

    // ---- Market data ----

    /** Hard stop and target checks. Software mode only; broker orders handle their own. */
    public void onTick(Tick tick) {
        BigDecimal ltp = tick.getLastPrice();
        if (ltp == null || ltp.signum() <= 0) {
            return;
        }
        for (ExitState state : new ArrayList<>(states.values())) {
            if (state.getContract().getInstrumentToken() != tick.getInstrumentToken()) {
                continue;
            }
            ExitReason reason = null;
            synchronized (state) {
                state.observe(ltp);
                if (state.isBrokerOrdersActive()) {
                    continue;
                }
                if (ltp.compareTo(state.getSlPrice()) <= 0) {
                    reason = ExitReason.SL;
                } else if (state.getTpPrice() != null && ltp.compareTo(state.getTpPrice()) >= 0) {
                    reason = ExitReason.TP;
                }
            }
            if (reason != null) {
                log.info("{} hit for {} at {}", reason, state.getOrderId(), ltp);
                exitPosition(state.getOrderId(), ltp, reason);
            }
        }
    }

    /** Breakeven and trailing adjustments, once per closed candle. */
    public void onCandleClose(Candle candle) {
        for (ExitState state : new ArrayList<>(states.values())) {
            try {
                adjustStop(state);
            } catch (RuntimeException e) {
                log.error("Stop adjustment failed for {}: {}", state.getOrderId(), e.getMessage(), e);
            }
        }
    }

    private void adjustStop(ExitState state) {
        BigDecimal ltp = broker.getLtp(state.getContract());
        if (ltp == null || ltp.signum() <= 0) {
            return;
        }
        synchronized (state) {
            if (!states.containsKey(state.getOrderId())) {
                return;
            }
            state.observe(ltp);
            BigDecimal before = state.getSlPrice();

            if (exitConfig.isBreakevenEnabled() && !state.isBreakevenEngaged()) {
                BigDecimal original = state.getOriginalEntryPrice();
                BigDecimal profitPct = ltp.subtract(original).divide(original, MathContext.DECIMAL64).multiply(HUNDRED);
                if (profitPct.compareTo(exitConfig.effectiveBreakevenTriggerPercent()) >= 0) {
                    state.setSlPrice(state.getSlPrice().max(original));
                    state.setBreakevenEngaged(true);
                    log.info("Breakeven engaged for {}: stop {} at profit {}%", state.getOrderId(), state.getSlPrice(), profitPct);
                }
            }

            if (exitConfig.isTrailingSl() && !state.isBreakevenEngaged()) {
                BigDecimal trailed = stopBelow(ltp);
                if (trailed.compareTo(state.getSlPrice()) > 0) {
                    state.setSlPrice(trailed);
                    log.debug("Trailing stop for {} raised to {}", state.getOrderId(), trailed);
                }
            }

            if (state.getSlPrice().compareTo(before) != 0 && state.isBrokerOrdersActive()) {
                BigDecimal reference = state.getLastBrokerStopPrice();
                BigDecimal changePct = state.getSlPrice()
                        .subtract(reference)
                        .abs()
                        .divide(reference, MathContext.DECIMAL64)
                        .multiply(HUNDRED);
                if (changePct.compareTo(exitConfig.getSlUpdateThresholdPercent()) >= 0) {
                    replaceBrokerStop(state);
                }
            }
        }
    }

    // ---- Time based ----

    /** Squares off every position with a known price once the square-off time is reached. */
    @Scheduled(fixedDelayString = "${engine.exit.squareoff-check-interval:1000}")
    public void checkSquareoff() {
        if (states.isEmpty() || !marketClock.isSquareoffTime()) {
            return;
        }
        for (ExitState state : new ArrayList<>(states.values())) {
            BigDecimal ltp = lastPrice(state);
            if (ltp != null && ltp.signum() > 0) {
                log.info("Square-off {} at {}", state.getOrderId(), ltp);
                exitPosition(state.getOrderId(), ltp, ExitReason.SQUAREOFF);
            }
        }
    }

    /**
     * Exits every tracked position at its LTP, or at its entry price when no LTP is known.
     *
     * @return the number of positions exited
     */
    public int closeAllPositions(ExitReason reason) {
        int closed = 0;
        for (ExitState state : new ArrayList<>(states.values())) {
            BigDecimal price = lastPrice(state);
            if (price == null || price.signum() <= 0) {
                log.warn("No LTP for {}, closing at entry price {}", state.getOrderId(), state.getEntryPrice());
                price = state.getEntryPrice();
            }
            if (exitPosition(state.getOrderId(), price, reason)) {
                closed++;
            }
        }
        log.info("Closed {} position(s) with reason {}", closed, reason);
        return closed;
    }

    /** LTP from the broker, or null when the lookup fails. */
    private BigDecimal lastPrice(ExitState state) {
        try {
            return broker.getLtp(state.getContract());
        } catch (RuntimeException e) {
            log.warn("LTP lookup failed for {}: {}", state.getOrderId(), e.getMessage());
            return null;
        }
    }

    // ---- Broker callbacks ----

    public boolean ownsOrder(String orderId) {
        return brokerOrderOwners.containsKey(orderId) || exitOrderIds.contains(orderId);
    }

    /** A resting SL or TP order filled at the broker. */
    public void onExitOrderFilled(String exitOrderId, BigDecimal fillPrice) {
        if (exitOrderIds.remove(exitOrderId)) {
            log.debug("Exit order {} filled at {}", exitOrderId, fillPrice);
            return;
        }
        String owner = brokerOrderOwners.remove(exitOrderId);
        if (owner == null) {
            return;
        }
        ExitState state = states.get(owner);
        if (state == null) {
            log.debug("Broker exit {} filled after {} was already closed", exitOrderId, owner);
            return;
        }
        ExitReason reason = exitOrderId.equals(state.getStopOrderId()) ? ExitReason.SL : ExitReason.TP;
        log.info("Broker {} order {} filled at {} for {}", reason, exitOrderId, fillPrice, owner);
        exit(owner, fillPrice, reason, true);
    }

    /** A resting SL or TP order was rejected: the position falls back to software monitoring. */
    public void onExitOrderRejected(String exitOrderId, String reason) {
        if (exitOrderIds.remove(exitOrderId)) {
            log.error("Exit order {} rejected: {}", exitOrderId, reason);
            return;
        }
        String owner = brokerOrderOwners.remove(exitOrderId);
        ExitState state = owner != null ? states.get(owner) : null;
        if (state == null) {
            return;
        }
        synchronized (state) {
            log.warn("Broker exit order {} for {} rejected ({}), monitoring in software", exitOrderId, owner, reason);
            cancelBrokerExitOrders(state);
        }
    }

    // ---- Exit ----

    /**
     * Exits a tracked position. Idempotent.
     *
     * @return true if this call performed the exit
     */
    public boolean exitPosition(String orderId, BigDecimal exitPrice, ExitReason reason) {
        return exit(orderId, exitPrice, reason, false);
    }

    private boolean exit(String orderId, BigDecimal exitPrice, ExitReason reason, boolean filledAtBroker) {
        ExitState state = states.remove(orderId);
        if (state == null) {
            return false;
        }

        Contract contract;
        int quantity;
        synchronized (state) {
            contract = state.getContract();
            quantity = state.getQuantity();
        }

        String exitOrderId = filledAtBroker
                ? (reason == ExitReason.SL ? state.getStopOrderId() : state.getTargetOrderId())
                : placeExitOrder(state, quantity);

        BigDecimal entryPrice = resolveEntryPrice(state, exitPrice);
        BigDecimal pnl = exitPrice.subtract(entryPrice).multiply(BigDecimal.valueOf(quantity));

        try {
            positionLedger.applyExitFill(contract, exitOrderId != null ? exitOrderId : orderId, quantity, exitPrice, reason);
        } catch (RuntimeException e) {
            log.error("Ledger exit failed for {}: {}", orderId, e.getMessage(), e);
        }
        recordTrade(TradeRecord.builder()
                .id(UUID.randomUUID().toString())
                .orderId(orderId)
                .tradeType(TradeType.EXIT)
                .fillNumber(1)
                .symbol(contract.getSymbol())
                .side(OrderSide.SELL)
                .quantity(quantity)
                .price(exitPrice)
                .entryPrice(entryPrice)
                .pnl(pnl)
                .exitReason(reason)
                .executedAt(LocalDateTime.now(clock))
                .build());

        try {
            orderExecutionController.onOrderExit(orderId, quantity, entryPrice);
        } catch (RuntimeException e) {
            log.error("Execution release failed for {}: {}", orderId, e.getMessage(), e);
        }
        try {
            capitalRiskGovernor.onPositionClosed(orderId, exitPrice, quantity, entryPrice);
        } catch (RuntimeException e) {
            log.error("Risk booking failed for {}: {}", orderId, e.getMessage(), e);
        }

        cancelRemainingBrokerOrders(state, filledAtBroker ? reason : null);

        log.info(
                "EXIT {} {} x{} reason={} entry={} exit={} pnl={}",
                orderId,
                contract.getSymbol(),
                quantity,
                reason,
                entryPrice,
                exitPrice,
                pnl);
        applicationEventPublisher.publishEvent(
                new PositionClosedEvent(this, orderId, contract.getSymbol(), reason, quantity, exitPrice, pnl));
        return true;
    }

    private String placeExitOrder(ExitState state, int quantity) {
        String exitOrderId = ClientOrderIds.next();
        OrderRequest request = OrderRequest.builder()
                .clientOrderId(exitOrderId)
                .contract(state.getContract())
                .side(OrderSide.SELL)
                .type(OrderType.MARKET)
                .quantity(quantity)
                .build();
        exitOrderIds.add(exitOrderId);
        try {
            broker.placeOrder(request);
            recordOrder(request);
            applicationEventPublisher.publishEvent(new OrderPlacedEvent(
                    this, exitOrderId, state.getContract().getSymbol(), OrderSide.SELL, OrderType.MARKET, quantity));
            return exitOrderId;
        } catch (BrokerException e) {
            exitOrderIds.remove(exitOrderId);
            log.error("Exit order for {} failed, closing books anyway: {}", state.getOrderId(), e.getMessage());
            return null;
        }
    }

    /**
     * Entry price for PnL: exit state, then the original entry, then the execution
     * controller, then the ledger aggregate. The exit price is the last resort and books
     * zero PnL.
     */
    private BigDecimal resolveEntryPrice(ExitState state, BigDecimal exitPrice) {
        if (isPositive(state.getEntryPrice())) {
            return state.getEntryPrice();
        }
        if (isPositive(state.getOriginalEntryPrice())) {
            return state.getOriginalEntryPrice();
        }
        Optional<BigDecimal> fromExecution = orderExecutionController
                .findPosition(state.getOrderId())
                .map(OpenPosition::getAveragePrice)
                .filter(this::isPositive);
        if (fromExecution.isPresent()) {
            return fromExecution.get();
        }
        Optional<BigDecimal> fromLedger = positionLedger
                .findOpen(state.getContract().getSymbol())
                .map(AggregatePosition::getAverageEntryPrice)
                .filter(this::isPositive);
        if (fromLedger.isPresent()) {
            return fromLedger.get();
        }

        log.error("No entry price for {}, using exit price {} (PnL booked as zero)", state.getOrderId(), exitPrice);
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.ENTRY_PRICE_FALLBACK,
                RiskLevel.WARNING,
                "Entry price unavailable at exit",
                Map.of("orderId", state.getOrderId(), "exitPrice", exitPrice)));
        return exitPrice;
    }

    // ---- Broker-side exit orders ----

    private void placeBrokerExitOrders(ExitState state) {
        List<String> placed = new ArrayList<>();
        try {
            String stopId = placeRestingOrder(state, OrderType.STOP, state.getSlPrice());
            placed.add(stopId);
            state.setStopOrderId(stopId);
            state.setLastBrokerStopPrice(state.getSlPrice());

            if (state.getTpPrice() != null) {
                String targetId = placeRestingOrder(state, OrderType.LIMIT, state.getTpPrice());
                placed.add(targetId);
                state.setTargetOrderId(targetId);
            }
            state.setBrokerOrdersActive(true);
            log.info("Broker exits resting for {}: stop={} target={}", state.getOrderId(), state.getStopOrderId(), state.getTargetOrderId());
        } catch (BrokerException e) {
            log.warn("Broker exit orders failed for {}, monitoring in software: {}", state.getOrderId(), e.getMessage());
            placed.forEach(this::cancelQuietly);
            state.setStopOrderId(null);
            state.setTargetOrderId(null);
            state.setBrokerOrdersActive(false);
        }
    }

    private String placeRestingOrder(ExitState state, OrderType type, BigDecimal level) {
        String orderId = ClientOrderIds.next();
        OrderRequest request = OrderRequest.builder()
                .clientOrderId(orderId)
                .contract(state.getContract())
                .side(OrderSide.SELL)
                .type(type)
                .quantity(state.getQuantity())
                .price(type == OrderType.LIMIT ? level : null)
                .triggerPrice(type == OrderType.STOP ? level : null)
                .build();
        brokerOrderOwners.put(orderId, state.getOrderId());
        try {
            broker.placeOrder(request);
        } catch (BrokerException e) {
            brokerOrderOwners.remove(orderId);
            throw e;
        }
        recordOrder(request);
        applicationEventPublisher.publishEvent(new OrderPlacedEvent(
                this, orderId, state.getContract().getSymbol(), OrderSide.SELL, type, state.getQuantity()));
        return orderId;
    }

    private void replaceBrokerStop(ExitState state) {
        String oldStop = state.getStopOrderId();
        cancelQuietly(oldStop);
        try {
            String newStop = placeRestingOrder(state, OrderType.STOP, state.getSlPrice());
            state.setStopOrderId(newStop);
            state.setLastBrokerStopPrice(state.getSlPrice());
            log.info("Broker stop for {} moved to {} ({} -> {})", state.getOrderId(), state.getSlPrice(), oldStop, newStop);
        } catch (BrokerException e) {
            log.warn("Stop replace failed for {}, monitoring in software: {}", state.getOrderId(), e.getMessage());
            state.setStopOrderId(null);
            cancelQuietly(state.getTargetOrderId());
            state.setTargetOrderId(null);
            state.setBrokerOrdersActive(false);
        }
    }

    private void cancelBrokerExitOrders(ExitState state) {
        cancelQuietly(state.getStopOrderId());
        cancelQuietly(state.getTargetOrderId());
        state.setStopOrderId(null);
        state.setTargetOrderId(null);
        state.setBrokerOrdersActive(false);
    }

    /** Cancels the resting orders that did not cause the exit. */
    private void cancelRemainingBrokerOrders(ExitState state, ExitReason filledReason) {
        if (filledReason != ExitReason.SL) {
            cancelQuietly(state.getStopOrderId());
        }
        if (filledReason != ExitReason.TP) {
            cancelQuietly(state.getTargetOrderId());
        }
    }

    private void cancelQuietly(String orderId) {
        if (orderId == null) {
            return;
        }
        brokerOrderOwners.remove(orderId);
        try {
            if (!broker.cancelOrder(orderId)) {
                log.debug("Broker exit order {} no longer pending", orderId);
            }
        } catch (RuntimeException e) {
            log.debug("Cancel of {} lost the race: {}", orderId, e.getMessage());
        }
    }

    // ---- Queries ----

    public Optional<ExitState> findState(String orderId) {
        ExitState state = states.get(orderId);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.of(copy(state));
        }
    }

    public int trackedCount() {
        return states.size();
    }

    // ---- Helpers ----

    private BigDecimal initialStop(BigDecimal entry) {
        return stopBelow(entry);
    }

    private BigDecimal stopBelow(BigDecimal price) {
        return price.multiply(BigDecimal.ONE.subtract(exitConfig.getSlPercent().movePointLeft(2)))
                .setScale(LEVEL_SCALE, RoundingMode.HALF_UP);
    }

    private BigDecimal initialTarget(BigDecimal entry) {
        if (!exitConfig.isTpExitEnabled()) {
            return null;
        }
        return entry.multiply(BigDecimal.ONE.add(exitConfig.getTpPercent().movePointLeft(2)))
                .setScale(LEVEL_SCALE, RoundingMode.HALF_UP);
    }

    private boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private ExitState copy(ExitState state) {
        return ExitState.builder()
                .orderId(state.getOrderId())
                .contract(state.getContract())
                .quantity(state.getQuantity())
                .entryPrice(state.getEntryPrice())
                .originalEntryPrice(state.getOriginalEntryPrice())
                .slPrice(state.getSlPrice())
                .tpPrice(state.getTpPrice())
                .highestPrice(state.getHighestPrice())
                .lowestPrice(state.getLowestPrice())
                .breakevenEngaged(state.isBreakevenEngaged())
                .stopOrderId(state.getStopOrderId())
                .targetOrderId(state.getTargetOrderId())
                .lastBrokerStopPrice(state.getLastBrokerStopPrice())
                .brokerOrdersActive(state.isBrokerOrdersActive())
                .build();
    }

    private void recordOrder(OrderRequest request) {
        try {
            positionStore.recordOrder(Order.builder()
                    .id(request.getClientOrderId())
                    .contract(request.getContract())
                    .side(request.getSide())
                    .type(request.getType())
                    .quantity(request.getQuantity())
                    .price(request.getPrice())
                    .triggerPrice(request.getTriggerPrice())
                    .status(OrderStatus.PENDING)
                    .placedAt(LocalDateTime.now(clock))
                    .updatedAt(LocalDateTime.now(clock))
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to record exit order {}: {}", request.getClientOrderId(), e.getMessage());
        }
    }

    private void recordTrade(TradeRecord tradeRecord) {
        try {
            positionStore.recordTrade(tradeRecord);
        } catch (RuntimeException e) {
            log.error("Failed to record exit trade for {}: {}", tradeRecord.getOrderId(), e.getMessage());
        }
    }
}
