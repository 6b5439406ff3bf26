package com.optionengine.simulator;

import com.optionengine.broker.Broker;
import com.optionengine.domain.enums.OrderSide;
import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.enums.OrderType;
import com.optionengine.domain.model.Contract;
import com.optionengine.domain.model.Fill;
import com.optionengine.domain.model.Order;
import com.optionengine.domain.model.OrderRequest;
import com.optionengine.domain.model.Tick;
import com.optionengine.event.OrderFillEvent;
import com.optionengine.event.OrderRejectedEvent;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Paper-trading {@link Broker} that matches orders in memory against the tick stream.
 *
 * <p>Keeps a cash balance, simulated holdings per instrument, an LTP cache and three pending
 * books: MARKET orders awaiting a first price, LIMIT orders and STOP orders. Matching rules:
 * <ul>
 *   <li>MARKET BUY: fills immediately in 1 to 3 randomized slices (several only at or above
 *       the slice threshold), each perturbed by up to 1% in price. Stops early when cash
 *       runs out; nothing filled means REJECTED, less than requested means PARTIAL.</li>
 *   <li>MARKET SELL: fills the whole quantity at the LTP and credits cash.</li>
 *   <li>LIMIT BUY: fills at the LTP once LTP &lt;= limit. LIMIT SELL: once LTP &gt;= limit.
 *       A monitor task cancels the order when its check window expires.</li>
 *   <li>STOP SELL: triggers at LTP &lt;= trigger. STOP BUY: at LTP &gt;= trigger. Fills at the
 *       LTP.</li>
 * </ul>
 *
 * <p>Removal from a pending book is the claim on an order, so at most one fill path fires
 * per order. Fill events carry the cumulative quantity and average price and are published
 * on the fill callback executor; listener exceptions are logged.
 */
@Service
@ConditionalOnProperty(name = "engine.mode", havingValue = "PAPER", matchIfMissing = true)
public class SimulatedMatchingEngine implements Broker {

    private static final Logger log = LoggerFactory.getLogger(SimulatedMatchingEngine.class);

    private static final int PRICE_SCALE = 2;
    private static final int AVERAGE_SCALE = 6;

    private final ApplicationEventPublisher applicationEventPublisher;
    private final SimulatorConfig simulatorConfig;
    private final TaskScheduler taskScheduler;
    private final Executor fillCallbackExecutor;
    private final Random random;
    private final Clock clock;

    private final Object cashLock = new Object();
    private BigDecimal balance;

    private final Map<String, Order> orders = new ConcurrentHashMap<>();
    private final Map<String, List<Fill>> fills = new ConcurrentHashMap<>();
    private final Map<Long, BigDecimal> ltpCache = new ConcurrentHashMap<>();

    /** Net simulated holdings per instrument token. */
    private final Map<Long, Integer> holdings = new ConcurrentHashMap<>();

    private final Map<String, Order> awaitingPrice = new ConcurrentHashMap<>();
    private final Map<String, Order> limitOrders = new ConcurrentHashMap<>();
    private final Map<String, Order> stopOrders = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> limitMonitors = new ConcurrentHashMap<>();

    @Autowired
    public SimulatedMatchingEngine(
            ApplicationEventPublisher applicationEventPublisher,
            SimulatorConfig simulatorConfig,
            TaskScheduler taskScheduler,
            @Qualifier("fillCallbackExecutor") Executor fillCallbackExecutor,
            Clock clock) {
        this(
                applicationEventPublisher,
                simulatorConfig,
                taskScheduler,
                fillCallbackExecutor,
                simulatorConfig.getRandomSeed() != null ? new Random(simulatorConfig.getRandomSeed()) : new Random(),
                clock);
    }

    public SimulatedMatchingEngine(
            ApplicationEventPublisher applicationEventPublisher,
            SimulatorConfig simulatorConfig,
            TaskScheduler taskScheduler,
            Executor fillCallbackExecutor,
            Random random,
            Clock clock) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.simulatorConfig = simulatorConfig;
        this.taskScheduler = taskScheduler;
        this.fillCallbackExecutor = fillCallbackExecutor;
        this.random = random;
        this.clock = clock;
        this.balance = simulatorConfig.getStartingCapital();
        log.info("Paper broker active with starting capital {}", balance);
    }

    // ---- Orders ----

    @Override
    public String placeOrder(OrderRequest request) {
        Contract contract = request.getContract();
        LocalDateTime now = LocalDateTime.now(clock);
        Order order = Order.builder()
                .id(request.getClientOrderId())
                .contract(contract)
                .side(request.getSide())
                .type(request.getType())
                .quantity(request.getQuantity())
                .price(request.getPrice())
                .triggerPrice(request.getTriggerPrice())
                .status(OrderStatus.PENDING)
                .placedAt(now)
                .updatedAt(now)
                .build();
        orders.put(order.getId(), order);
        fills.put(order.getId(), new CopyOnWriteArrayList<>());

        BigDecimal ltp = ltpCache.getOrDefault(contract.getInstrumentToken(), BigDecimal.ZERO);

        switch (order.getType()) {
            case MARKET -> {
                if (ltp.signum() <= 0) {
                    awaitingPrice.put(order.getId(), order);
                    log.debug("Paper MARKET order {} queued until a price for {} arrives", order.getId(), contract.getSymbol());
                } else {
                    executeMarket(order, ltp);
                }
            }
            case LIMIT -> {
                limitOrders.put(order.getId(), order);
                if (!tryFillLimit(order, ltp)) {
                    startLimitMonitor(order);
                }
            }
            case STOP -> stopOrders.put(order.getId(), order);
        }

        log.info(
                "Paper order placed: {} {} {} {} qty={} price={} trigger={}",
                order.getId(),
                order.getSide(),
                order.getType(),
                contract.getSymbol(),
                order.getQuantity(),
                order.getPrice(),
                order.getTriggerPrice());
        return order.getId();
    }

    @Override
    public boolean cancelOrder(String orderId) {
        Order order = awaitingPrice.remove(orderId);
        if (order == null) {
            order = limitOrders.remove(orderId);
        }
        if (order == null) {
            order = stopOrders.remove(orderId);
        }
        stopLimitMonitor(orderId);
        if (order == null) {
            return false;
        }
        synchronized (order) {
            order.setStatus(OrderStatus.CANCELLED);
            order.setUpdatedAt(LocalDateTime.now(clock));
        }
        log.info("Paper order cancelled: {}", orderId);
        return true;
    }

    @Override
    public OrderStatus getOrderStatus(String orderId) {
        Order order = orders.get(orderId);
        return order != null ? order.getStatus() : OrderStatus.PENDING;
    }

    // ---- Market data ----

    /**
     * Updates the LTP cache, then evaluates the awaiting-price, limit and stop books for the
     * tick's instrument.
     */
    public void onTick(Tick tick) {
        BigDecimal ltp = tick.getLastPrice();
        if (ltp == null || ltp.signum() <= 0) {
            return;
        }
        long token = tick.getInstrumentToken();
        ltpCache.put(token, ltp);

        for (Order order : new ArrayList<>(awaitingPrice.values())) {
            if (order.getContract().getInstrumentToken() == token && awaitingPrice.remove(order.getId()) != null) {
                executeMarket(order, ltp);
            }
        }
        for (Order order : new ArrayList<>(limitOrders.values())) {
            if (order.getContract().getInstrumentToken() == token) {
                tryFillLimit(order, ltp);
            }
        }
        for (Order order : new ArrayList<>(stopOrders.values())) {
            if (order.getContract().getInstrumentToken() == token && isStopTriggered(order, ltp)
                    && stopOrders.remove(order.getId()) != null) {
                log.info("Paper STOP {} triggered at {} (trigger {})", order.getId(), ltp, order.getTriggerPrice());
                executeAtPrice(order, ltp);
            }
        }
    }

    @Override
    public BigDecimal getLtp(Contract contract) {
        return ltpCache.getOrDefault(contract.getInstrumentToken(), BigDecimal.ZERO);
    }

    // ---- Account ----

    @Override
    public BigDecimal getAccountBalance() {
        synchronized (cashLock) {
            return balance;
        }
    }

    public BigDecimal getAverageFillPrice(String orderId) {
        List<Fill> orderFills = fills.getOrDefault(orderId, List.of());
        int quantity = 0;
        BigDecimal notional = BigDecimal.ZERO;
        for (Fill fill : orderFills) {
            quantity += fill.getQuantity();
            notional = notional.add(fill.getPrice().multiply(BigDecimal.valueOf(fill.getQuantity())));
        }
        return quantity == 0
                ? BigDecimal.ZERO
                : notional.divide(BigDecimal.valueOf(quantity), AVERAGE_SCALE, RoundingMode.HALF_UP);
    }

    public int getFilledQuantity(String orderId) {
        return fills.getOrDefault(orderId, List.of()).stream().mapToInt(Fill::getQuantity).sum();
    }

    public Order getOrder(String orderId) {
        Order order = orders.get(orderId);
        if (order == null) {
            return null;
        }
        synchronized (order) {
            return order.toBuilder().build();
        }
    }

    public int getHolding(long instrumentToken) {
        return holdings.getOrDefault(instrumentToken, 0);
    }

    /** Clears every book and restores the starting capital for a new session. */
    public void reset() {
        limitMonitors.values().forEach(future -> future.cancel(false));
        limitMonitors.clear();
        awaitingPrice.clear();
        limitOrders.clear();
        stopOrders.clear();
        orders.clear();
        fills.clear();
        holdings.clear();
        ltpCache.clear();
        synchronized (cashLock) {
            balance = simulatorConfig.getStartingCapital();
        }
        log.info("Paper broker reset, balance {}", balance);
    }

    // ---- Internal matching logic ----

    private void executeMarket(Order order, BigDecimal ltp) {
        if (order.getSide() == OrderSide.BUY) {
            executeSlicedBuy(order, ltp);
        } else {
            executeAtPrice(order, ltp);
        }
    }

    /**
     * Fills a MARKET BUY in randomized slices. One fill event is published per slice with the
     * running totals.
     */
    private void executeSlicedBuy(Order order, BigDecimal ltp) {
        int quantity = order.getQuantity();
        int slices = quantity >= simulatorConfig.getSliceThreshold() ? 1 + random.nextInt(3) : 1;

        int filled = 0;
        BigDecimal notional = BigDecimal.ZERO;
        for (int i = 0; i < slices && filled < quantity; i++) {
            double perturbation = (random.nextDouble() * 2 - 1) * 0.01;
            BigDecimal slicePrice = ltp.multiply(BigDecimal.valueOf(1 + perturbation))
                    .setScale(PRICE_SCALE, RoundingMode.HALF_UP);

            int remaining = quantity - filled;
            int sliceQty = i == slices - 1 ? remaining : (int) (remaining * (0.3 + random.nextDouble() * 0.4));
            if (sliceQty <= 0) {
                continue;
            }
            BigDecimal cost = slicePrice.multiply(BigDecimal.valueOf(sliceQty));
            if (!debit(cost)) {
                log.info("Paper order {} out of cash after {} of {}", order.getId(), filled, quantity);
                break;
            }
            filled += sliceQty;
            notional = notional.add(cost);
            recordFill(order, sliceQty, slicePrice);
            holdings.merge(order.getContract().getInstrumentToken(), sliceQty, Integer::sum);

            BigDecimal average = notional.divide(BigDecimal.valueOf(filled), AVERAGE_SCALE, RoundingMode.HALF_UP);
            updateOrder(order, filled < quantity ? OrderStatus.PARTIAL : OrderStatus.FILLED, filled, average);
            publishFill(order, average, filled);
        }

        if (filled == 0) {
            reject(order, "Insufficient cash for " + quantity + " @ " + ltp);
        }
    }

    /** Fills the whole order at one price. Used by SELL, STOP and LIMIT matches. */
    private void executeAtPrice(Order order, BigDecimal price) {
        int quantity = order.getQuantity();
        BigDecimal notional = price.multiply(BigDecimal.valueOf(quantity));
        long token = order.getContract().getInstrumentToken();
        if (order.getSide() == OrderSide.BUY) {
            if (!debit(notional)) {
                reject(order, "Insufficient cash for " + quantity + " @ " + price);
                return;
            }
            holdings.merge(token, quantity, Integer::sum);
        } else {
            synchronized (cashLock) {
                balance = balance.add(notional);
            }
            holdings.merge(token, -quantity, Integer::sum);
        }
        recordFill(order, quantity, price);
        updateOrder(order, OrderStatus.FILLED, quantity, price);
        publishFill(order, price, quantity);
    }

    private boolean tryFillLimit(Order order, BigDecimal ltp) {
        if (ltp == null || ltp.signum() <= 0) {
            return false;
        }
        boolean favourable = order.getSide() == OrderSide.BUY
                ? ltp.compareTo(order.getPrice()) <= 0
                : ltp.compareTo(order.getPrice()) >= 0;
        if (!favourable || limitOrders.remove(order.getId()) == null) {
            return false;
        }
        stopLimitMonitor(order.getId());
        log.info("Paper LIMIT {} matched at {} (limit {})", order.getId(), ltp, order.getPrice());
        executeAtPrice(order, ltp);
        return true;
    }

    private boolean isStopTriggered(Order order, BigDecimal ltp) {
        return order.getSide() == OrderSide.SELL
                ? ltp.compareTo(order.getTriggerPrice()) <= 0
                : ltp.compareTo(order.getTriggerPrice()) >= 0;
    }

    private void startLimitMonitor(Order order) {
        AtomicInteger checks = new AtomicInteger();
        String orderId = order.getId();
        ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(
                () -> {
                    if (!limitOrders.containsKey(orderId)) {
                        stopLimitMonitor(orderId);
                        return;
                    }
                    if (tryFillLimit(order, getLtp(order.getContract()))) {
                        return;
                    }
                    if (checks.incrementAndGet() >= simulatorConfig.getLimitCheckCount()) {
                        log.info("Paper LIMIT {} not matched within {} checks, cancelling", orderId, checks.get());
                        cancelOrder(orderId);
                    }
                },
                simulatorConfig.getLimitCheckInterval());
        if (future != null) {
            limitMonitors.put(orderId, future);
        }
    }

    private void stopLimitMonitor(String orderId) {
        ScheduledFuture<?> future = limitMonitors.remove(orderId);
        if (future != null) {
            future.cancel(false);
        }
    }

    private boolean debit(BigDecimal amount) {
        synchronized (cashLock) {
            if (amount.compareTo(balance) > 0) {
                return false;
            }
            balance = balance.subtract(amount);
            return true;
        }
    }

    private void recordFill(Order order, int quantity, BigDecimal price) {
        List<Fill> orderFills = fills.computeIfAbsent(order.getId(), id -> new CopyOnWriteArrayList<>());
        orderFills.add(new Fill(order.getId(), quantity, price, orderFills.size() + 1, LocalDateTime.now(clock)));
    }

    private void updateOrder(Order order, OrderStatus status, int filledQuantity, BigDecimal averagePrice) {
        synchronized (order) {
            order.setStatus(status);
            order.setFilledQuantity(filledQuantity);
            order.setAverageFillPrice(averagePrice);
            order.setUpdatedAt(LocalDateTime.now(clock));
        }
    }

    private void reject(Order order, String reason) {
        synchronized (order) {
            order.setStatus(OrderStatus.REJECTED);
            order.setRejectionReason(reason);
            order.setUpdatedAt(LocalDateTime.now(clock));
        }
        log.warn("Paper order {} rejected: {}", order.getId(), reason);
        dispatch(new OrderRejectedEvent(this, order.getId(), reason));
    }

    private void publishFill(Order order, BigDecimal averagePrice, int cumulativeQuantity) {
        log.info(
                "Paper fill {} {} {}/{} avg={}",
                order.getId(),
                order.getSide(),
                cumulativeQuantity,
                order.getQuantity(),
                averagePrice);
        dispatch(new OrderFillEvent(
                this,
                order.getId(),
                order.getContract(),
                averagePrice,
                order.getQuantity(),
                cumulativeQuantity,
                cumulativeQuantity < order.getQuantity()));
    }

    private void dispatch(Object event) {
        fillCallbackExecutor.execute(() -> {
            try {
                applicationEventPublisher.publishEvent(event);
            } catch (RuntimeException e) {
                log.error("Fill callback failed for {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
            }
        });
    }
}
