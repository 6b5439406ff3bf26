package com.optionengine.oms;

import com.optionengine.broker.Broker;
import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.model.Contract;
import com.optionengine.exception.BrokerException;
import com.optionengine.exception.StaleCancelRaceException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Cancels resting LIMIT entries that time out or whose market has drifted away.
 *
 * <p>Each watched order gets its own periodic check on the {@link TaskScheduler}:
 * <ul>
 *   <li>a terminal broker status ends the watch;</li>
 *   <li>elapsed time &gt;= {@code orderTimeout} cancels the order;</li>
 *   <li>{@code |ltp - limit| / limit * 100 > priceTolerancePct} cancels the order.</li>
 * </ul>
 *
 * <p>A cancel the broker reports as no longer pending lost the race against a fill; it is
 * logged at debug and the fill callback takes over.
 */
@Component
public class OrderTimeoutWatchdog {

    private static final Logger log = LoggerFactory.getLogger(OrderTimeoutWatchdog.class);

    private final Broker broker;
    private final TaskScheduler taskScheduler;
    private final ExecutionConfig executionConfig;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> watches = new ConcurrentHashMap<>();

    public OrderTimeoutWatchdog(
            Broker broker, TaskScheduler taskScheduler, ExecutionConfig executionConfig, Clock clock) {
        this.broker = broker;
        this.taskScheduler = taskScheduler;
        this.executionConfig = executionConfig;
        this.clock = clock;
    }

    /**
     * Starts watching a LIMIT order.
     *
     * @param onCancelled invoked with the order id after a successful cancel
     */
    public void watch(
            String orderId,
            Contract contract,
            BigDecimal limitPrice,
            LocalDateTime placedAt,
            Consumer<String> onCancelled) {
        ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(
                () -> check(orderId, contract, limitPrice, placedAt, onCancelled),
                executionConfig.getWatchdogInterval());
        if (future != null) {
            ScheduledFuture<?> previous = watches.put(orderId, future);
            if (previous != null) {
                previous.cancel(false);
            }
        }
        log.debug("Watching LIMIT {} @ {} (timeout {})", orderId, limitPrice, executionConfig.getOrderTimeout());
    }

    public void stop(String orderId) {
        ScheduledFuture<?> future = watches.remove(orderId);
        if (future != null) {
            future.cancel(false);
        }
    }

    public boolean isWatching(String orderId) {
        return watches.containsKey(orderId);
    }

    void check(
            String orderId,
            Contract contract,
            BigDecimal limitPrice,
            LocalDateTime placedAt,
            Consumer<String> onCancelled) {
        try {
            OrderStatus status = broker.getOrderStatus(orderId);
            if (status.isTerminal()) {
                log.debug("Order {} reached {}, watch ended", orderId, status);
                stop(orderId);
                return;
            }

            Duration elapsed = Duration.between(placedAt, LocalDateTime.now(clock));
            if (elapsed.compareTo(executionConfig.getOrderTimeout()) >= 0) {
                log.warn("Cancelling {}: no fill after {}s", orderId, elapsed.toSeconds());
                cancel(orderId, onCancelled);
                return;
            }

            BigDecimal ltp = broker.getLtp(contract);
            if (ltp != null && ltp.signum() > 0 && limitPrice.signum() > 0) {
                BigDecimal driftPct = ltp.subtract(limitPrice)
                        .abs()
                        .divide(limitPrice, MathContext.DECIMAL64)
                        .multiply(BigDecimal.valueOf(100));
                if (driftPct.compareTo(executionConfig.getPriceTolerancePct()) > 0) {
                    log.warn("Cancelling {}: price drifted {}% from limit {}", orderId, driftPct, limitPrice);
                    cancel(orderId, onCancelled);
                }
            }
        } catch (RuntimeException e) {
            log.error("Watchdog check failed for {}: {}", orderId, e.getMessage(), e);
        }
    }

    private void cancel(String orderId, Consumer<String> onCancelled) {
        stop(orderId);
        try {
            if (!broker.cancelOrder(orderId)) {
                throw new StaleCancelRaceException(orderId);
            }
            onCancelled.accept(orderId);
        } catch (StaleCancelRaceException e) {
            log.debug("Stale cancel for {}: {}", orderId, e.getMessage());
        } catch (BrokerException e) {
            log.warn("Cancel of {} failed: {}", orderId, e.getMessage());
        }
    }
}
