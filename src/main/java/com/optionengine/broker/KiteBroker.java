package com.optionengine.broker;

import com.optionengine.broker.KiteOrderBook.TrackedOrder;
import com.optionengine.broker.mapper.KiteOrderMapper;
import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.model.Contract;
import com.optionengine.domain.model.OrderRequest;
import com.optionengine.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.utils.Constants;
import com.zerodhatech.models.LTPQuote;
import com.zerodhatech.models.Margin;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.OrderParams;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Live {@link Broker} backed by the Kite Connect REST API.
 *
 * <p>Orders are placed as intraday regular-variety orders tagged with the client order id.
 * Fills and rejections are not reported here; they arrive over the ticker's order-update
 * channel and are published by {@link KiteOrderUpdateHandler}.
 *
 * <p>Resilience4j decorators:
 * <ul>
 *   <li><b>Rate limiter</b> ({@code kiteOrders}) on order placement and cancellation</li>
 *   <li><b>Circuit breaker</b> ({@code kiteApi}) on every call</li>
 *   <li><b>Retry</b> ({@code kiteApi}) on read-only calls only, so an order is never sent twice</li>
 * </ul>
 *
 * <p>Kite's checked exceptions are wrapped into {@link BrokerException}.
 */
@Service
@ConditionalOnProperty(name = "engine.mode", havingValue = "LIVE")
public class KiteBroker implements Broker {

    private static final Logger log = LoggerFactory.getLogger(KiteBroker.class);

    private static final String MARGIN_SEGMENT = "equity";

    private final KiteConnect kiteConnect;
    private final KiteOrderMapper kiteOrderMapper;
    private final KiteOrderBook kiteOrderBook;

    public KiteBroker(KiteConnect kiteConnect, KiteOrderMapper kiteOrderMapper, KiteOrderBook kiteOrderBook) {
        this.kiteConnect = kiteConnect;
        this.kiteOrderMapper = kiteOrderMapper;
        this.kiteOrderBook = kiteOrderBook;
    }

    @Override
    @RateLimiter(name = "kiteOrders")
    @CircuitBreaker(name = "kiteApi")
    public String placeOrder(OrderRequest orderRequest) {
        String clientOrderId = orderRequest.getClientOrderId();
        String symbol = orderRequest.getContract().getSymbol();
        OrderParams params = kiteOrderMapper.toOrderParams(orderRequest);
        kiteOrderBook.track(orderRequest);
        try {
            Order kiteOrder = kiteConnect.placeOrder(params, Constants.VARIETY_REGULAR);
            kiteOrderBook.bindKiteOrderId(clientOrderId, kiteOrder.orderId);
            log.info(
                    "Order placed: clientOrderId={} kiteOrderId={} symbol={} side={} type={} qty={}",
                    clientOrderId,
                    kiteOrder.orderId,
                    symbol,
                    orderRequest.getSide(),
                    orderRequest.getType(),
                    orderRequest.getQuantity());
            return clientOrderId;
        } catch (KiteException e) {
            kiteOrderBook.forget(clientOrderId);
            log.error("Kite order placement failed for {}: {}", symbol, e.message);
            throw new BrokerException("Order placement failed: " + e.message, e);
        } catch (JSONException | IOException e) {
            kiteOrderBook.forget(clientOrderId);
            log.error("Order placement error for {}", symbol, e);
            throw new BrokerException("Order placement error: " + e.getMessage(), e);
        }
    }

    @Override
    @RateLimiter(name = "kiteOrders")
    @CircuitBreaker(name = "kiteApi")
    public boolean cancelOrder(String orderId) {
        Optional<TrackedOrder> trackedOpt = kiteOrderBook.findByClientId(orderId);
        if (trackedOpt.isEmpty() || trackedOpt.get().getKiteOrderId() == null) {
            log.debug("Cancel requested for unknown or unacknowledged order {}", orderId);
            return false;
        }
        TrackedOrder tracked = trackedOpt.get();
        if (tracked.getStatus().isTerminal()) {
            return false;
        }
        try {
            kiteConnect.cancelOrder(tracked.getKiteOrderId(), Constants.VARIETY_REGULAR);
            tracked.setStatus(OrderStatus.CANCELLED);
            log.info("Order cancelled: clientOrderId={} kiteOrderId={}", orderId, tracked.getKiteOrderId());
            return true;
        } catch (KiteException e) {
            // Kite refuses to cancel orders that completed in the meantime
            OrderStatus current = refreshStatus(tracked);
            if (current.isTerminal()) {
                log.debug("Cancel of {} lost to {}: {}", orderId, current, e.message);
                return false;
            }
            log.error("Order cancellation failed for {}: {}", orderId, e.message);
            throw new BrokerException("Order cancellation failed: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Order cancellation error for {}", orderId, e);
            throw new BrokerException("Order cancellation error: " + e.getMessage(), e);
        }
    }

    @Override
    @CircuitBreaker(name = "kiteApi")
    @Retry(name = "kiteApi")
    public OrderStatus getOrderStatus(String orderId) {
        Optional<TrackedOrder> trackedOpt = kiteOrderBook.findByClientId(orderId);
        if (trackedOpt.isEmpty()) {
            return OrderStatus.PENDING;
        }
        TrackedOrder tracked = trackedOpt.get();
        if (tracked.getStatus().isTerminal() || tracked.getKiteOrderId() == null) {
            return tracked.getStatus();
        }
        return refreshStatus(tracked);
    }

    @Override
    @CircuitBreaker(name = "kiteApi")
    @Retry(name = "kiteApi")
    public BigDecimal getLtp(Contract contract) {
        String key = contract.getExchange() + ":" + contract.getSymbol();
        try {
            Map<String, LTPQuote> quotes = kiteConnect.getLTP(new String[] {key});
            LTPQuote quote = quotes.get(key);
            if (quote == null || quote.lastPrice <= 0) {
                return BigDecimal.ZERO;
            }
            return BigDecimal.valueOf(quote.lastPrice);
        } catch (KiteException e) {
            log.error("Failed to fetch LTP for {}: {}", key, e.message);
            throw new BrokerException("Failed to fetch LTP: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching LTP for {}", key, e);
            throw new BrokerException("Error fetching LTP: " + e.getMessage(), e);
        }
    }

    @Override
    @CircuitBreaker(name = "kiteApi")
    @Retry(name = "kiteApi")
    public BigDecimal getAccountBalance() {
        try {
            Margin margin = kiteConnect.getMargins(MARGIN_SEGMENT);
            if (margin == null || margin.available == null) {
                return BigDecimal.ZERO;
            }
            return kiteOrderMapper.parseBigDecimal(margin.available.cash);
        } catch (KiteException e) {
            log.error("Failed to fetch margins: {}", e.message);
            throw new BrokerException("Failed to fetch margins: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching margins", e);
            throw new BrokerException("Error fetching margins: " + e.getMessage(), e);
        }
    }

    /**
     * Reads the latest state from the order history. The tracked status is left to the
     * order-update handler, which owns fill accounting.
     */
    private OrderStatus refreshStatus(TrackedOrder tracked) {
        try {
            List<Order> history = kiteConnect.getOrderHistory(tracked.getKiteOrderId());
            if (history == null || history.isEmpty()) {
                return tracked.getStatus();
            }
            Order latest = history.get(history.size() - 1);
            return kiteOrderMapper.mapStatus(latest.status, kiteOrderMapper.parseInt(latest.filledQuantity));
        } catch (KiteException e) {
            log.error("Failed to fetch order history for {}: {}", tracked.getKiteOrderId(), e.message);
            throw new BrokerException("Failed to fetch order history: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching order history for {}", tracked.getKiteOrderId(), e);
            throw new BrokerException("Error fetching order history: " + e.getMessage(), e);
        }
    }
}
