package com.optionengine.broker;

import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.model.Contract;
import com.optionengine.domain.model.OrderRequest;
import java.math.BigDecimal;

/**
 * Order routing capability used by the execution and exit controllers. Components never
 * talk to broker-specific classes directly.
 *
 * <p>Two implementations exist:
 * <ul>
 *   <li>{@code KiteBroker}: Kite Connect REST API for live trading</li>
 *   <li>{@code SimulatedMatchingEngine}: in-memory matching for paper trading</li>
 * </ul>
 *
 * <p>The active implementation is selected by {@code engine.mode} (LIVE or PAPER).
 * Fills and rejections are reported asynchronously as
 * {@link com.optionengine.event.OrderFillEvent} and
 * {@link com.optionengine.event.OrderRejectedEvent}, keyed by the client order id.
 */
public interface Broker {

    // ---- Orders ----

    /**
     * Places an order under the request's client order id.
     *
     * @return the client order id, by which fills and status are reported
     * @throws com.optionengine.exception.BrokerException if the broker rejects the order or is unavailable
     */
    String placeOrder(OrderRequest orderRequest);

    /**
     * Cancels a pending order.
     *
     * @return false if the order was no longer pending (already filled, cancelled or unknown)
     */
    boolean cancelOrder(String orderId);

    /**
     * Current status of an order. Unknown orders report PENDING.
     */
    OrderStatus getOrderStatus(String orderId);

    // ---- Market data ----

    /**
     * Last traded price of the contract, or {@link BigDecimal#ZERO} if none is known yet.
     */
    BigDecimal getLtp(Contract contract);

    // ---- Account ----

    BigDecimal getAccountBalance();
}
