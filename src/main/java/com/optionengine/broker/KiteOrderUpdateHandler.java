package com.optionengine.broker;

import com.optionengine.broker.KiteOrderBook.TrackedOrder;
import com.optionengine.broker.mapper.KiteOrderMapper;
import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.model.OrderRequest;
import com.optionengine.event.OrderFillEvent;
import com.optionengine.event.OrderRejectedEvent;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Turns Kite WebSocket order updates into {@link OrderFillEvent}s and
 * {@link OrderRejectedEvent}s keyed by the client order id.
 *
 * <p>Safety guarantees:
 * <ul>
 *   <li>Idempotent: a fill is published only when the cumulative filled quantity grew</li>
 *   <li>FILLED and REJECTED orders are never moved backwards</li>
 *   <li>A CANCELLED order still reports fills that happened before the cancel</li>
 *   <li>Updates for orders this engine did not place are ignored</li>
 * </ul>
 */
@Service
public class KiteOrderUpdateHandler {

    private static final Logger log = LoggerFactory.getLogger(KiteOrderUpdateHandler.class);

    private final KiteOrderBook kiteOrderBook;
    private final KiteOrderMapper kiteOrderMapper;
    private final ApplicationEventPublisher applicationEventPublisher;

    public KiteOrderUpdateHandler(
            KiteOrderBook kiteOrderBook,
            KiteOrderMapper kiteOrderMapper,
            ApplicationEventPublisher applicationEventPublisher) {
        this.kiteOrderBook = kiteOrderBook;
        this.kiteOrderMapper = kiteOrderMapper;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Processes one update. Called on the ticker's callback thread.
     */
    public void handleOrderUpdate(com.zerodhatech.models.Order kiteOrder) {
        if (kiteOrder == null || kiteOrder.orderId == null) {
            log.warn("Received null order update or order with null orderId, ignoring");
            return;
        }

        Optional<TrackedOrder> trackedOpt = kiteOrderBook.resolve(kiteOrder.tag, kiteOrder.orderId);
        if (trackedOpt.isEmpty()) {
            log.info(
                    "Order update for unknown kiteOrderId={} tag={} status={}, ignoring",
                    kiteOrder.orderId,
                    kiteOrder.tag,
                    kiteOrder.status);
            return;
        }

        TrackedOrder tracked = trackedOpt.get();
        int incomingFilledQty = kiteOrderMapper.parseInt(kiteOrder.filledQuantity);
        OrderStatus incomingStatus = kiteOrderMapper.mapStatus(kiteOrder.status, incomingFilledQty);

        log.debug(
                "Order update: clientOrderId={} kiteOrderId={} status={} filledQty={} avgPrice={}",
                tracked.getClientOrderId(),
                kiteOrder.orderId,
                kiteOrder.status,
                kiteOrder.filledQuantity,
                kiteOrder.averagePrice);

        ApplicationEvent event = null;
        synchronized (tracked) {
            OrderStatus current = tracked.getStatus();
            if (current == OrderStatus.FILLED || current == OrderStatus.REJECTED) {
                log.debug(
                        "Order {} already {}, ignoring update to {}",
                        tracked.getClientOrderId(),
                        current,
                        incomingStatus);
                return;
            }

            if (incomingStatus == OrderStatus.REJECTED) {
                if (tracked.getFilledQuantity() > 0) {
                    log.warn("Rejection for partially filled order {} treated as cancel", tracked.getClientOrderId());
                    tracked.setStatus(OrderStatus.CANCELLED);
                    return;
                }
                event = handleRejection(tracked, kiteOrder.statusMessage);
            } else if (incomingFilledQty > tracked.getFilledQuantity()) {
                BigDecimal averagePrice = kiteOrderMapper.parseBigDecimal(kiteOrder.averagePrice);
                event = handleFill(tracked, incomingStatus, incomingFilledQty, averagePrice);
            } else if (incomingStatus == OrderStatus.CANCELLED && current != OrderStatus.CANCELLED) {
                tracked.setStatus(OrderStatus.CANCELLED);
                log.info("Order {} cancelled at broker", tracked.getClientOrderId());
            } else {
                log.debug("Ignoring order update for {}: no fill change", tracked.getClientOrderId());
            }
        }
        // Published outside the lock; listeners may call back into the broker
        if (event != null) {
            applicationEventPublisher.publishEvent(event);
        }
    }

    private ApplicationEvent handleRejection(TrackedOrder tracked, String reason) {
        tracked.setStatus(OrderStatus.REJECTED);
        log.warn(
                "Order rejected by broker: clientOrderId={} symbol={} reason={}",
                tracked.getClientOrderId(),
                tracked.getRequest().getContract().getSymbol(),
                reason);
        return new OrderRejectedEvent(this, tracked.getClientOrderId(), reason);
    }

    private ApplicationEvent handleFill(TrackedOrder tracked, OrderStatus incomingStatus, int filledQty, BigDecimal averagePrice) {
        OrderRequest request = tracked.getRequest();
        int previous = tracked.getFilledQuantity();
        tracked.setFilledQuantity(filledQty);

        OrderStatus next;
        if (filledQty >= request.getQuantity() || incomingStatus == OrderStatus.FILLED) {
            next = OrderStatus.FILLED;
        } else if (tracked.getStatus() == OrderStatus.CANCELLED || incomingStatus == OrderStatus.CANCELLED) {
            next = OrderStatus.CANCELLED;
        } else {
            next = OrderStatus.PARTIAL;
        }
        tracked.setStatus(next);

        log.info(
                "Order fill: clientOrderId={} symbol={} filledQty={}/{} avgPrice={} previousFilled={}",
                tracked.getClientOrderId(),
                request.getContract().getSymbol(),
                filledQty,
                request.getQuantity(),
                averagePrice,
                previous);

        return new OrderFillEvent(
                this,
                tracked.getClientOrderId(),
                request.getContract(),
                averagePrice,
                request.getQuantity(),
                filledQty,
                next != OrderStatus.FILLED);
    }
}
