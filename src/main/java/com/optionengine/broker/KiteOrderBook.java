package com.optionengine.broker;

import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.model.OrderRequest;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Orders this engine has placed on Kite, indexed by client order id and by Kite order id.
 *
 * <p>The client order id travels to Kite as the order tag, so an update can be correlated
 * even when it arrives before the placement call has returned the Kite id.
 */
@Component
public class KiteOrderBook {

    private final Map<String, TrackedOrder> byClientId = new ConcurrentHashMap<>();
    private final Map<String, String> clientIdByKiteId = new ConcurrentHashMap<>();

    public TrackedOrder track(OrderRequest request) {
        TrackedOrder tracked = new TrackedOrder(request);
        byClientId.put(request.getClientOrderId(), tracked);
        return tracked;
    }

    public void bindKiteOrderId(String clientOrderId, String kiteOrderId) {
        TrackedOrder tracked = byClientId.get(clientOrderId);
        if (tracked != null) {
            tracked.kiteOrderId = kiteOrderId;
            clientIdByKiteId.put(kiteOrderId, clientOrderId);
        }
    }

    public Optional<TrackedOrder> findByClientId(String clientOrderId) {
        return Optional.ofNullable(byClientId.get(clientOrderId));
    }

    /**
     * Resolves an update by tag first, then by Kite order id.
     */
    public Optional<TrackedOrder> resolve(String tag, String kiteOrderId) {
        if (tag != null) {
            TrackedOrder byTag = byClientId.get(tag);
            if (byTag != null) {
                if (byTag.kiteOrderId == null && kiteOrderId != null) {
                    bindKiteOrderId(tag, kiteOrderId);
                }
                return Optional.of(byTag);
            }
        }
        if (kiteOrderId == null) {
            return Optional.empty();
        }
        String clientId = clientIdByKiteId.get(kiteOrderId);
        return clientId == null ? Optional.empty() : Optional.ofNullable(byClientId.get(clientId));
    }

    public void forget(String clientOrderId) {
        TrackedOrder removed = byClientId.remove(clientOrderId);
        if (removed != null && removed.kiteOrderId != null) {
            clientIdByKiteId.remove(removed.kiteOrderId);
        }
    }

    /** Mutable view of one order; mutations are guarded by synchronizing on the instance. */
    public static final class TrackedOrder {

        private final OrderRequest request;
        private volatile String kiteOrderId;
        private OrderStatus status = OrderStatus.PENDING;
        private int filledQuantity;

        TrackedOrder(OrderRequest request) {
            this.request = request;
        }

        public OrderRequest getRequest() {
            return request;
        }

        public String getClientOrderId() {
            return request.getClientOrderId();
        }

        public String getKiteOrderId() {
            return kiteOrderId;
        }

        public synchronized OrderStatus getStatus() {
            return status;
        }

        public synchronized void setStatus(OrderStatus status) {
            this.status = status;
        }

        public synchronized int getFilledQuantity() {
            return filledQuantity;
        }

        public synchronized void setFilledQuantity(int filledQuantity) {
            this.filledQuantity = filledQuantity;
        }
    }
}
