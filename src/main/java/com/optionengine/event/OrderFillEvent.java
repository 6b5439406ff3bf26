package com.optionengine.event;

import com.optionengine.domain.model.Contract;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/**
 * Broker callback for an order that received one or more fills.
 *
 * <p>{@code filledQuantity} is cumulative for the order and {@code fillPrice} is the
 * average price across all fills so far. Events for the same order may be replayed or
 * arrive out of order; consumers must apply only the delta beyond what they have already
 * accounted for.
 */
public class OrderFillEvent extends ApplicationEvent {

    private final String orderId;
    private final Contract contract;
    private final BigDecimal fillPrice;
    private final int totalQuantity;
    private final int filledQuantity;
    private final boolean partial;

    public OrderFillEvent(
            Object source,
            String orderId,
            Contract contract,
            BigDecimal fillPrice,
            int totalQuantity,
            int filledQuantity,
            boolean partial) {
        super(source);
        this.orderId = orderId;
        this.contract = contract;
        this.fillPrice = fillPrice;
        this.totalQuantity = totalQuantity;
        this.filledQuantity = filledQuantity;
        this.partial = partial;
    }

    public String getOrderId() {
        return orderId;
    }

    public Contract getContract() {
        return contract;
    }

    public BigDecimal getFillPrice() {
        return fillPrice;
    }

    public int getTotalQuantity() {
        return totalQuantity;
    }

    public int getFilledQuantity() {
        return filledQuantity;
    }

    public boolean isPartial() {
        return partial;
    }
}
