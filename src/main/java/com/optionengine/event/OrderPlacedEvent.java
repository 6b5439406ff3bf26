package com.optionengine.event;

import com.optionengine.domain.enums.OrderSide;
import com.optionengine.domain.enums.OrderType;
import org.springframework.context.ApplicationEvent;

/** Published after the broker accepted an order, entry or exit. */
public class OrderPlacedEvent extends ApplicationEvent {

    private final String orderId;
    private final String symbol;
    private final OrderSide side;
    private final OrderType orderType;
    private final int quantity;

    public OrderPlacedEvent(
            Object source, String orderId, String symbol, OrderSide side, OrderType orderType, int quantity) {
        super(source);
        this.orderId = orderId;
        this.symbol = symbol;
        this.side = side;
        this.orderType = orderType;
        this.quantity = quantity;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getSymbol() {
        return symbol;
    }

    public OrderSide getSide() {
        return side;
    }

    public OrderType getOrderType() {
        return orderType;
    }

    public int getQuantity() {
        return quantity;
    }
}
