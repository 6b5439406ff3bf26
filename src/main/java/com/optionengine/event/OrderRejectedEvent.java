package com.optionengine.event;

import org.springframework.context.ApplicationEvent;

/** Broker callback for an order that was rejected after submission. */
public class OrderRejectedEvent extends ApplicationEvent {

    private final String orderId;
    private final String reason;

    public OrderRejectedEvent(Object source, String orderId, String reason) {
        super(source);
        this.orderId = orderId;
        this.reason = reason;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getReason() {
        return reason;
    }
}
