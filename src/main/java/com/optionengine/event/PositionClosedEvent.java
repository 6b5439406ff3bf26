package com.optionengine.event;

import com.optionengine.domain.enums.ExitReason;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/** Published by the exit controller once a position exit has been finalized. */
public class PositionClosedEvent extends ApplicationEvent {

    private final String orderId;
    private final String symbol;
    private final ExitReason reason;
    private final int quantity;
    private final BigDecimal exitPrice;
    private final BigDecimal pnl;

    public PositionClosedEvent(
            Object source,
            String orderId,
            String symbol,
            ExitReason reason,
            int quantity,
            BigDecimal exitPrice,
            BigDecimal pnl) {
        super(source);
        this.orderId = orderId;
        this.symbol = symbol;
        this.reason = reason;
        this.quantity = quantity;
        this.exitPrice = exitPrice;
        this.pnl = pnl;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getSymbol() {
        return symbol;
    }

    public ExitReason getReason() {
        return reason;
    }

    public int getQuantity() {
        return quantity;
    }

    public BigDecimal getExitPrice() {
        return exitPrice;
    }

    public BigDecimal getPnl() {
        return pnl;
    }
}
