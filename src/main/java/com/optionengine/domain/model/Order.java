package com.optionengine.domain.model;

import com.optionengine.domain.enums.OrderSide;
import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * An order as tracked by a broker implementation and persisted for reporting.
 *
 * <p>Only the owning broker (or its callbacks) mutates status and fill fields.
 * averageFillPrice is the VWAP across all fills.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String id;
    private Contract contract;
    private OrderSide side;
    private OrderType type;
    private int quantity;

    /** Limit price. Set for LIMIT orders. */
    private BigDecimal price;

    /** Trigger price. Set for STOP orders. */
    private BigDecimal triggerPrice;

    private OrderStatus status;
    private int filledQuantity;
    private BigDecimal averageFillPrice;
    private String rejectionReason;
    private LocalDateTime placedAt;
    private LocalDateTime updatedAt;
}
