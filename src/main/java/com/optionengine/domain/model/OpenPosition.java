package com.optionengine.domain.model;

import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.enums.OrderType;
import com.optionengine.domain.enums.Signal;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Execution-side view of one entry order, from submission until the position is exited.
 *
 * <p>Owned by the OrderExecutionController; other components only receive snapshots.
 * appliedQuantity/appliedNotional record what has already been pushed to the ledger and
 * are the basis of fill-delta idempotency. exitedQuantity/exitedNotional record the part
 * already closed by the exit side, at its entry cost; a fill that lands after an exit is
 * re-registered as the remainder.
 */
@Data
@Builder(toBuilder = true)
public class OpenPosition {

    private String orderId;
    private Contract contract;
    private Signal signal;
    private OrderType orderType;
    private int requestedQuantity;
    private int filledQuantity;
    private BigDecimal averagePrice;
    private OrderStatus status;
    private BigDecimal limitPrice;
    private LocalDateTime placedAt;

    private int appliedQuantity;

    @Builder.Default
    private BigDecimal appliedNotional = BigDecimal.ZERO;

    private int fillCount;

    private int exitedQuantity;

    @Builder.Default
    private BigDecimal exitedNotional = BigDecimal.ZERO;

    /** Filled quantity not yet closed by an exit. */
    public int heldQuantity() {
        return filledQuantity - exitedQuantity;
    }

    public OpenPosition snapshot() {
        return toBuilder().build();
    }
}
