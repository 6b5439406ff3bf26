package com.optionengine.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Exit-side view of one filled position, keyed by its entry order id.
 *
 * <p>Created once by ExitController#registerPosition and mutated only by the exit
 * controller under the instance lock. A null tpPrice means target exits are disabled.
 */
@Data
@Builder
public class ExitState {

    private String orderId;
    private Contract contract;
    private int quantity;
    private BigDecimal entryPrice;
    private BigDecimal originalEntryPrice;
    private BigDecimal slPrice;
    private BigDecimal tpPrice;
    private BigDecimal highestPrice;
    private BigDecimal lowestPrice;
    private boolean breakevenEngaged;

    private String stopOrderId;
    private String targetOrderId;
    private BigDecimal lastBrokerStopPrice;
    private boolean brokerOrdersActive;

    /** Raises the high watermark and lowers the low watermark with the given price. */
    public void observe(BigDecimal price) {
        if (highestPrice == null || price.compareTo(highestPrice) > 0) {
            highestPrice = price;
        }
        if (lowestPrice == null || price.compareTo(lowestPrice) < 0) {
            lowestPrice = price;
        }
    }
}
