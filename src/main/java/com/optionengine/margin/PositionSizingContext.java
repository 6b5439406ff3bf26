package com.optionengine.margin;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Inputs to a {@link PositionSizer}. entryPrice is always positive here. */
@Data
@Builder
public class PositionSizingContext {

    private BigDecimal entryPrice;
    private int lotSize;

    /** Lots for fixed_lot, percentage of available capital for percent. */
    private BigDecimal value;

    private BigDecimal availableCapital;
}
