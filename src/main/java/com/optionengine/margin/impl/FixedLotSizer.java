package com.optionengine.margin.impl;

import com.optionengine.domain.enums.SizingMode;
import com.optionengine.margin.PositionSizer;
import com.optionengine.margin.PositionSizingContext;
import org.springframework.stereotype.Component;

/**
 * Always trades {@code value} lots, regardless of capital. Affordability is left to
 * the broker, which rejects or partially fills what it cannot fund.
 */
@Component
public class FixedLotSizer implements PositionSizer {

    @Override
    public int calculateQuantity(PositionSizingContext positionSizingContext) {
        int lots = positionSizingContext.getValue().intValue();
        return Math.max(lots, 0) * positionSizingContext.getLotSize();
    }

    @Override
    public SizingMode getType() {
        return SizingMode.FIXED_LOT;
    }
}
