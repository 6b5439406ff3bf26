package com.optionengine.margin.impl;

import com.optionengine.domain.enums.SizingMode;
import com.optionengine.margin.PositionSizer;
import com.optionengine.margin.PositionSizingContext;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Allocates {@code value}% of available capital to the trade:
 * {@code floor((capital * value / 100) / (price * lotSize)) * lotSize}.
 *
 * <p>Monotonically non-decreasing in capital. Returns 0 when the allocation does not
 * cover a single lot.
 */
@Component
public class PercentOfCapitalSizer implements PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(PercentOfCapitalSizer.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Override
    public int calculateQuantity(PositionSizingContext positionSizingContext) {
        int lotSize = positionSizingContext.getLotSize();
        if (lotSize <= 0) {
            return 0;
        }
        BigDecimal allocation = positionSizingContext
                .getAvailableCapital()
                .multiply(positionSizingContext.getValue())
                .divide(HUNDRED, 6, RoundingMode.DOWN);
        BigDecimal lotCost = positionSizingContext.getEntryPrice().multiply(BigDecimal.valueOf(lotSize));

        int lots = allocation.divide(lotCost, 0, RoundingMode.DOWN).intValue();
        if (lots <= 0) {
            log.debug("Allocation {} does not cover one lot costing {}", allocation, lotCost);
            return 0;
        }
        return lots * lotSize;
    }

    @Override
    public SizingMode getType() {
        return SizingMode.PERCENT;
    }
}
