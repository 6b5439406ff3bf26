package com.optionengine.margin;

import com.optionengine.domain.enums.SizingMode;

/**
 * Calculates the order quantity for a new entry.
 *
 * <p>Two implementations exist:
 * <ul>
 *   <li>{@link com.optionengine.margin.impl.FixedLotSizer}: a fixed number of lots</li>
 *   <li>{@link com.optionengine.margin.impl.PercentOfCapitalSizer}: scales with available capital</li>
 * </ul>
 *
 * <p>Resolved by {@link PositionSizerFactory} based on {@link SizingMode}.
 */
public interface PositionSizer {

    /**
     * @return quantity in units, always a multiple of the lot size and never negative
     */
    int calculateQuantity(PositionSizingContext positionSizingContext);

    SizingMode getType();
}
