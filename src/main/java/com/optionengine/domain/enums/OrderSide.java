package com.optionengine.domain.enums;

/** Buy or sell side of an order. Maps to Kite API's transaction_type field. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used to close a long entry. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
