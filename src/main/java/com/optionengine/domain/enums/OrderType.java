package com.optionengine.domain.enums;

/** Order kinds understood by every broker implementation. STOP is a stop-market order. */
public enum OrderType {
    MARKET,
    LIMIT,
    STOP
}
