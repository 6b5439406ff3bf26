package com.optionengine.event;

/** Classifies the risk condition that produced a {@link RiskEvent}. */
public enum RiskEventType {

    /** Cumulative realized loss or profit magnitude reached the daily limit; new entries are blocked. */
    KILL_SWITCH_TRIGGERED,

    /** An exit had to use its own price as the entry price, booking zero PnL. */
    ENTRY_PRICE_FALLBACK
}
