package com.optionengine.domain.enums;

/**
 * Lifecycle status of an order: PENDING -> {PARTIAL -> PARTIAL|FILLED} | CANCELLED | REJECTED.
 * FILLED, CANCELLED and REJECTED are final.
 */
public enum OrderStatus {
    PENDING,
    PARTIAL,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }
}
