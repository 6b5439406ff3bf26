package com.optionengine.domain.enums;

/** Why a position was exited. Exactly one reason applies per position. */
public enum ExitReason {
    SL,
    TP,
    SQUAREOFF,
    SYSTEM_SHUTDOWN
}
