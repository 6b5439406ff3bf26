package com.optionengine.domain.enums;

public enum TradeType {
    ENTRY,
    EXIT
}
