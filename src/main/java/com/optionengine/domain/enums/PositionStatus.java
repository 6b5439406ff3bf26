package com.optionengine.domain.enums;

public enum PositionStatus {
    OPEN,
    CLOSED
}
