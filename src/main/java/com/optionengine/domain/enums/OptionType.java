package com.optionengine.domain.enums;

public enum OptionType {
    CE,
    PE
}
