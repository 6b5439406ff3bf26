package com.optionengine.domain.enums;

/** Entry signal produced on candle close: buy a call or buy a put. */
public enum Signal {
    BUY_CE(OptionType.CE),
    BUY_PE(OptionType.PE);

    private final OptionType optionType;

    Signal(OptionType optionType) {
        this.optionType = optionType;
    }

    public OptionType getOptionType() {
        return optionType;
    }

    /** Returns the matching signal, or null for anything unrecognized. */
    public static Signal fromString(String value) {
        if (value == null) {
            return null;
        }
        for (Signal signal : values()) {
            if (signal.name().equalsIgnoreCase(value.trim())) {
                return signal;
            }
        }
        return null;
    }
}
