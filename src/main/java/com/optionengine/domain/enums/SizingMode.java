package com.optionengine.domain.enums;

import com.optionengine.exception.InvalidConfigurationException;

/**
 * Position sizing modes. Configured as {@code fixed_lot} or {@code percent}.
 */
public enum SizingMode {
    FIXED_LOT("fixed_lot"),
    PERCENT("percent");

    private final String configValue;

    SizingMode(String configValue) {
        this.configValue = configValue;
    }

    public String getConfigValue() {
        return configValue;
    }

    /**
     * Parses a configured mode name.
     *
     * @throws InvalidConfigurationException for unknown modes
     */
    public static SizingMode fromConfig(String value) {
        if (value != null) {
            for (SizingMode mode : values()) {
                if (mode.configValue.equalsIgnoreCase(value.trim()) || mode.name().equalsIgnoreCase(value.trim())) {
                    return mode;
                }
            }
        }
        throw new InvalidConfigurationException("Unknown sizing mode: " + value);
    }
}
