package com.optionengine.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>CRITICAL is reserved for conditions that trigger automatic protective action,
 * such as the daily loss kill switch.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
