package com.optionengine.simulator;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/** Paper broker settings, bound from {@code engine.simulator.*}. */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "engine.simulator")
public class SimulatorConfig {

    @NotNull
    @DecimalMin("0")
    private BigDecimal startingCapital = new BigDecimal("1000000");

    /** Number of checks a LIMIT order's monitor makes before cancelling it. */
    @Min(1)
    private int limitCheckCount = 30;

    @NotNull
    private Duration limitCheckInterval = Duration.ofSeconds(1);

    /** Quantity at or above which a MARKET BUY may fill in several slices. */
    @Min(1)
    private int sliceThreshold = 50;

    /** Fixed seed for reproducible sessions. Null seeds from entropy. */
    private Long randomSeed;
}
