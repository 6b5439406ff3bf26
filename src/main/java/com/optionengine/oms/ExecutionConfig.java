package com.optionengine.oms;

import com.optionengine.domain.enums.OrderType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/** Entry execution settings, bound from {@code engine.execution.*}. */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "engine.execution")
public class ExecutionConfig {

    /** Master switch for new entries. Exits are never blocked by it. */
    private boolean tradingEnabled = true;

    /** MARKET or LIMIT. STOP is not a valid entry type. */
    @NotNull
    private OrderType orderType = OrderType.MARKET;

    /** LIMIT premium over LTP, and the drift that cancels a resting LIMIT entry. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal priceTolerancePct = new BigDecimal("2.0");

    @NotNull
    private Duration orderTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration watchdogInterval = Duration.ofSeconds(1);

    @Min(1)
    private int ltpRetries = 15;

    @NotNull
    private Duration ltpRetryInterval = Duration.ofSeconds(1);

    /** Pause after subscribing so the first tick can arrive. */
    @NotNull
    private Duration subscribeSettle = Duration.ofMillis(500);
}
