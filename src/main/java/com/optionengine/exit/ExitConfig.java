package com.optionengine.exit;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/** Stop-loss, target, trailing and breakeven settings, bound from {@code engine.exit.*}. */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "engine.exit")
public class ExitConfig {

    @NotNull
    @DecimalMin("0")
    private BigDecimal slPercent = new BigDecimal("5");

    @NotNull
    @DecimalMin("0")
    private BigDecimal tpPercent = new BigDecimal("10");

    private boolean tpExitEnabled = true;

    private boolean trailingSl = false;

    private boolean breakevenEnabled = false;

    /** Profit percentage that engages breakeven. Defaults to the target percentage. */
    @DecimalMin("0")
    private BigDecimal breakevenTriggerPercent;

    /** Rest STOP/LIMIT exit orders at the broker instead of watching ticks in software. */
    private boolean useBrokerSlOrders = false;

    /** Minimum stop move, in percent, before a resting broker stop is replaced. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal slUpdateThresholdPercent = BigDecimal.ONE;

    public BigDecimal effectiveBreakevenTriggerPercent() {
        return breakevenTriggerPercent != null ? breakevenTriggerPercent : tpPercent;
    }
}
