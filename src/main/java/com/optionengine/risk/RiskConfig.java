package com.optionengine.risk;

import com.optionengine.domain.enums.SizingMode;
import jakarta.annotation.PostConstruct;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Risk and sizing configuration, bound from {@code engine.risk.*}.
 *
 * <p>The sizing mode is parsed at startup so that a typo aborts the process instead of
 * silently dropping every signal later in the session.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "engine.risk")
public class RiskConfig {

    private static final Logger log = LoggerFactory.getLogger(RiskConfig.class);

    /** Kill switch threshold on the magnitude of cumulative realized PnL. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal maxDailyLoss = new BigDecimal("5000");

    /** {@code fixed_lot} or {@code percent}. */
    @NotNull
    private String sizingMode = SizingMode.FIXED_LOT.getConfigValue();

    /** Lots for fixed_lot, percentage of capital for percent. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal sizingValue = BigDecimal.ONE;

    @PostConstruct
    void validate() {
        SizingMode mode = SizingMode.fromConfig(sizingMode);
        log.info("Risk config: maxDailyLoss={} sizing={} value={}", maxDailyLoss, mode, sizingValue);
    }
}
