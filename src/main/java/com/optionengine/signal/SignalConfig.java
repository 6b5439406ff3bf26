package com.optionengine.signal;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/** Underlying, candle and EMA settings, bound from {@code engine.signal.*}. */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "engine.signal")
public class SignalConfig {

    /** Instrument token of the underlying index (NIFTY 50 on Kite). */
    private long underlyingToken = 256265L;

    /** Underlying name as it appears in the option instrument dump. */
    @NotBlank
    private String underlyingName = "NIFTY";

    @NotBlank
    private String optionExchange = "NFO";

    @NotNull
    private Duration candleInterval = Duration.ofMinutes(1);

    @Min(1)
    private int emaFastPeriod = 9;

    @Min(2)
    private int emaSlowPeriod = 26;

    @Min(10)
    private int maxBarCount = 500;
}
