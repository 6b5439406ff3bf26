package com.optionengine.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** A closed OHLC bar of the underlying, aggregated from ticks. */
@Data
@Builder
public class Candle {

    private long instrumentToken;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private LocalDateTime openTime;
    private LocalDateTime closeTime;
}
