package com.optionengine.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** Last traded price update for one instrument. */
@Data
@Builder
public class Tick {

    private long instrumentToken;
    private BigDecimal lastPrice;
    private LocalDateTime timestamp;
}
