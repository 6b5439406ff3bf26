package com.optionengine.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Value;

/** One execution against an order. Append-only. */
@Value
public class Fill {

    String orderId;
    int quantity;
    BigDecimal price;
    int sequence;
    LocalDateTime time;
}
