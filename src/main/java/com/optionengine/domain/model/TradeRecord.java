package com.optionengine.domain.model;

import com.optionengine.domain.enums.ExitReason;
import com.optionengine.domain.enums.OrderSide;
import com.optionengine.domain.enums.TradeType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** Append-only record of an entry fill delta or a position exit. */
@Data
@Builder
public class TradeRecord {

    private String id;
    private String orderId;
    private TradeType tradeType;
    private int fillNumber;
    private String symbol;
    private OrderSide side;
    private int quantity;
    private BigDecimal price;

    /** Set on EXIT records only. */
    private BigDecimal entryPrice;

    private BigDecimal pnl;
    private ExitReason exitReason;
    private LocalDateTime executedAt;
}
