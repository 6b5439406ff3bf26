package com.optionengine.entity;

import com.optionengine.domain.enums.ExitReason;
import com.optionengine.domain.enums.OrderSide;
import com.optionengine.domain.enums.TradeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trades table. Append-only: one row per entry fill delta and one
 * per position exit.
 */
@Entity
@Table(name = "trades")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "order_id", length = 36)
    private String orderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "trade_type", columnDefinition = "varchar(10)")
    private TradeType tradeType;

    @Column(name = "fill_number")
    private int fillNumber;

    @Column(length = 50)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private OrderSide side;

    private int quantity;

    @Column(precision = 15, scale = 6)
    private BigDecimal price;

    @Column(name = "entry_price", precision = 15, scale = 6)
    private BigDecimal entryPrice;

    @Column(precision = 15, scale = 2)
    private BigDecimal pnl;

    @Enumerated(EnumType.STRING)
    @Column(name = "exit_reason", columnDefinition = "varchar(20)")
    private ExitReason exitReason;

    @Column(name = "trading_date")
    private LocalDate tradingDate;

    @Column(name = "executed_at")
    private LocalDateTime executedAt;
}
