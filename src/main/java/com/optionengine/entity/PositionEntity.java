package com.optionengine.entity;

import com.optionengine.domain.enums.ExitReason;
import com.optionengine.domain.enums.PositionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the positions table: one row per aggregate position.
 * Contract fields are flattened; contributing order ids are stored comma-separated.
 */
@Entity
@Table(name = "positions", indexes = @Index(name = "idx_positions_symbol_status", columnList = "symbol,status"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 50, nullable = false)
    private String symbol;

    @Column(length = 10)
    private String exchange;

    @Column(name = "instrument_token")
    private long instrumentToken;

    @Column(name = "lot_size")
    private int lotSize;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private PositionStatus status;

    @Column(name = "open_quantity")
    private int openQuantity;

    @Column(name = "opened_quantity")
    private int openedQuantity;

    @Column(name = "closed_quantity")
    private int closedQuantity;

    @Column(name = "average_entry_price", precision = 15, scale = 6)
    private BigDecimal averageEntryPrice;

    @Column(name = "average_exit_price", precision = 15, scale = 6)
    private BigDecimal averageExitPrice;

    @Column(name = "last_price", precision = 15, scale = 6)
    private BigDecimal lastPrice;

    @Column(name = "realized_pnl", precision = 15, scale = 2)
    private BigDecimal realizedPnl;

    @Column(name = "unrealized_pnl", precision = 15, scale = 2)
    private BigDecimal unrealizedPnl;

    @Column(name = "net_pnl", precision = 15, scale = 2)
    private BigDecimal netPnl;

    @Column(name = "order_ids", length = 1000)
    private String orderIds;

    @Enumerated(EnumType.STRING)
    @Column(name = "exit_reason", columnDefinition = "varchar(20)")
    private ExitReason exitReason;

    @Column(name = "opened_at")
    private LocalDateTime openedAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;
}
