package com.optionengine.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the daily_summary table. One row per trading date. */
@Entity
@Table(name = "daily_summary")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailySummaryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trading_date", unique = true, nullable = false)
    private LocalDate tradingDate;

    @Column(name = "total_trades")
    private int totalTrades;

    private int wins;
    private int losses;

    @Column(name = "win_rate", precision = 7, scale = 2)
    private BigDecimal winRate;

    @Column(name = "gross_pnl", precision = 15, scale = 2)
    private BigDecimal grossPnl;

    @Column(name = "gross_profit", precision = 15, scale = 2)
    private BigDecimal grossProfit;

    @Column(name = "gross_loss", precision = 15, scale = 2)
    private BigDecimal grossLoss;

    @Column(name = "average_win", precision = 15, scale = 2)
    private BigDecimal averageWin;

    @Column(name = "average_loss", precision = 15, scale = 2)
    private BigDecimal averageLoss;

    @Column(name = "max_win", precision = 15, scale = 2)
    private BigDecimal maxWin;

    @Column(name = "max_loss", precision = 15, scale = 2)
    private BigDecimal maxLoss;

    @Column(name = "profit_factor", precision = 10, scale = 2)
    private BigDecimal profitFactor;

    @Column(name = "max_drawdown", precision = 15, scale = 2)
    private BigDecimal maxDrawdown;
}
