package com.optionengine.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/**
 * Session statistics over the EXIT trades of one day.
 * Loss figures are magnitudes. profitFactor is zero when there are no losing trades.
 */
@Data
@Builder
public class DailySummary {

    private LocalDate tradingDate;
    private int totalTrades;
    private int wins;
    private int losses;
    private BigDecimal winRate;
    private BigDecimal grossPnl;
    private BigDecimal grossProfit;
    private BigDecimal grossLoss;
    private BigDecimal averageWin;
    private BigDecimal averageLoss;
    private BigDecimal maxWin;
    private BigDecimal maxLoss;
    private BigDecimal profitFactor;
    private BigDecimal maxDrawdown;
}
