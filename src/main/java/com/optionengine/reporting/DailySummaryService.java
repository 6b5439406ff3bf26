package com.optionengine.reporting;

import com.optionengine.calendar.MarketClock;
import com.optionengine.domain.enums.TradeType;
import com.optionengine.domain.model.DailySummary;
import com.optionengine.domain.model.TradeRecord;
import com.optionengine.exception.PersistenceFailureException;
import com.optionengine.ledger.PositionStore;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes the end-of-day statistics from the EXIT trades of a trading date.
 *
 * <p>Trades are walked in execution order. A trade with positive PnL is a win, negative a
 * loss; zero counts toward the total only. Max drawdown is the largest fall of the
 * cumulative PnL curve, starting at zero, below its running peak.
 */
@Service
public class DailySummaryService {

    private static final Logger log = LoggerFactory.getLogger(DailySummaryService.class);

    private static final int SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PositionStore positionStore;
    private final MarketClock marketClock;

    public DailySummaryService(PositionStore positionStore, MarketClock marketClock) {
        this.positionStore = positionStore;
        this.marketClock = marketClock;
    }

    public DailySummary summarize(LocalDate tradingDate) {
        List<TradeRecord> exits = positionStore.findTrades(tradingDate).stream()
                .filter(trade -> trade.getTradeType() == TradeType.EXIT)
                .sorted(Comparator.comparing(TradeRecord::getExecutedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();

        int wins = 0;
        int losses = 0;
        BigDecimal grossProfit = BigDecimal.ZERO;
        BigDecimal grossLoss = BigDecimal.ZERO;
        BigDecimal maxWin = BigDecimal.ZERO;
        BigDecimal maxLoss = BigDecimal.ZERO;
        BigDecimal equity = BigDecimal.ZERO;
        BigDecimal peak = BigDecimal.ZERO;
        BigDecimal maxDrawdown = BigDecimal.ZERO;

        for (TradeRecord trade : exits) {
            BigDecimal pnl = Objects.requireNonNullElse(trade.getPnl(), BigDecimal.ZERO);
            if (pnl.signum() > 0) {
                wins++;
                grossProfit = grossProfit.add(pnl);
                maxWin = maxWin.max(pnl);
            } else if (pnl.signum() < 0) {
                losses++;
                grossLoss = grossLoss.add(pnl.abs());
                maxLoss = maxLoss.max(pnl.abs());
            }
            equity = equity.add(pnl);
            peak = peak.max(equity);
            maxDrawdown = maxDrawdown.max(peak.subtract(equity));
        }

        int total = exits.size();
        return DailySummary.builder()
                .tradingDate(tradingDate)
                .totalTrades(total)
                .wins(wins)
                .losses(losses)
                .winRate(total == 0 ? zero() : ratio(BigDecimal.valueOf(wins).multiply(HUNDRED), total))
                .grossProfit(scaled(grossProfit))
                .grossLoss(scaled(grossLoss))
                .grossPnl(scaled(grossProfit.subtract(grossLoss)))
                .averageWin(wins == 0 ? zero() : ratio(grossProfit, wins))
                .averageLoss(losses == 0 ? zero() : ratio(grossLoss, losses))
                .maxWin(scaled(maxWin))
                .maxLoss(scaled(maxLoss))
                .profitFactor(grossLoss.signum() == 0 ? zero() : grossProfit.divide(grossLoss, SCALE, RoundingMode.HALF_UP))
                .maxDrawdown(scaled(maxDrawdown))
                .build();
    }

    /**
     * Summarizes the current trading date and stores the result. A storage failure is
     * logged and the computed summary is still returned.
     */
    public DailySummary saveTodaySummary() {
        DailySummary summary = summarize(marketClock.today());
        try {
            positionStore.saveDailySummary(summary);
            log.info(
                    "Daily summary saved for {}: trades={} wins={} losses={} grossPnl={} maxDrawdown={}",
                    summary.getTradingDate(),
                    summary.getTotalTrades(),
                    summary.getWins(),
                    summary.getLosses(),
                    summary.getGrossPnl(),
                    summary.getMaxDrawdown());
        } catch (PersistenceFailureException e) {
            log.error("Failed to save daily summary for {}: {}", summary.getTradingDate(), e.getMessage(), e);
        }
        return summary;
    }

    /** The stored summary for a past date, or a fresh computation when none was saved. */
    public DailySummary findOrSummarize(LocalDate tradingDate) {
        return positionStore.findDailySummary(tradingDate).orElseGet(() -> summarize(tradingDate));
    }

    private BigDecimal ratio(BigDecimal numerator, int denominator) {
        return numerator.divide(BigDecimal.valueOf(denominator), SCALE, RoundingMode.HALF_UP);
    }

    private BigDecimal scaled(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    private BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }
}
