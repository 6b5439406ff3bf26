package com.optionengine.ledger;

import com.optionengine.domain.enums.ExitReason;
import com.optionengine.domain.model.Contract;
import com.optionengine.domain.model.DailySummary;
import com.optionengine.domain.model.Order;
import com.optionengine.domain.model.TradeRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Durable counterpart of the {@link PositionLedger} plus the append-only order, trade and
 * daily-summary records consumed by reporting.
 *
 * <p>Implementations wrap storage errors in
 * {@link com.optionengine.exception.PersistenceFailureException}; callers log and continue.
 */
public interface PositionStore {

    // ---- Aggregate positions ----

    void applyEntryFill(Contract contract, String orderId, int quantity, BigDecimal fillPrice);

    void applyExitFill(Contract contract, String exitOrderId, int quantity, BigDecimal exitPrice, ExitReason reason);

    void markToMarket(Contract contract, BigDecimal lastPrice);

    // ---- Records ----

    /** Inserts or updates the order record by id. */
    void recordOrder(Order order);

    void recordTrade(TradeRecord tradeRecord);

    List<TradeRecord> findTrades(LocalDate tradingDate);

    void saveDailySummary(DailySummary dailySummary);

    Optional<DailySummary> findDailySummary(LocalDate tradingDate);
}
