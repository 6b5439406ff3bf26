package com.optionengine.ledger;

import com.optionengine.domain.enums.ExitReason;
import com.optionengine.domain.model.AggregatePosition;
import com.optionengine.domain.model.Contract;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * In-memory ledger of aggregate positions per symbol.
 *
 * <p>Applies entry and exit fill deltas with quantity-weighted averaging and computes
 * realized, unrealized and net PnL. The ledger performs no deduplication: callers
 * deliver each fill delta exactly once. Every mutation is written through to the
 * {@link PositionStore}; a store failure is logged and the in-memory state stays
 * authoritative for the session.
 *
 * <p>At most one OPEN aggregate exists per symbol. Closed aggregates are kept in
 * {@code closedPositions} for the session summary.
 */
@Service
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final PositionStore positionStore;
    private final Clock clock;

    /** OPEN aggregates keyed by symbol. */
    private final Map<String, AggregatePosition> openPositions = new ConcurrentHashMap<>();

    private final List<AggregatePosition> closedPositions = new CopyOnWriteArrayList<>();

    public PositionLedger(PositionStore positionStore, Clock clock) {
        this.positionStore = positionStore;
        this.clock = clock;
    }

    public void applyEntryFill(Contract contract, String orderId, int quantity, BigDecimal fillPrice) {
        if (quantity <= 0) {
            log.warn("Ignoring entry fill with non-positive quantity {} for {}", quantity, orderId);
            return;
        }
        String symbol = contract.getSymbol();
        AggregatePosition position = openPositions.compute(symbol, (key, existing) -> {
            if (existing == null) {
                return AggregatePosition.open(contract, orderId, quantity, fillPrice, LocalDateTime.now(clock));
            }
            synchronized (existing) {
                existing.applyEntry(orderId, quantity, fillPrice);
            }
            return existing;
        });
        log.info(
                "Ledger entry {}: +{} @ {} -> open={} avg={}",
                symbol,
                quantity,
                fillPrice,
                position.getOpenQuantity(),
                position.getAverageEntryPrice());

        persist("entry fill " + orderId, () -> positionStore.applyEntryFill(contract, orderId, quantity, fillPrice));
    }

    /**
     * Applies an exit fill, clamped to the open quantity.
     *
     * @return the realized PnL of this fill, zero when no OPEN aggregate exists
     */
    public BigDecimal applyExitFill(
            Contract contract, String exitOrderId, int quantity, BigDecimal exitPrice, ExitReason reason) {
        String symbol = contract.getSymbol();
        BigDecimal[] realized = {BigDecimal.ZERO};
        AggregatePosition[] closed = {null};
        boolean[] applied = {false};

        openPositions.computeIfPresent(symbol, (key, existing) -> {
            applied[0] = true;
            if (quantity > existing.getOpenQuantity()) {
                log.warn(
                        "Exit of {} for {} exceeds open quantity {}, clamping",
                        quantity,
                        symbol,
                        existing.getOpenQuantity());
            }
            synchronized (existing) {
                realized[0] = existing.applyExit(exitOrderId, quantity, exitPrice, reason, LocalDateTime.now(clock));
            }
            if (!existing.isOpen()) {
                closed[0] = existing;
                return null;
            }
            return existing;
        });

        if (!applied[0]) {
            log.debug("No open aggregate for {}, exit fill ignored", symbol);
            return BigDecimal.ZERO;
        }
        if (closed[0] != null) {
            closedPositions.add(closed[0]);
            log.info(
                    "Ledger closed {}: realized={} avgEntry={} avgExit={} reason={}",
                    symbol,
                    closed[0].getRealizedPnl(),
                    closed[0].getAverageEntryPrice(),
                    closed[0].getAverageExitPrice(),
                    reason);
        }

        persist(
                "exit fill " + exitOrderId,
                () -> positionStore.applyExitFill(contract, exitOrderId, quantity, exitPrice, reason));
        return realized[0];
    }

    public void markToMarket(Contract contract, BigDecimal lastPrice) {
        AggregatePosition position = openPositions.get(contract.getSymbol());
        if (position == null) {
            return;
        }
        boolean marked;
        synchronized (position) {
            marked = position.markToMarket(lastPrice);
        }
        if (marked) {
            persist("mark " + contract.getSymbol(), () -> positionStore.markToMarket(contract, lastPrice));
        }
    }

    /** Marks every OPEN aggregate of the given instrument. Used on the tick path. */
    public void markToMarket(long instrumentToken, BigDecimal lastPrice) {
        for (AggregatePosition position : openPositions.values()) {
            if (position.getContract().getInstrumentToken() == instrumentToken) {
                markToMarket(position.getContract(), lastPrice);
            }
        }
    }

    public Optional<AggregatePosition> findOpen(String symbol) {
        AggregatePosition position = openPositions.get(symbol);
        if (position == null) {
            return Optional.empty();
        }
        synchronized (position) {
            return Optional.of(position.snapshot());
        }
    }

    public List<AggregatePosition> openPositions() {
        return openPositions.values().stream().map(this::snapshotOf).toList();
    }

    public List<AggregatePosition> closedPositions() {
        return closedPositions.stream().map(this::snapshotOf).toList();
    }

    /** Closed aggregates in closing order, followed by the open ones. */
    public List<AggregatePosition> allPositions() {
        List<AggregatePosition> all = new ArrayList<>(closedPositions());
        all.addAll(openPositions());
        return all;
    }

    public BigDecimal totalRealizedPnl() {
        BigDecimal total = BigDecimal.ZERO;
        for (AggregatePosition position : openPositions()) {
            total = total.add(position.getRealizedPnl());
        }
        for (AggregatePosition position : closedPositions) {
            total = total.add(position.getRealizedPnl());
        }
        return total;
    }

    private AggregatePosition snapshotOf(AggregatePosition position) {
        synchronized (position) {
            return position.snapshot();
        }
    }

    private void persist(String description, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.error("Position store write failed ({}), continuing with in-memory state", description, e);
        }
    }
}
