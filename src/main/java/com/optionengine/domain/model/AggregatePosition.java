package com.optionengine.domain.model;

import com.optionengine.domain.enums.ExitReason;
import com.optionengine.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Net position in one symbol, built up from entry fills and reduced by exit fills.
 *
 * <p>Invariant: {@code openQuantity == openedQuantity - closedQuantity >= 0}. Entry and exit
 * averages are quantity-weighted over every contributing fill. The status moves to CLOSED
 * exactly when the open quantity reaches zero and never reopens; a later entry in the same
 * symbol starts a new aggregate.
 *
 * <p>The fill arithmetic lives here so the in-memory ledger and the durable store share it.
 */
@Data
@Builder(toBuilder = true)
public class AggregatePosition {

    public static final int PRICE_SCALE = 6;

    private Long id;
    private Contract contract;
    private PositionStatus status;
    private int openQuantity;
    private int openedQuantity;
    private int closedQuantity;
    private BigDecimal averageEntryPrice;
    private BigDecimal averageExitPrice;
    private BigDecimal lastPrice;

    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal netPnl = BigDecimal.ZERO;

    @Builder.Default
    private List<String> orderIds = new ArrayList<>();

    private ExitReason exitReason;
    private LocalDateTime openedAt;
    private LocalDateTime closedAt;

    /** Starts a new OPEN aggregate with the given fill as its baseline. */
    public static AggregatePosition open(
            Contract contract, String orderId, int quantity, BigDecimal fillPrice, LocalDateTime time) {
        AggregatePosition position = AggregatePosition.builder()
                .contract(contract)
                .status(PositionStatus.OPEN)
                .openedAt(time)
                .build();
        position.applyEntry(orderId, quantity, fillPrice);
        return position;
    }

    /**
     * Merges an entry fill into the weighted-average entry price.
     *
     * @return false if the quantity was not positive and nothing changed
     */
    public boolean applyEntry(String orderId, int quantity, BigDecimal fillPrice) {
        if (quantity <= 0) {
            return false;
        }
        BigDecimal fillQty = BigDecimal.valueOf(quantity);
        if (openQuantity == 0 || averageEntryPrice == null) {
            averageEntryPrice = fillPrice;
        } else {
            BigDecimal existingCost = averageEntryPrice.multiply(BigDecimal.valueOf(openQuantity));
            averageEntryPrice = existingCost
                    .add(fillPrice.multiply(fillQty))
                    .divide(BigDecimal.valueOf(openQuantity + quantity), PRICE_SCALE, RoundingMode.HALF_UP);
        }
        openQuantity += quantity;
        openedQuantity += quantity;
        if (orderId != null && !orderIds.contains(orderId)) {
            orderIds.add(orderId);
        }
        recomputePnl();
        return true;
    }

    /**
     * Applies an exit fill, clamped to the open quantity.
     *
     * @return the realized PnL of this fill (zero if nothing was open)
     */
    public BigDecimal applyExit(
            String exitOrderId, int quantity, BigDecimal exitPrice, ExitReason reason, LocalDateTime time) {
        int clamped = Math.min(Math.max(quantity, 0), openQuantity);
        if (clamped == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal clampedQty = BigDecimal.valueOf(clamped);
        BigDecimal pnl = exitPrice.subtract(averageEntryPrice).multiply(clampedQty);

        if (closedQuantity == 0 || averageExitPrice == null) {
            averageExitPrice = exitPrice;
        } else {
            averageExitPrice = averageExitPrice
                    .multiply(BigDecimal.valueOf(closedQuantity))
                    .add(exitPrice.multiply(clampedQty))
                    .divide(BigDecimal.valueOf(closedQuantity + clamped), PRICE_SCALE, RoundingMode.HALF_UP);
        }

        closedQuantity += clamped;
        openQuantity = openedQuantity - closedQuantity;
        realizedPnl = realizedPnl.add(pnl);
        lastPrice = exitPrice;
        if (exitOrderId != null && !orderIds.contains(exitOrderId)) {
            orderIds.add(exitOrderId);
        }

        if (openQuantity == 0) {
            status = PositionStatus.CLOSED;
            exitReason = reason;
            closedAt = time;
        }
        recomputePnl();
        return pnl;
    }

    /**
     * Updates the mark price. No-op without a known entry price.
     *
     * @return true if the mark was applied
     */
    public boolean markToMarket(BigDecimal price) {
        if (averageEntryPrice == null || price == null) {
            return false;
        }
        lastPrice = price;
        recomputePnl();
        return true;
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public AggregatePosition snapshot() {
        return toBuilder().orderIds(new ArrayList<>(orderIds)).build();
    }

    private void recomputePnl() {
        if (lastPrice != null && averageEntryPrice != null && openQuantity > 0) {
            unrealizedPnl = lastPrice.subtract(averageEntryPrice).multiply(BigDecimal.valueOf(openQuantity));
        } else {
            unrealizedPnl = BigDecimal.ZERO;
        }
        netPnl = realizedPnl.add(unrealizedPnl);
    }
}
