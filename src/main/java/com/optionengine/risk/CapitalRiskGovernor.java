package com.optionengine.risk;

import com.optionengine.broker.Broker;
import com.optionengine.domain.enums.SizingMode;
import com.optionengine.domain.model.OpenPosition;
import com.optionengine.event.RiskEvent;
import com.optionengine.event.RiskEventType;
import com.optionengine.event.RiskLevel;
import com.optionengine.margin.PositionSizerFactory;
import com.optionengine.margin.PositionSizingContext;
import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Tracks session capital and realized PnL, sizes new entries and owns the daily-loss
 * kill switch.
 *
 * <p>Opening capital is read lazily from the broker on first use. The kill switch is a
 * one-way latch: once {@code |realizedPnl| >= maxDailyLoss} trading stays disabled for the
 * rest of the session even if PnL later recovers.
 *
 * <p>Never throws on missing downstream data. A failed balance query counts as zero
 * capital and is retried on the next call.
 */
@Service
public class CapitalRiskGovernor {

    private static final Logger log = LoggerFactory.getLogger(CapitalRiskGovernor.class);

    private final Broker broker;
    private final RiskConfig riskConfig;
    private final PositionSizerFactory positionSizerFactory;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final AtomicBoolean tradingEnabled = new AtomicBoolean(true);
    private final Map<String, OpenPosition> openPositions = new ConcurrentHashMap<>();

    private BigDecimal openingCapital;
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    public CapitalRiskGovernor(
            Broker broker,
            RiskConfig riskConfig,
            PositionSizerFactory positionSizerFactory,
            ApplicationEventPublisher applicationEventPublisher) {
        this.broker = broker;
        this.riskConfig = riskConfig;
        this.positionSizerFactory = positionSizerFactory;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /** Opening capital plus realized PnL, floored at zero. */
    public synchronized BigDecimal availableCapital() {
        if (openingCapital == null) {
            try {
                openingCapital = broker.getAccountBalance();
                log.info("Opening capital captured: {}", openingCapital);
            } catch (RuntimeException e) {
                log.warn("Could not read account balance, treating capital as zero: {}", e.getMessage());
                return BigDecimal.ZERO;
            }
        }
        return openingCapital.add(realizedPnl).max(BigDecimal.ZERO);
    }

    public boolean canTakeNewTrade() {
        return tradingEnabled.get();
    }

    /**
     * Sizes an order for the configured mode name.
     *
     * @throws com.optionengine.exception.InvalidConfigurationException for unknown modes
     */
    public int sizeOrder(BigDecimal entryPrice, int lotSize, String mode, BigDecimal value) {
        if (entryPrice == null || entryPrice.signum() <= 0) {
            return 0;
        }
        return sizeOrder(entryPrice, lotSize, SizingMode.fromConfig(mode), value);
    }

    public int sizeOrder(BigDecimal entryPrice, int lotSize, SizingMode mode, BigDecimal value) {
        if (entryPrice == null || entryPrice.signum() <= 0) {
            return 0;
        }
        PositionSizingContext context = PositionSizingContext.builder()
                .entryPrice(entryPrice)
                .lotSize(lotSize)
                .value(value)
                .availableCapital(mode == SizingMode.PERCENT ? availableCapital() : BigDecimal.ZERO)
                .build();
        int quantity = positionSizerFactory.getSizer(mode).calculateQuantity(context);
        log.debug("Sized {} @ {} (lot {}) -> {}", mode, entryPrice, lotSize, quantity);
        return quantity;
    }

    /** Sizes with the configured mode and value. */
    public int sizeOrder(BigDecimal entryPrice, int lotSize) {
        return sizeOrder(entryPrice, lotSize, riskConfig.getSizingMode(), riskConfig.getSizingValue());
    }

    public void onPositionOpened(String orderId, OpenPosition position) {
        openPositions.put(orderId, position);
    }

    /**
     * Books {@code (exitPrice - entryPrice) * quantity} into realized PnL and trips the
     * kill switch when the daily limit is reached. The entry price comes from the caller so
     * that the ledger and the governor agree on it.
     *
     * @return the PnL booked for this close
     */
    public BigDecimal onPositionClosed(String orderId, BigDecimal exitPrice, int quantity, BigDecimal entryPrice) {
        if (openPositions.remove(orderId) == null) {
            log.debug("Close for unregistered order {}, booking PnL anyway", orderId);
        }
        BigDecimal pnl = exitPrice.subtract(entryPrice).multiply(BigDecimal.valueOf(quantity));

        BigDecimal cumulative;
        synchronized (this) {
            realizedPnl = realizedPnl.add(pnl);
            cumulative = realizedPnl;
        }
        log.info("Position {} closed: pnl={} realized={}", orderId, pnl, cumulative);

        if (cumulative.abs().compareTo(riskConfig.getMaxDailyLoss()) >= 0 && tradingEnabled.compareAndSet(true, false)) {
            log.error(
                    "KILL SWITCH: realized PnL {} reached daily limit {}, new trades disabled",
                    cumulative,
                    riskConfig.getMaxDailyLoss());
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.KILL_SWITCH_TRIGGERED,
                    RiskLevel.CRITICAL,
                    "Daily loss limit reached",
                    Map.of("realizedPnl", cumulative, "maxDailyLoss", riskConfig.getMaxDailyLoss())));
        }
        return pnl;
    }

    public synchronized BigDecimal getRealizedPnl() {
        return realizedPnl;
    }

    public int getOpenPositionCount() {
        return openPositions.size();
    }
}
