package com.optionengine.session;

import com.optionengine.domain.enums.ExitReason;
import com.optionengine.exit.ExitController;
import com.optionengine.reporting.DailySummaryService;
import com.optionengine.risk.CapitalRiskGovernor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Ends the trading session when the application shuts down.
 *
 * <p>Runs in a high {@link SmartLifecycle} phase so that it stops before the schedulers,
 * the ticker and the data source. The shutdown sequence:
 * <ol>
 *   <li>Close every tracked position at market (reason SYSTEM_SHUTDOWN)</li>
 *   <li>Compute and store the daily summary</li>
 *   <li>Log the final risk state</li>
 * </ol>
 */
@Service
public class SessionLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycle.class);

    private final ExitController exitController;
    private final DailySummaryService dailySummaryService;
    private final CapitalRiskGovernor capitalRiskGovernor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public SessionLifecycle(
            ExitController exitController,
            DailySummaryService dailySummaryService,
            CapitalRiskGovernor capitalRiskGovernor) {
        this.exitController = exitController;
        this.dailySummaryService = dailySummaryService;
        this.capitalRiskGovernor = capitalRiskGovernor;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("Trading session started");
    }

    @Override
    public void stop() {
        log.info("Session shutdown initiated...");
        try {
            closeAll();
        } catch (RuntimeException e) {
            log.error("Error closing positions during shutdown", e);
        }
        try {
            dailySummaryService.saveTodaySummary();
        } catch (RuntimeException e) {
            log.error("Error writing the daily summary during shutdown", e);
        }
        log.info(
                "Session ended: realizedPnl={} tradingEnabled={} openPositions={}",
                capitalRiskGovernor.getRealizedPnl(),
                capitalRiskGovernor.canTakeNewTrade(),
                capitalRiskGovernor.getOpenPositionCount());
        running.set(false);
    }

    /** Closes every tracked position at market. Returns the number of exits started. */
    public int closeAll() {
        int closed = exitController.closeAllPositions(ExitReason.SYSTEM_SHUTDOWN);
        log.info("Closed {} positions (SYSTEM_SHUTDOWN)", closed);
        return closed;
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
