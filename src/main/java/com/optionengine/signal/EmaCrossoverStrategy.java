package com.optionengine.signal;

import com.optionengine.calendar.MarketHoursConfig;
import com.optionengine.domain.enums.Signal;
import com.optionengine.domain.model.Candle;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

/**
 * Fast/slow EMA crossover on closed underlying candles.
 *
 * <p>BUY_CE when the fast EMA crosses above the slow one, BUY_PE when it crosses below. No
 * signal until the series holds more than {@code emaSlowPeriod} bars.
 */
@Component
public class EmaCrossoverStrategy {

    private static final Logger log = LoggerFactory.getLogger(EmaCrossoverStrategy.class);

    private final SignalConfig signalConfig;
    private final ZoneId zone;
    private final Duration barDuration;

    private BarSeries series;
    private EMAIndicator fastEma;
    private EMAIndicator slowEma;

    public EmaCrossoverStrategy(SignalConfig signalConfig, MarketHoursConfig marketHoursConfig) {
        this.signalConfig = signalConfig;
        this.zone = marketHoursConfig.getZone();
        this.barDuration = signalConfig.getCandleInterval();
        reset();
    }

    public synchronized Optional<Signal> onCandle(Candle candle) {
        if (candle == null || candle.getClose() == null) {
            return Optional.empty();
        }
        if (!series.isEmpty()
                && !candle.getCloseTime().atZone(zone).isAfter(series.getLastBar().getEndTime())) {
            log.debug("Candle {} not after last bar, ignored", candle.getCloseTime());
            return Optional.empty();
        }
        series.addBar(
                barDuration,
                candle.getCloseTime().atZone(zone),
                candle.getOpen(),
                candle.getHigh(),
                candle.getLow(),
                candle.getClose(),
                0);

        if (series.getBarCount() <= signalConfig.getEmaSlowPeriod()) {
            return Optional.empty();
        }
        int end = series.getEndIndex();
        double fastNow = fastEma.getValue(end).doubleValue();
        double slowNow = slowEma.getValue(end).doubleValue();
        double fastPrev = fastEma.getValue(end - 1).doubleValue();
        double slowPrev = slowEma.getValue(end - 1).doubleValue();

        Signal signal = null;
        if (fastPrev <= slowPrev && fastNow > slowNow) {
            signal = Signal.BUY_CE;
        } else if (fastPrev >= slowPrev && fastNow < slowNow) {
            signal = Signal.BUY_PE;
        }
        if (signal != null) {
            log.info(
                    "{} at close {}: fast {} -> {}, slow {} -> {}",
                    signal,
                    candle.getClose(),
                    fastPrev,
                    fastNow,
                    slowPrev,
                    slowNow);
        }
        return Optional.ofNullable(signal);
    }

    public synchronized int barCount() {
        return series.getBarCount();
    }

    public synchronized void reset() {
        series = new BaseBarSeriesBuilder()
                .withName(signalConfig.getUnderlyingName())
                .withMaxBarCount(signalConfig.getMaxBarCount())
                .build();
        ClosePriceIndicator closePrice = new ClosePriceIndicator(series);
        fastEma = new EMAIndicator(closePrice, signalConfig.getEmaFastPeriod());
        slowEma = new EMAIndicator(closePrice, signalConfig.getEmaSlowPeriod());
    }
}
