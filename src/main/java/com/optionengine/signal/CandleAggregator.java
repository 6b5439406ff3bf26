package com.optionengine.signal;

import com.optionengine.calendar.MarketHoursConfig;
import com.optionengine.domain.model.Candle;
import com.optionengine.domain.model.Tick;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Aggregates underlying ticks into fixed-interval candles.
 *
 * <p>A tick belongs to bucket {@code epochSecond - epochSecond % interval}. The first tick of
 * a new bucket closes and returns the previous candle; the candle in progress is never
 * emitted early.
 */
@Component
public class CandleAggregator {

    private static final Logger log = LoggerFactory.getLogger(CandleAggregator.class);

    private final long intervalSeconds;
    private final ZoneId zone;
    private final Clock clock;

    private Candle current;
    private long currentBucket = -1;

    public CandleAggregator(SignalConfig signalConfig, MarketHoursConfig marketHoursConfig, Clock clock) {
        this.intervalSeconds = signalConfig.getCandleInterval().toSeconds();
        this.zone = marketHoursConfig.getZone();
        this.clock = clock;
    }

    /** @return the candle that this tick closed, if any */
    public synchronized Optional<Candle> onTick(Tick tick) {
        BigDecimal price = tick.getLastPrice();
        if (price == null || price.signum() <= 0) {
            return Optional.empty();
        }
        LocalDateTime time = tick.getTimestamp() != null ? tick.getTimestamp() : LocalDateTime.now(clock);
        long epochSecond = time.atZone(zone).toEpochSecond();
        long bucket = epochSecond - epochSecond % intervalSeconds;

        if (current == null) {
            start(tick.getInstrumentToken(), bucket, price);
            return Optional.empty();
        }
        if (bucket == currentBucket) {
            current.setHigh(current.getHigh().max(price));
            current.setLow(current.getLow().min(price));
            current.setClose(price);
            return Optional.empty();
        }
        if (bucket < currentBucket) {
            log.debug("Late tick at {} for closed bucket, ignored", time);
            return Optional.empty();
        }

        Candle closed = current;
        start(tick.getInstrumentToken(), bucket, price);
        log.debug(
                "Candle closed {} O={} H={} L={} C={}",
                closed.getOpenTime(),
                closed.getOpen(),
                closed.getHigh(),
                closed.getLow(),
                closed.getClose());
        return Optional.of(closed);
    }

    public synchronized void reset() {
        current = null;
        currentBucket = -1;
    }

    private void start(long instrumentToken, long bucket, BigDecimal price) {
        currentBucket = bucket;
        current = Candle.builder()
                .instrumentToken(instrumentToken)
                .open(price)
                .high(price)
                .low(price)
                .close(price)
                .openTime(toLocal(bucket))
                .closeTime(toLocal(bucket + intervalSeconds))
                .build();
    }

    private LocalDateTime toLocal(long epochSecond) {
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSecond), zone);
    }
}
