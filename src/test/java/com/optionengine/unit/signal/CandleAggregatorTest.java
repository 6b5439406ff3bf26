package com.optionengine.unit.signal;

import static org.assertj.core.api.Assertions.assertThat;

import com.optionengine.calendar.MarketHoursConfig;
import com.optionengine.domain.model.Candle;
import com.optionengine.domain.model.Tick;
import com.optionengine.signal.CandleAggregator;
import com.optionengine.signal.SignalConfig;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CandleAggregatorTest {

    private static final long NIFTY = 256265L;
    private static final LocalDateTime NINE_FIFTEEN = LocalDateTime.of(2024, 12, 16, 9, 15);

    private CandleAggregator candleAggregator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-12-16T03:45:00Z"), ZoneId.of("Asia/Kolkata"));
        candleAggregator = new CandleAggregator(new SignalConfig(), new MarketHoursConfig(), clock);
    }

    private Optional<Candle> tick(int secondsAfterOpen, String price) {
        return candleAggregator.onTick(Tick.builder()
                .instrumentToken(NIFTY)
                .lastPrice(new BigDecimal(price))
                .timestamp(NINE_FIFTEEN.plusSeconds(secondsAfterOpen))
                .build());
    }

    @Nested
    @DisplayName("Bucketing")
    class Bucketing {

        @Test
        @DisplayName("Closes the candle on the first tick of the next minute")
        void closesOnNextBucket() {
            assertThat(tick(0, "24000")).isEmpty();
            assertThat(tick(20, "24030")).isEmpty();
            assertThat(tick(40, "23990")).isEmpty();
            assertThat(tick(59, "24010")).isEmpty();

            Candle candle = tick(60, "24020").orElseThrow();

            assertThat(candle.getOpen()).isEqualByComparingTo("24000");
            assertThat(candle.getHigh()).isEqualByComparingTo("24030");
            assertThat(candle.getLow()).isEqualByComparingTo("23990");
            assertThat(candle.getClose()).isEqualByComparingTo("24010");
            assertThat(candle.getOpenTime()).isEqualTo(NINE_FIFTEEN);
            assertThat(candle.getCloseTime()).isEqualTo(NINE_FIFTEEN.plusMinutes(1));
            assertThat(candle.getInstrumentToken()).isEqualTo(NIFTY);
        }

        @Test
        @DisplayName("Starts the next candle from the closing tick")
        void nextCandleStarts() {
            tick(0, "24000");
            tick(60, "24020");

            Candle second = tick(125, "24040").orElseThrow();

            assertThat(second.getOpen()).isEqualByComparingTo("24020");
            assertThat(second.getClose()).isEqualByComparingTo("24020");
            assertThat(second.getOpenTime()).isEqualTo(NINE_FIFTEEN.plusMinutes(1));
        }

        @Test
        @DisplayName("Ignores ticks for an already closed bucket")
        void lateTick() {
            tick(0, "24000");
            tick(60, "24020");

            assertThat(tick(30, "25000")).isEmpty();
            Candle candle = tick(120, "24030").orElseThrow();
            assertThat(candle.getHigh()).isEqualByComparingTo("24020");
        }

        @Test
        @DisplayName("Ignores ticks without a positive price")
        void nonPositivePrice() {
            tick(0, "24000");

            assertThat(tick(10, "0")).isEmpty();
            Candle candle = tick(60, "24010").orElseThrow();
            assertThat(candle.getLow()).isEqualByComparingTo("24000");
        }

        @Test
        @DisplayName("Forgets the candle in progress on reset")
        void reset() {
            tick(0, "24000");
            candleAggregator.reset();

            assertThat(tick(60, "24010")).isEmpty();
        }
    }
}
