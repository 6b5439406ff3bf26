package com.optionengine.unit.calendar;

import static org.assertj.core.api.Assertions.assertThat;

import com.optionengine.calendar.MarketClock;
import com.optionengine.calendar.MarketHoursConfig;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MarketClockTest {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    /** A Monday. */
    private static final LocalDate MONDAY = LocalDate.of(2024, 12, 16);

    private MarketHoursConfig marketHoursConfig;

    @BeforeEach
    void setUp() {
        marketHoursConfig = new MarketHoursConfig();
    }

    private MarketClock clockAt(LocalDate date, int hour, int minute) {
        ZonedDateTime at = date.atTime(hour, minute).atZone(IST);
        return new MarketClock(marketHoursConfig, Clock.fixed(at.toInstant(), ZoneId.of("UTC")));
    }

    @Nested
    @DisplayName("Market hours")
    class MarketHours {

        @Test
        @DisplayName("Open between open and close on a weekday")
        void openDuringSession() {
            assertThat(clockAt(MONDAY, 10, 0).isMarketOpen()).isTrue();
            assertThat(clockAt(MONDAY, 9, 15).isMarketOpen()).isTrue();
            assertThat(clockAt(MONDAY, 15, 15).isMarketOpen()).isTrue();
        }

        @Test
        @DisplayName("Closed outside the session")
        void closedOutsideSession() {
            assertThat(clockAt(MONDAY, 9, 14).isMarketOpen()).isFalse();
            assertThat(clockAt(MONDAY, 15, 16).isMarketOpen()).isFalse();
        }

        @Test
        @DisplayName("Closed on weekends and holidays")
        void closedOnNonTradingDays() {
            assertThat(clockAt(MONDAY.minusDays(2), 10, 0).isMarketOpen()).isFalse();
            assertThat(clockAt(MONDAY.minusDays(1), 10, 0).isMarketOpen()).isFalse();

            marketHoursConfig.setHolidays(List.of(MONDAY));
            assertThat(clockAt(MONDAY, 10, 0).isMarketOpen()).isFalse();
            assertThat(clockAt(MONDAY, 10, 0).isTradingDay(MONDAY.plusDays(1))).isTrue();
        }
    }

    @Nested
    @DisplayName("Square-off")
    class Squareoff {

        @Test
        @DisplayName("Due from the square-off time onwards")
        void squareoffDue() {
            assertThat(clockAt(MONDAY, 15, 9).isSquareoffTime()).isFalse();
            assertThat(clockAt(MONDAY, 15, 10).isSquareoffTime()).isTrue();
            assertThat(clockAt(MONDAY, 15, 30).isSquareoffTime()).isTrue();
        }

        @Test
        @DisplayName("Reports time in the market zone whatever the clock zone")
        void marketZone() {
            MarketClock marketClock = clockAt(MONDAY, 0, 30);

            assertThat(marketClock.now().getZone()).isEqualTo(IST);
            assertThat(marketClock.today()).isEqualTo(MONDAY);
        }
    }
}
