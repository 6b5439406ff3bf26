package com.optionengine.calendar;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import org.springframework.stereotype.Service;

/**
 * Market hours awareness over an injectable {@link Clock}.
 *
 * <p>The market is open on weekdays that are not configured holidays, between the open and
 * close times inclusive. Square-off is due from the square-off time onwards on any day.
 */
@Service
public class MarketClock {

    private final MarketHoursConfig marketHoursConfig;
    private final Clock clock;

    public MarketClock(MarketHoursConfig marketHoursConfig, Clock clock) {
        this.marketHoursConfig = marketHoursConfig;
        this.clock = clock;
    }

    public ZonedDateTime now() {
        return ZonedDateTime.now(clock).withZoneSameInstant(marketHoursConfig.getZone());
    }

    public LocalDate today() {
        return now().toLocalDate();
    }

    public boolean isMarketOpen() {
        return isMarketOpen(now());
    }

    public boolean isMarketOpen(ZonedDateTime dateTime) {
        ZonedDateTime local = dateTime.withZoneSameInstant(marketHoursConfig.getZone());
        if (!isTradingDay(local.toLocalDate())) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        return !time.isBefore(marketHoursConfig.getOpen()) && !time.isAfter(marketHoursConfig.getClose());
    }

    public boolean isSquareoffTime() {
        return isSquareoffTime(now());
    }

    public boolean isSquareoffTime(ZonedDateTime dateTime) {
        LocalTime time = dateTime.withZoneSameInstant(marketHoursConfig.getZone()).toLocalTime();
        return !time.isBefore(marketHoursConfig.getSquareoff());
    }

    public LocalTime squareoffTime() {
        return marketHoursConfig.getSquareoff();
    }

    public boolean isTradingDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        return !marketHoursConfig.getHolidays().contains(date);
    }
}
