package com.optionengine.calendar;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Session timings, bound from {@code engine.market.*}. Times are local to {@code zone}.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "engine.market")
public class MarketHoursConfig {

    @NotNull
    private LocalTime open = LocalTime.of(9, 15);

    @NotNull
    private LocalTime close = LocalTime.of(15, 15);

    @NotNull
    private LocalTime squareoff = LocalTime.of(15, 10);

    @NotNull
    private ZoneId zone = ZoneId.of("Asia/Kolkata");

    /** Exchange holidays on which the market stays closed. */
    private List<LocalDate> holidays = new ArrayList<>();
}
