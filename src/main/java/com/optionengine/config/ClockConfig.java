package com.optionengine.config;

import com.optionengine.calendar.MarketHoursConfig;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** System clock in the exchange's zone. Tests construct components with a fixed clock instead. */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(MarketHoursConfig marketHoursConfig) {
        return Clock.system(marketHoursConfig.getZone());
    }
}
