package com.optionengine.event;

import com.optionengine.domain.model.Candle;
import org.springframework.context.ApplicationEvent;

/** Published by the candle aggregator when an underlying bar closes. */
public class CandleCloseEvent extends ApplicationEvent {

    private final Candle candle;

    public CandleCloseEvent(Object source, Candle candle) {
        super(source);
        this.candle = candle;
    }

    public Candle getCandle() {
        return candle;
    }
}
