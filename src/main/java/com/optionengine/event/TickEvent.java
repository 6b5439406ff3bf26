package com.optionengine.event;

import com.optionengine.domain.model.Tick;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every market data tick received from the feed.
 *
 * <p>The highest-frequency event in the system. MarketDataRouter is the only listener and
 * fans the tick out in a fixed order: simulator, exit controller, ledger mark, candles.
 */
public class TickEvent extends ApplicationEvent {

    private final Tick tick;

    public TickEvent(Object source, Tick tick) {
        super(source);
        this.tick = tick;
    }

    public Tick getTick() {
        return tick;
    }
}
