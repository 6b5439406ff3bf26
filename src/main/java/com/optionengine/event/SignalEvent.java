package com.optionengine.event;

import com.optionengine.domain.enums.Signal;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/** An entry signal from the strategy, with the underlying spot price it was computed at. */
public class SignalEvent extends ApplicationEvent {

    private final Signal signal;
    private final BigDecimal spotPrice;

    public SignalEvent(Object source, Signal signal, BigDecimal spotPrice) {
        super(source);
        this.signal = signal;
        this.spotPrice = spotPrice;
    }

    public Signal getSignal() {
        return signal;
    }

    public BigDecimal getSpotPrice() {
        return spotPrice;
    }
}
