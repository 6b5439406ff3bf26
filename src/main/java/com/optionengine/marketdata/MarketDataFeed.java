package com.optionengine.marketdata;

/**
 * Streaming price source. Ticks for subscribed instruments are published as
 * {@link com.optionengine.event.TickEvent}.
 */
public interface MarketDataFeed {

    void subscribe(long instrumentToken);

    void unsubscribe(long instrumentToken);
}
