package com.optionengine.broker;

import com.optionengine.calendar.MarketHoursConfig;
import com.optionengine.config.KiteConfig;
import com.optionengine.domain.model.Tick;
import com.optionengine.event.TickEvent;
import com.optionengine.marketdata.MarketDataFeed;
import com.optionengine.signal.SignalConfig;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Order;
import com.zerodhatech.ticker.KiteTicker;
import com.zerodhatech.ticker.OnError;
import jakarta.annotation.PreDestroy;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * {@link MarketDataFeed} over the Kite WebSocket ticker.
 *
 * <p>Ticks are mapped to the engine's {@link Tick} and published as {@link TickEvent}s on
 * the ticker thread. Order updates from the same socket go to
 * {@link KiteOrderUpdateHandler}. The underlying index is always part of the subscription
 * set, and the whole set is sent again after every (re)connect.
 *
 * <p>The ticker connects once the application is ready, and only when an access token is
 * configured. Subscriptions made before that are queued.
 */
@Service
public class KiteMarketDataFeed implements MarketDataFeed {

    private static final Logger log = LoggerFactory.getLogger(KiteMarketDataFeed.class);

    private final KiteConfig kiteConfig;
    private final SignalConfig signalConfig;
    private final MarketHoursConfig marketHoursConfig;
    private final KiteOrderUpdateHandler kiteOrderUpdateHandler;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Set<Long> tokens = ConcurrentHashMap.newKeySet();
    private final AtomicInteger droppedConnections = new AtomicInteger();

    private volatile KiteTicker ticker;
    private volatile boolean live;

    public KiteMarketDataFeed(
            KiteConfig kiteConfig,
            SignalConfig signalConfig,
            MarketHoursConfig marketHoursConfig,
            KiteOrderUpdateHandler kiteOrderUpdateHandler,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.kiteConfig = kiteConfig;
        this.signalConfig = signalConfig;
        this.marketHoursConfig = marketHoursConfig;
        this.kiteOrderUpdateHandler = kiteOrderUpdateHandler;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        tokens.add(signalConfig.getUnderlyingToken());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!kiteConfig.hasAccessToken()) {
            log.warn("kite.access-token is empty; ticks will not stream until a token is configured");
            return;
        }
        open();
    }

    /** Opens the socket. Ignored while the feed is live. */
    public void open() {
        if (live) {
            return;
        }
        KiteTicker newTicker = new KiteTicker(kiteConfig.getAccessToken(), kiteConfig.getApiKey());
        newTicker.setOnConnectedListener(this::onSocketUp);
        newTicker.setOnDisconnectedListener(this::onSocketDown);
        newTicker.setOnTickerArrivalListener(this::onTicks);
        newTicker.setOnOrderUpdateListener(this::onOrderUpdate);
        newTicker.setOnErrorListener(new OnError() {
            @Override
            public void onError(Exception exception) {
                log.error("Ticker socket error", exception);
            }

            @Override
            public void onError(KiteException kiteException) {
                log.error("Ticker API error {}: {}", kiteException.code, kiteException.message);
            }

            @Override
            public void onError(String error) {
                log.error("Ticker error: {}", error);
            }
        });
        newTicker.setTryReconnection(true);
        try {
            newTicker.setMaximumRetries(kiteConfig.getMaxReconnectRetries());
            newTicker.setMaximumRetryInterval(kiteConfig.getMaxReconnectIntervalSeconds());
        } catch (KiteException e) {
            log.warn("Ticker reconnect limits rejected, using library defaults: {}", e.message);
        }
        ticker = newTicker;
        log.info("Opening ticker socket for {} instruments", tokens.size());
        newTicker.connect();
    }

    @PreDestroy
    public void close() {
        live = false;
        KiteTicker current = ticker;
        ticker = null;
        if (current == null) {
            return;
        }
        try {
            current.disconnect();
        } catch (RuntimeException e) {
            log.warn("Ticker did not close cleanly: {}", e.getMessage());
        }
    }

    @Override
    public void subscribe(long instrumentToken) {
        if (tokens.add(instrumentToken)) {
            send(List.of(instrumentToken));
        }
    }

    @Override
    public void unsubscribe(long instrumentToken) {
        if (instrumentToken == signalConfig.getUnderlyingToken() || !tokens.remove(instrumentToken)) {
            return;
        }
        KiteTicker current = ticker;
        if (live && current != null) {
            current.unsubscribe(new ArrayList<>(List.of(instrumentToken)));
        }
    }

    /** Whether the socket is up and streaming. */
    public boolean isLive() {
        return live;
    }

    public Set<Long> subscriptions() {
        return Set.copyOf(tokens);
    }

    /** Ticker callback. Zero-priced ticks are pre-open noise and are skipped. */
    public void onTicks(List<com.zerodhatech.models.Tick> kiteTicks) {
        for (com.zerodhatech.models.Tick kiteTick : kiteTicks) {
            if (kiteTick.getLastTradedPrice() <= 0) {
                continue;
            }
            try {
                eventPublisher.publishEvent(new TickEvent(this, toTick(kiteTick)));
            } catch (RuntimeException e) {
                log.error("Tick listener failed for token {}", kiteTick.getInstrumentToken(), e);
            }
        }
    }

    /** Ticker callback. A failing update must not close the socket that also carries ticks. */
    public void onOrderUpdate(Order kiteOrder) {
        try {
            kiteOrderUpdateHandler.handleOrderUpdate(kiteOrder);
        } catch (RuntimeException e) {
            log.error("Order update {} could not be applied", kiteOrder != null ? kiteOrder.orderId : null, e);
        }
    }

    void onSocketUp() {
        live = true;
        droppedConnections.set(0);
        log.info("Ticker socket up");
        send(tokens);
    }

    void onSocketDown() {
        live = false;
        int drops = droppedConnections.incrementAndGet();
        if (drops >= kiteConfig.getMaxReconnectRetries()) {
            log.error("Ticker socket down {} times in a row, market data is degraded", drops);
        } else {
            log.warn("Ticker socket down (drop {}), library will reconnect", drops);
        }
    }

    private void send(Collection<Long> instrumentTokens) {
        KiteTicker current = ticker;
        if (!live || current == null || instrumentTokens.isEmpty()) {
            return;
        }
        ArrayList<Long> batch = new ArrayList<>(instrumentTokens);
        current.subscribe(batch);
        current.setMode(batch, KiteTicker.modeFull);
        log.info("Subscribed {} tokens in full mode ({} tracked)", batch.size(), tokens.size());
    }

    private Tick toTick(com.zerodhatech.models.Tick kiteTick) {
        Date tickTime = kiteTick.getTickTimestamp();
        LocalDateTime timestamp = tickTime != null
                ? LocalDateTime.ofInstant(tickTime.toInstant(), marketHoursConfig.getZone())
                : LocalDateTime.now(clock.withZone(marketHoursConfig.getZone()));
        return Tick.builder()
                .instrumentToken(kiteTick.getInstrumentToken())
                .lastPrice(BigDecimal.valueOf(kiteTick.getLastTradedPrice()))
                .timestamp(timestamp)
                .build();
    }
}
