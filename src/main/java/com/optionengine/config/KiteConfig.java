package com.optionengine.config;

import com.zerodhatech.kiteconnect.KiteConnect;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Kite Connect credentials and the shared SDK client, bound from {@code kite.*}.
 *
 * <p>The access token is obtained out of band (daily login) and supplied through
 * configuration. Without one, the REST client still exists but every call fails, and the
 * ticker stays disconnected.
 */
@Configuration
@ConfigurationProperties(prefix = "kite")
@Getter
@Setter
public class KiteConfig {

    private static final Logger log = LoggerFactory.getLogger(KiteConfig.class);

    private String apiKey;

    private String apiSecret;

    /** Session token for the current trading day. */
    private String accessToken;

    /** Ticker reconnection attempts before the feed is reported degraded. */
    private int maxReconnectRetries = 10;

    /** Upper bound, in seconds, of the ticker's reconnection backoff. */
    private int maxReconnectIntervalSeconds = 30;

    @Bean
    public KiteConnect kiteConnect() {
        log.info("Creating KiteConnect client with API key: {}", maskApiKey(apiKey));
        KiteConnect kiteConnect = new KiteConnect(apiKey);
        if (hasAccessToken()) {
            kiteConnect.setAccessToken(accessToken);
        }
        kiteConnect.setSessionExpiryHook(() -> log.warn("Kite session expired, a new access token is required"));
        return kiteConnect;
    }

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }

    private String maskApiKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }
}
