package com.portfoliotrader.config;

import com.zerodhatech.kiteconnect.KiteConnect;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties and the shared {@link KiteConnect} client, bound to {@code kite.*}.
 *
 * <p>The access token is issued daily by Zerodha's login flow outside this process and
 * supplied through configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "kite")
@Getter
@Setter
public class KiteConfig {

    private static final Logger log = LoggerFactory.getLogger(KiteConfig.class);

    /** Kite Connect API key (from Zerodha developer console). */
    private String apiKey;

    /** Access token for the current trading day. */
    private String accessToken;

    /** Product type for every order (NRML carries overnight, MIS is intraday). */
    private String product = "NRML";

    /** Whether the account has the historical data add-on. */
    private boolean historyEnabled = false;

    /** Connect the websocket ticker on startup. */
    private boolean tickerEnabled = true;

    @Bean
    public KiteConnect kiteConnect() {
        log.info("Creating KiteConnect bean with API key: {}...", maskApiKey(apiKey));
        KiteConnect kiteConnect = new KiteConnect(apiKey);
        if (accessToken != null && !accessToken.isBlank()) {
            kiteConnect.setAccessToken(accessToken);
        }
        kiteConnect.setSessionExpiryHook(() -> log.warn("Kite session expired (detected by SDK SessionExpiryHook)"));
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
