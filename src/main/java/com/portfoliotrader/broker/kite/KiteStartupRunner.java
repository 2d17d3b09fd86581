package com.portfoliotrader.broker.kite;

import com.portfoliotrader.config.KiteConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Connects the Kite ticker once the application is ready, if an access token is configured.
 * Without a token the gateway runs degraded: contract lookups and orders fail until the
 * process is restarted with a valid token.
 */
@Component
public class KiteStartupRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(KiteStartupRunner.class);

    private final KiteConfig kiteConfig;
    private final KiteTickerService kiteTickerService;

    public KiteStartupRunner(KiteConfig kiteConfig, KiteTickerService kiteTickerService) {
        this.kiteConfig = kiteConfig;
        this.kiteTickerService = kiteTickerService;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (!kiteConfig.hasAccessToken()) {
            log.warn("No Kite access token configured. Running degraded, no market data or orders.");
            return;
        }
        if (!kiteConfig.isTickerEnabled()) {
            log.info("Kite ticker disabled by configuration");
            return;
        }
        kiteTickerService.connect(kiteConfig.getAccessToken());
    }
}
