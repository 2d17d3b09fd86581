package com.portfoliotrader.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strategy engine settings, bound to {@code portfoliotrader.engine.*}.
 */
@ConfigurationProperties(prefix = "portfoliotrader.engine")
@Getter
@Setter
public class EngineProperties {

    /** Prefix of the order reference; the full reference is {@code prefix + "_" + strategyName}. */
    private String orderReferencePrefix = "PortfolioStrategy";

    /** Pending initializations allowed on the single init worker. */
    private int initQueueCapacity = 100;

    /**
     * Ticks allowed to wait for the event thread; newer ticks are dropped beyond it. Order and
     * trade updates are never dropped and do not count against it.
     */
    private int tickBacklogLimit = 100_000;

    /** Initialize every strategy in the roster once the application is ready. */
    private boolean autoInit = false;

    private TradeIdRetention tradeIdRetention = new TradeIdRetention();

    /**
     * How long applied trade ids are remembered for duplicate suppression. The defaults
     * remember every id for the life of the process.
     */
    @Getter
    @Setter
    public static class TradeIdRetention {

        /** Maximum remembered ids, oldest evicted first. 0 means unbounded. */
        private long maxSize = 0;

        /** Forget ids this long after they were applied. Null means never. */
        private Duration expireAfter;
    }
}
