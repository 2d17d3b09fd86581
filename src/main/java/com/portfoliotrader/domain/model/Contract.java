package com.portfoliotrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Static metadata for a tradable instrument.
 */
@Data
@Builder
public class Contract {

    private String instrument;
    private String symbol;
    private String exchange;
    private String name;

    /** Minimum price increment. Order prices are rounded to a multiple of it. */
    private BigDecimal tickSize;

    /** Minimum tradable quantity. Order volumes are rounded to a multiple of it. */
    private int lotSize;

    /** Gateway that lists the contract; cancel requests go back to it. */
    private String gateway;

    /** Whether the gateway serves historical bars for this contract. */
    private boolean historyData;

    /** Broker-side numeric token (Kite instrument_token), used for ticker subscriptions. */
    private Long brokerToken;
}
