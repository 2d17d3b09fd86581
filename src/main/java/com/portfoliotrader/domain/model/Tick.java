package com.portfoliotrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Market data tick for one instrument.
 *
 * <p>{@code instrument} is the opaque instrument key ({@code EXCHANGE:TRADINGSYMBOL} for Kite).
 * The engine routes on it and never parses it.
 */
@Data
@Builder
public class Tick {

    private String instrument;
    private BigDecimal lastPrice;
    private long volume;
    private BigDecimal openInterest;
    private LocalDateTime timestamp;
}
