package com.portfoliotrader.domain.model;

import com.portfoliotrader.domain.enums.Interval;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * OHLCV bar. {@code datetime} is the bar's open time.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Bar {

    private String instrument;
    private Interval interval;
    private LocalDateTime datetime;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private long volume;
    private BigDecimal openInterest;

    /**
     * Synthetic bar used to forward-fill a gap: open, high, low and close all equal
     * {@code price} and volume is zero.
     */
    public static Bar flat(String instrument, Interval interval, LocalDateTime datetime, BigDecimal price) {
        return Bar.builder()
                .instrument(instrument)
                .interval(interval)
                .datetime(datetime)
                .open(price)
                .high(price)
                .low(price)
                .close(price)
                .volume(0)
                .openInterest(BigDecimal.ZERO)
                .build();
    }
}
