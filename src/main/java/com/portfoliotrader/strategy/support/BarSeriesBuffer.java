package com.portfoliotrader.strategy.support;

import com.portfoliotrader.domain.model.Bar;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;

/**
 * Rolling ta4j {@link BarSeries} fed with strategy bars, for indicator calculation.
 *
 * <p>Holds at most {@code maxBars} bars; older ones are dropped by the series. Bar times are
 * exchange local time (IST). A bar that does not end after the last one held is skipped.
 *
 * <p>Not thread-safe. Strategies feed it from the engine event thread only.
 */
public class BarSeriesBuffer {

    private static final Logger log = LoggerFactory.getLogger(BarSeriesBuffer.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final BarSeries series;
    private final Duration barDuration;

    public BarSeriesBuffer(String name, Duration barDuration, int maxBars) {
        this.barDuration = barDuration;
        this.series = new BaseBarSeriesBuilder()
                .withName(name)
                .withMaxBarCount(maxBars)
                .build();
    }

    /** @return false if the bar was out of order and skipped */
    public boolean add(Bar bar) {
        return add(
                bar.getDatetime(),
                bar.getOpen().doubleValue(),
                bar.getHigh().doubleValue(),
                bar.getLow().doubleValue(),
                bar.getClose().doubleValue(),
                bar.getVolume());
    }

    /** Adds a derived value (a spread, a ratio) as a flat bar opening at {@code time}. */
    public boolean addValue(LocalDateTime time, double value) {
        return add(time, value, value, value, value, 0);
    }

    private boolean add(LocalDateTime openTime, double open, double high, double low, double close, long volume) {
        ZonedDateTime endTime = openTime.plus(barDuration).atZone(IST);
        if (!series.isEmpty() && !endTime.isAfter(series.getLastBar().getEndTime())) {
            log.debug("Out of order bar for {} at {} skipped", series.getName(), openTime);
            return false;
        }
        series.addBar(barDuration, endTime, open, high, low, close, volume);
        return true;
    }

    public BarSeries getSeries() {
        return series;
    }

    public int getBarCount() {
        return series.getBarCount();
    }

    public int getEndIndex() {
        return series.getEndIndex();
    }
}
