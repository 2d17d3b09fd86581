package com.portfoliotrader.strategy.support;

import com.portfoliotrader.domain.enums.Interval;
import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.Tick;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Aggregates ticks from several instruments into one-minute bars, and optionally minute bars
 * into longer window bars.
 *
 * <p>When the first tick of a new minute arrives, the bars of the finished minute are handed
 * to the callback together, one per instrument that ticked during that minute. Ticks older
 * than the current minute are dropped.
 *
 * <p>Window bars are built from the minute bars passed to {@link #updateBars}:
 * <ul>
 *   <li>{@link Interval#MINUTE}: a window closes on the bar whose minute plus one is a multiple of {@code window}</li>
 *   <li>{@link Interval#HOUR}: an hour closes on its :59 bar, or when a bar of a later hour arrives,
 *       and every {@code window} closed hours make one window bar</li>
 * </ul>
 * A window bar opens at the open time of its first bar.
 */
public class PortfolioBarGenerator {

    private final Consumer<Map<String, Bar>> onBars;

    private final Map<String, Bar> bars = new LinkedHashMap<>();
    private final Map<String, Long> lastVolumes = new HashMap<>();
    private LocalDateTime currentMinute;

    private final int window;
    private final Consumer<Map<String, Bar>> onWindowBars;
    private final Interval windowInterval;

    private final Map<String, Bar> hourBars = new LinkedHashMap<>();
    private final Map<String, Bar> windowBars = new LinkedHashMap<>();
    private LocalDateTime lastBarTime;
    private int closedHours;

    public PortfolioBarGenerator(Consumer<Map<String, Bar>> onBars) {
        this(onBars, 1, null, Interval.MINUTE);
    }

    public PortfolioBarGenerator(
            Consumer<Map<String, Bar>> onBars,
            int window,
            Consumer<Map<String, Bar>> onWindowBars,
            Interval windowInterval) {
        if (window < 1) {
            throw new IllegalArgumentException("Window must be at least 1, got " + window);
        }
        if (windowInterval != Interval.MINUTE && windowInterval != Interval.HOUR) {
            throw new IllegalArgumentException("Window bars are built in minutes or hours, not " + windowInterval);
        }
        this.onBars = onBars;
        this.window = window;
        this.onWindowBars = onWindowBars;
        this.windowInterval = windowInterval;
    }

    public void updateTick(Tick tick) {
        if (tick.getLastPrice() == null || tick.getTimestamp() == null) {
            return;
        }

        LocalDateTime minute = tick.getTimestamp().truncatedTo(ChronoUnit.MINUTES);
        if (currentMinute != null && minute.isBefore(currentMinute)) {
            return;
        }
        if (currentMinute != null && minute.isAfter(currentMinute)) {
            flush();
        }
        currentMinute = minute;

        // tick volume is cumulative for the day
        Long lastVolume = lastVolumes.put(tick.getInstrument(), tick.getVolume());
        long volumeDelta = lastVolume == null ? 0 : Math.max(0, tick.getVolume() - lastVolume);

        Bar bar = bars.get(tick.getInstrument());
        if (bar == null) {
            bars.put(
                    tick.getInstrument(),
                    Bar.builder()
                            .instrument(tick.getInstrument())
                            .interval(Interval.MINUTE)
                            .datetime(minute)
                            .open(tick.getLastPrice())
                            .high(tick.getLastPrice())
                            .low(tick.getLastPrice())
                            .close(tick.getLastPrice())
                            .volume(volumeDelta)
                            .openInterest(tick.getOpenInterest())
                            .build());
        } else {
            bar.setHigh(bar.getHigh().max(tick.getLastPrice()));
            bar.setLow(bar.getLow().min(tick.getLastPrice()));
            bar.setClose(tick.getLastPrice());
            bar.setVolume(bar.getVolume() + volumeDelta);
            bar.setOpenInterest(tick.getOpenInterest());
        }
    }

    /** Emits the bars of the current minute, if any, without waiting for the next tick. */
    public void flush() {
        if (bars.isEmpty()) {
            return;
        }
        Map<String, Bar> finished = new LinkedHashMap<>(bars);
        bars.clear();
        onBars.accept(finished);
    }

    /** Feeds one minute's bars into the window aggregation. */
    public void updateBars(Map<String, Bar> minuteBars) {
        if (onWindowBars == null) {
            throw new IllegalStateException("No window callback configured");
        }
        if (minuteBars.isEmpty()) {
            return;
        }

        LocalDateTime time = minuteBars.values().iterator().next().getDatetime();
        if (windowInterval == Interval.MINUTE) {
            minuteBars.values().forEach(bar -> merge(windowBars, bar, bar.getDatetime()));
            if ((time.getMinute() + 1) % window == 0) {
                emitWindow();
            }
            return;
        }

        LocalDateTime hour = time.truncatedTo(ChronoUnit.HOURS);
        // the previous hour had no :59 bar
        if (lastBarTime != null && hour.isAfter(lastBarTime.truncatedTo(ChronoUnit.HOURS)) && !hourBars.isEmpty()) {
            closeHour();
        }
        minuteBars.values().forEach(bar -> merge(hourBars, bar, hour));
        if (time.getMinute() == 59) {
            closeHour();
        }
        lastBarTime = time;
    }

    private void closeHour() {
        hourBars.values().forEach(bar -> merge(windowBars, bar, bar.getDatetime()));
        hourBars.clear();
        closedHours++;
        if (closedHours % window == 0) {
            emitWindow();
        }
    }

    private void emitWindow() {
        if (windowBars.isEmpty()) {
            return;
        }
        Map<String, Bar> finished = new LinkedHashMap<>(windowBars);
        windowBars.clear();
        onWindowBars.accept(finished);
    }

    private void merge(Map<String, Bar> target, Bar bar, LocalDateTime openTime) {
        Bar merged = target.get(bar.getInstrument());
        if (merged == null) {
            target.put(bar.getInstrument(), bar.toBuilder().interval(windowInterval).datetime(openTime).build());
            return;
        }
        merged.setHigh(merged.getHigh().max(bar.getHigh()));
        merged.setLow(merged.getLow().min(bar.getLow()));
        merged.setClose(bar.getClose());
        merged.setVolume(merged.getVolume() + bar.getVolume());
        merged.setOpenInterest(bar.getOpenInterest());
    }
}
