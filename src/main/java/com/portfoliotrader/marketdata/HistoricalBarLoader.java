package com.portfoliotrader.marketdata;

import com.portfoliotrader.domain.enums.Interval;
import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.HistoryRequest;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Loads history for a set of instruments and lines it up into one timeline.
 *
 * <p>Per instrument, the {@link HistoricalBarSource}s are tried in order (broker, datafeed,
 * local store) and the first non-empty result wins. A failing source is logged and skipped.
 * Bars fetched from a remote source are written through to the local store.
 *
 * <p>The merged timeline has one entry per distinct bar time. Once an instrument has produced
 * a bar, every later entry carries a bar for it: a gap is filled with a flat bar at the last
 * close. Instruments with no data yet are simply absent from the entry.
 */
@Component
public class HistoricalBarLoader {

    private static final Logger log = LoggerFactory.getLogger(HistoricalBarLoader.class);

    private final List<HistoricalBarSource> sources;
    private final LocalStoreHistoricalBarSource localStore;

    public HistoricalBarLoader(List<HistoricalBarSource> sources, LocalStoreHistoricalBarSource localStore) {
        this.sources = sources;
        this.localStore = localStore;
    }

    public List<Bar> loadBar(String instrument, Interval interval, LocalDateTime start, LocalDateTime end) {
        HistoryRequest request = HistoryRequest.builder()
                .instrument(instrument)
                .interval(interval)
                .start(start)
                .end(end)
                .build();

        for (HistoricalBarSource source : sources) {
            List<Bar> bars;
            try {
                bars = source.query(request);
            } catch (RuntimeException e) {
                log.warn("History source {} failed for {}: {}", source.getName(), instrument, e.getMessage());
                continue;
            }
            if (!bars.isEmpty()) {
                log.info("Loaded {} {} bars for {} from {}", bars.size(), interval, instrument, source.getName());
                if (source != localStore) {
                    writeThrough(bars);
                }
                return bars;
            }
        }

        log.info("No {} history found for {} between {} and {}", interval, instrument, start, end);
        return List.of();
    }

    /**
     * Merged, forward-filled timeline for {@code instruments}, oldest first. Each map is
     * keyed by instrument in the order given.
     */
    public List<Map<String, Bar>> loadBars(
            List<String> instruments, Interval interval, LocalDateTime start, LocalDateTime end) {
        TreeMap<LocalDateTime, Map<String, Bar>> history = new TreeMap<>();
        for (String instrument : instruments) {
            for (Bar bar : loadBar(instrument, interval, start, end)) {
                history.computeIfAbsent(bar.getDatetime(), k -> new HashMap<>()).put(instrument, bar);
            }
        }

        List<Map<String, Bar>> timeline = new ArrayList<>(history.size());
        Map<String, Bar> lastBars = new HashMap<>();
        for (Map.Entry<LocalDateTime, Map<String, Bar>> entry : history.entrySet()) {
            Map<String, Bar> slice = new LinkedHashMap<>();
            for (String instrument : instruments) {
                Bar bar = entry.getValue().get(instrument);
                if (bar != null) {
                    lastBars.put(instrument, bar);
                    slice.put(instrument, bar);
                } else if (lastBars.containsKey(instrument)) {
                    Bar previous = lastBars.get(instrument);
                    slice.put(instrument, Bar.flat(instrument, interval, entry.getKey(), previous.getClose()));
                }
            }
            timeline.add(slice);
        }
        return timeline;
    }

    private void writeThrough(List<Bar> bars) {
        try {
            localStore.save(bars);
        } catch (DataAccessException e) {
            log.warn("Could not store {} bars locally: {}", bars.size(), e.getMessage());
        }
    }
}
