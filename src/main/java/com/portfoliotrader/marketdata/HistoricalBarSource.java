package com.portfoliotrader.marketdata;

import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.HistoryRequest;
import java.util.List;

/**
 * One provider of historical bars. {@link HistoricalBarLoader} tries the sources in
 * {@link org.springframework.core.annotation.Order} sequence and keeps the first non-empty answer.
 */
public interface HistoricalBarSource {

    String getName();

    /**
     * Bars for the request, oldest first.
     *
     * @return an empty list if this source cannot serve the request
     */
    List<Bar> query(HistoryRequest request);
}
