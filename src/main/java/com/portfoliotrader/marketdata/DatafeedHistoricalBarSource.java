package com.portfoliotrader.marketdata;

import com.portfoliotrader.config.DatafeedConfig;
import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.HistoryRequest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * History from an external data service over HTTP.
 *
 * <p>Expects {@code GET /bars?instrument=&interval=&start=&end=} to answer with a JSON array of
 * bars in the same shape as {@link Bar}. Skipped entirely while the datafeed is disabled.
 */
@Component
@Order(2)
public class DatafeedHistoricalBarSource implements HistoricalBarSource {

    private static final Logger log = LoggerFactory.getLogger(DatafeedHistoricalBarSource.class);

    private static final ParameterizedTypeReference<List<Bar>> BAR_LIST = new ParameterizedTypeReference<>() {};

    private final DatafeedConfig datafeedConfig;
    private final RestClient datafeedRestClient;

    public DatafeedHistoricalBarSource(
            DatafeedConfig datafeedConfig, @Qualifier("datafeedRestClient") RestClient datafeedRestClient) {
        this.datafeedConfig = datafeedConfig;
        this.datafeedRestClient = datafeedRestClient;
    }

    @Override
    public String getName() {
        return "datafeed";
    }

    @Override
    public List<Bar> query(HistoryRequest request) {
        if (!datafeedConfig.isEnabled()) {
            return List.of();
        }

        List<Bar> bars = datafeedRestClient
                .get()
                .uri(uriBuilder -> uriBuilder
                        .path("/bars")
                        .queryParam("instrument", request.getInstrument())
                        .queryParam("interval", request.getInterval().name())
                        .queryParam("start", request.getStart())
                        .queryParam("end", request.getEnd())
                        .build())
                .retrieve()
                .body(BAR_LIST);

        if (bars == null) {
            return List.of();
        }
        log.debug("Datafeed returned {} bars for {}", bars.size(), request.getInstrument());
        return bars;
    }
}
