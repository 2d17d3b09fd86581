package com.portfoliotrader.broker.kite;

import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.Contract;
import com.portfoliotrader.domain.model.HistoryRequest;
import com.portfoliotrader.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.HistoricalData;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fetches historical candles from Kite. Requires the account's historical data add-on.
 *
 * <p>Kite allows 3 history requests per second, enforced by the {@code kiteHistory} limiter.
 */
@Service
public class KiteHistoryService {

    private static final Logger log = LoggerFactory.getLogger(KiteHistoryService.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    /** Kite candle timestamps, e.g. {@code 2024-03-01T09:15:00+0530}. */
    static final DateTimeFormatter CANDLE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

    private final KiteConnect kiteConnect;

    public KiteHistoryService(KiteConnect kiteConnect) {
        this.kiteConnect = kiteConnect;
    }

    @RateLimiter(name = "kiteHistory")
    @CircuitBreaker(name = "kiteApi")
    @Retry(name = "kiteApi")
    public List<Bar> getHistoricalBars(Contract contract, HistoryRequest request) {
        Date from = toDate(request.getStart());
        Date to = toDate(request.getEnd());
        String token = String.valueOf(contract.getBrokerToken());

        try {
            HistoricalData data = kiteConnect.getHistoricalData(
                    from, to, token, request.getInterval().getKiteInterval(), false, true);
            List<Bar> bars = toBars(request, data);
            log.debug("Fetched {} {} candles for {}", bars.size(), request.getInterval(), request.getInstrument());
            return bars;
        } catch (KiteException e) {
            log.error("Kite history request failed for {}: {}", request.getInstrument(), e.message);
            throw new BrokerException("History request failed: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("History request error for {}", request.getInstrument(), e);
            throw new BrokerException("History request error: " + e.getMessage(), e);
        }
    }

    List<Bar> toBars(HistoryRequest request, HistoricalData data) {
        if (data == null || data.dataArrayList == null) {
            return List.of();
        }

        List<Bar> bars = new ArrayList<>(data.dataArrayList.size());
        for (HistoricalData candle : data.dataArrayList) {
            bars.add(Bar.builder()
                    .instrument(request.getInstrument())
                    .interval(request.getInterval())
                    .datetime(parseTimestamp(candle.timeStamp))
                    .open(BigDecimal.valueOf(candle.open))
                    .high(BigDecimal.valueOf(candle.high))
                    .low(BigDecimal.valueOf(candle.low))
                    .close(BigDecimal.valueOf(candle.close))
                    .volume(candle.volume)
                    .openInterest(BigDecimal.valueOf(candle.oi))
                    .build());
        }
        return bars;
    }

    static LocalDateTime parseTimestamp(String timestamp) {
        return OffsetDateTime.parse(timestamp, CANDLE_TIMESTAMP)
                .atZoneSameInstant(IST)
                .toLocalDateTime();
    }

    private Date toDate(LocalDateTime dateTime) {
        return Date.from(dateTime.atZone(IST).toInstant());
    }
}
