package com.portfoliotrader.broker.kite;

import com.portfoliotrader.config.KiteConfig;
import com.portfoliotrader.domain.model.Contract;
import com.portfoliotrader.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Instrument;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Contract master for Kite, keyed by {@code EXCHANGE:TRADINGSYMBOL}.
 *
 * <p>The instrument dump is fetched on first lookup and cached for the process. A failed
 * fetch is logged and retried on the next lookup.
 */
@Service
public class KiteInstrumentService {

    private static final Logger log = LoggerFactory.getLogger(KiteInstrumentService.class);

    private final KiteConnect kiteConnect;
    private final KiteConfig kiteConfig;

    private final Map<String, Contract> contracts = new ConcurrentHashMap<>();
    private final Map<Long, String> instrumentsByToken = new ConcurrentHashMap<>();

    public KiteInstrumentService(KiteConnect kiteConnect, KiteConfig kiteConfig) {
        this.kiteConnect = kiteConnect;
        this.kiteConfig = kiteConfig;
    }

    public Optional<Contract> getContract(String instrument) {
        ensureLoaded();
        return Optional.ofNullable(contracts.get(instrument));
    }

    /** Reverse lookup used to key incoming ticks. */
    public Optional<String> getInstrumentByToken(long instrumentToken) {
        ensureLoaded();
        return Optional.ofNullable(instrumentsByToken.get(instrumentToken));
    }

    public int getContractCount() {
        return contracts.size();
    }

    private void ensureLoaded() {
        if (!contracts.isEmpty()) {
            return;
        }
        synchronized (this) {
            if (!contracts.isEmpty()) {
                return;
            }
            try {
                load(fetchInstruments());
            } catch (BrokerException e) {
                log.error("Instrument master unavailable: {}", e.getMessage());
            }
        }
    }

    void load(List<Instrument> instruments) {
        for (Instrument instrument : instruments) {
            String key = instrument.exchange + ":" + instrument.tradingsymbol;
            contracts.put(key, toContract(key, instrument));
            instrumentsByToken.put(instrument.instrument_token, key);
        }
        log.info("Loaded {} Kite contracts", contracts.size());
    }

    List<Instrument> fetchInstruments() {
        try {
            return kiteConnect.getInstruments();
        } catch (KiteException e) {
            throw new BrokerException("Failed to fetch instruments: " + e.message, e);
        } catch (JSONException | IOException e) {
            throw new BrokerException("Error fetching instruments: " + e.getMessage(), e);
        }
    }

    private Contract toContract(String key, Instrument instrument) {
        return Contract.builder()
                .instrument(key)
                .symbol(instrument.tradingsymbol)
                .exchange(instrument.exchange)
                .name(instrument.name)
                .tickSize(BigDecimal.valueOf(instrument.tick_size))
                .lotSize(Math.max(instrument.lot_size, 1))
                .gateway(KiteBrokerGateway.GATEWAY_NAME)
                .historyData(kiteConfig.isHistoryEnabled())
                .brokerToken(instrument.instrument_token)
                .build();
    }
}
