package com.portfoliotrader.broker.kite;

import com.portfoliotrader.config.KiteConfig;
import com.portfoliotrader.domain.model.Tick;
import com.portfoliotrader.event.EventPublisherHelper;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.ticker.KiteTicker;
import com.zerodhatech.ticker.OnConnect;
import com.zerodhatech.ticker.OnDisconnect;
import com.zerodhatech.ticker.OnError;
import com.zerodhatech.ticker.OnOrderUpdate;
import com.zerodhatech.ticker.OnTicks;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Manages the Kite websocket ticker: market data for subscribed instruments and order
 * updates for the account.
 *
 * <p>Each Kite tick is keyed back to its {@code EXCHANGE:TRADINGSYMBOL} instrument and
 * published as a {@link com.portfoliotrader.event.TickEvent}. Order updates go to
 * {@link KiteOrderUpdateHandler}.
 *
 * <p>Subscriptions made before the socket is up are remembered and sent on connect, and
 * again after every reconnect.
 */
@Service
public class KiteTickerService {

    private static final Logger log = LoggerFactory.getLogger(KiteTickerService.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    static final int MAX_RECONNECT_RETRIES = 10;

    static final int MAX_RECONNECT_INTERVAL_SECONDS = 30;

    private final KiteConfig kiteConfig;
    private final KiteInstrumentService kiteInstrumentService;
    private final KiteOrderUpdateHandler kiteOrderUpdateHandler;
    private final EventPublisherHelper eventPublisherHelper;

    private final Set<Long> subscribedTokens = ConcurrentHashMap.newKeySet();

    private volatile KiteTicker kiteTicker;
    private volatile boolean connected;

    public KiteTickerService(
            KiteConfig kiteConfig,
            KiteInstrumentService kiteInstrumentService,
            KiteOrderUpdateHandler kiteOrderUpdateHandler,
            EventPublisherHelper eventPublisherHelper) {
        this.kiteConfig = kiteConfig;
        this.kiteInstrumentService = kiteInstrumentService;
        this.kiteOrderUpdateHandler = kiteOrderUpdateHandler;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public void connect(String accessToken) {
        if (connected) {
            log.warn("Ticker already connected, ignoring connect request");
            return;
        }

        log.info("Connecting to Kite WebSocket...");
        kiteTicker = createTicker(accessToken);
        setupCallbacks();
        kiteTicker.setTryReconnection(true);

        try {
            kiteTicker.setMaximumRetries(MAX_RECONNECT_RETRIES);
            kiteTicker.setMaximumRetryInterval(MAX_RECONNECT_INTERVAL_SECONDS);
        } catch (KiteException e) {
            // KiteException extends Throwable, not Exception
            log.warn("Failed to configure ticker retry settings: {}", e.message);
        }

        kiteTicker.connect();
    }

    public void disconnect() {
        if (kiteTicker != null) {
            kiteTicker.disconnect();
            log.info("Kite ticker disconnected");
        }
        connected = false;
    }

    /** Subscribes in FULL mode. Repeated subscriptions of the same token are harmless. */
    public void subscribe(long instrumentToken) {
        if (!subscribedTokens.add(instrumentToken)) {
            return;
        }

        if (kiteTicker != null && connected) {
            ArrayList<Long> tokens = new ArrayList<>(List.of(instrumentToken));
            kiteTicker.subscribe(tokens);
            kiteTicker.setMode(tokens, KiteTicker.modeFull);
            log.info("Subscribed token {} (total: {})", instrumentToken, subscribedTokens.size());
        }
    }

    public boolean isConnected() {
        return connected;
    }

    public Set<Long> getSubscribedTokens() {
        return Set.copyOf(subscribedTokens);
    }

    KiteTicker createTicker(String accessToken) {
        // KiteTicker constructor order: (accessToken, apiKey)
        return new KiteTicker(accessToken, kiteConfig.getApiKey());
    }

    private void setupCallbacks() {
        kiteTicker.setOnConnectedListener(new OnConnect() {
            @Override
            public void onConnected() {
                onConnect();
            }
        });

        kiteTicker.setOnDisconnectedListener(new OnDisconnect() {
            @Override
            public void onDisconnected() {
                log.warn("Kite ticker disconnected");
                connected = false;
            }
        });

        kiteTicker.setOnTickerArrivalListener(new OnTicks() {
            @Override
            public void onTicks(ArrayList<com.zerodhatech.models.Tick> ticks) {
                KiteTickerService.this.onTicks(ticks);
            }
        });

        kiteTicker.setOnErrorListener(new OnError() {
            @Override
            public void onError(Exception exception) {
                log.error("Kite ticker error: {}", exception.getMessage());
            }

            @Override
            public void onError(KiteException kiteException) {
                log.error("Kite ticker KiteException: {}", kiteException.message);
            }

            @Override
            public void onError(String error) {
                log.error("Kite ticker error: {}", error);
            }
        });

        kiteTicker.setOnOrderUpdateListener(new OnOrderUpdate() {
            @Override
            public void onOrderUpdate(com.zerodhatech.models.Order order) {
                onKiteOrderUpdate(order);
            }
        });
    }

    private void onConnect() {
        log.info("Kite ticker connected");
        connected = true;

        if (!subscribedTokens.isEmpty()) {
            ArrayList<Long> tokens = new ArrayList<>(subscribedTokens);
            kiteTicker.subscribe(tokens);
            kiteTicker.setMode(tokens, KiteTicker.modeFull);
            log.info("Resubscribed {} instruments", tokens.size());
        }
    }

    /** Order update failures must not take down the socket, which also carries ticks. */
    private void onKiteOrderUpdate(com.zerodhatech.models.Order kiteOrder) {
        try {
            kiteOrderUpdateHandler.handleOrderUpdate(kiteOrder);
        } catch (RuntimeException e) {
            log.error(
                    "Error processing order update for orderId={}: {}",
                    kiteOrder != null ? kiteOrder.orderId : "null",
                    e.getMessage(),
                    e);
        }
    }

    void onTicks(List<com.zerodhatech.models.Tick> ticks) {
        for (com.zerodhatech.models.Tick kiteTick : ticks) {
            Optional<String> instrument = kiteInstrumentService.getInstrumentByToken(kiteTick.getInstrumentToken());
            if (instrument.isEmpty()) {
                log.debug("Tick for unknown token {} dropped", kiteTick.getInstrumentToken());
                continue;
            }
            eventPublisherHelper.publishTick(this, toTick(instrument.get(), kiteTick));
        }
    }

    private Tick toTick(String instrument, com.zerodhatech.models.Tick kiteTick) {
        return Tick.builder()
                .instrument(instrument)
                .lastPrice(BigDecimal.valueOf(kiteTick.getLastTradedPrice()))
                .volume((long) kiteTick.getVolumeTradedToday())
                .openInterest(BigDecimal.valueOf(kiteTick.getOi()))
                .timestamp(toLocalDateTime(kiteTick.getTickTimestamp()))
                .build();
    }

    private LocalDateTime toLocalDateTime(Date date) {
        if (date == null) {
            return LocalDateTime.now();
        }
        return date.toInstant().atZone(IST).toLocalDateTime();
    }
}
