package com.portfoliotrader.broker.kite;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.portfoliotrader.broker.kite.mapper.KiteOrderMapper;
import com.portfoliotrader.domain.model.Order;
import com.portfoliotrader.event.EventPublisherHelper;
import com.portfoliotrader.exception.BrokerException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Processes Kite websocket order updates for orders placed through this gateway.
 *
 * <p>Every accepted update is published as an {@link com.portfoliotrader.event.OrderEvent}.
 * When the filled quantity grows, the order's fills are fetched and each one is published
 * as a {@link com.portfoliotrader.event.TradeEvent}. Kite reports all fills of the order
 * each time, so fills seen before are published again; the engine drops them by trade id.
 *
 * <p>Safety guarantees:
 * <ul>
 *   <li>Updates for orders not placed here (manual orders, other apps) are ignored</li>
 *   <li>A terminal order (COMPLETE/REJECTED/CANCELLED) is never moved back to a working state</li>
 *   <li>An update that overtakes {@link #track} (a marketable order filling before the placement
 *       call returns) is held briefly and applied once the order is tracked</li>
 * </ul>
 *
 * <p>Working orders are held until they reach a terminal status; terminal orders are kept for
 * a day, then evicted.
 */
@Service
public class KiteOrderUpdateHandler {

    private static final Logger log = LoggerFactory.getLogger(KiteOrderUpdateHandler.class);

    private final KiteOrderMapper kiteOrderMapper;
    private final KiteOrderService kiteOrderService;
    private final EventPublisherHelper eventPublisherHelper;

    private static final Duration UNTRACKED_UPDATE_TTL = Duration.ofSeconds(30);
    private static final Duration CLOSED_ORDER_TTL = Duration.ofDays(1);
    private static final long MAX_CLOSED_ORDERS = 50_000;

    /** Last known state of working orders placed by this gateway, by Kite order id. */
    private final Map<String, Order> workingOrders = new ConcurrentHashMap<>();

    private final Cache<String, Order> closedOrders = Caffeine.newBuilder()
            .maximumSize(MAX_CLOSED_ORDERS)
            .expireAfterWrite(CLOSED_ORDER_TTL)
            .build();

    /** Latest update per order id not tracked yet. Updates for foreign orders simply expire. */
    private final Cache<String, com.zerodhatech.models.Order> untrackedUpdates = Caffeine.newBuilder()
            .maximumSize(MAX_CLOSED_ORDERS)
            .expireAfterWrite(UNTRACKED_UPDATE_TTL)
            .build();

    public KiteOrderUpdateHandler(
            KiteOrderMapper kiteOrderMapper,
            KiteOrderService kiteOrderService,
            EventPublisherHelper eventPublisherHelper) {
        this.kiteOrderMapper = kiteOrderMapper;
        this.kiteOrderService = kiteOrderService;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Starts tracking an order that was just placed and announces it, then applies any update
     * for it that arrived first.
     */
    public void track(Order order) {
        com.zerodhatech.models.Order early;
        synchronized (this) {
            store(order);
            early = untrackedUpdates.asMap().remove(order.getOrderId());
        }
        eventPublisherHelper.publishOrder(this, order);

        if (early != null) {
            log.info("Applying early update for orderId={}, status={}", early.orderId, early.status);
            handleOrderUpdate(early);
        }
    }

    public Optional<Order> getOrder(String orderId) {
        Order working = workingOrders.get(orderId);
        return working != null ? Optional.of(working) : Optional.ofNullable(closedOrders.getIfPresent(orderId));
    }

    /** Orders placed here that have not reached a terminal status. */
    public int getWorkingOrderCount() {
        return workingOrders.size();
    }

    /**
     * Called from the KiteTicker callback thread; safe to call from any thread.
     */
    public void handleOrderUpdate(com.zerodhatech.models.Order kiteOrder) {
        if (kiteOrder == null || kiteOrder.orderId == null) {
            log.warn("Received null order update or order with null orderId, ignoring");
            return;
        }

        Order existing;
        synchronized (this) {
            existing = getOrder(kiteOrder.orderId).orElse(null);
            if (existing == null) {
                untrackedUpdates.put(kiteOrder.orderId, kiteOrder);
            }
        }
        if (existing == null) {
            log.debug("Order update for untracked orderId={}, status={} held", kiteOrder.orderId, kiteOrder.status);
            return;
        }
        if (!existing.isActive()) {
            log.debug(
                    "Order {} already in terminal status {}, ignoring update to {}",
                    kiteOrder.orderId,
                    existing.getStatus(),
                    kiteOrder.status);
            return;
        }

        Order updated = kiteOrderMapper.applyUpdate(existing, kiteOrder);
        store(updated);
        eventPublisherHelper.publishOrder(this, updated);

        if (updated.getTraded() > existing.getTraded()) {
            log.info(
                    "Order filled: orderId={}, instrument={}, traded={}/{}",
                    updated.getOrderId(),
                    updated.getInstrument(),
                    updated.getTraded(),
                    updated.getVolume());
            publishTrades(updated);
        }
    }

    private void store(Order order) {
        if (order.isActive()) {
            workingOrders.put(order.getOrderId(), order);
        } else {
            workingOrders.remove(order.getOrderId());
            closedOrders.put(order.getOrderId(), order);
        }
    }

    private void publishTrades(Order order) {
        List<com.zerodhatech.models.Trade> kiteTrades;
        try {
            kiteTrades = kiteOrderService.getOrderTrades(order.getOrderId());
        } catch (BrokerException e) {
            log.error("Fill of order {} not applied, trade fetch failed: {}", order.getOrderId(), e.getMessage());
            return;
        }

        for (com.zerodhatech.models.Trade kiteTrade : kiteTrades) {
            eventPublisherHelper.publishTrade(this, kiteOrderMapper.toTrade(kiteTrade, order));
        }
    }
}
