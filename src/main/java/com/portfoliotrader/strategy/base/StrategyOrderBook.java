package com.portfoliotrader.strategy.base;

import com.portfoliotrader.domain.model.Order;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Orders submitted by one strategy: the last known snapshot per order id, plus the ids
 * that have not yet reached a terminal status.
 *
 * <p>An id leaves the active set exactly once, on the first terminal update seen for it.
 */
public class StrategyOrderBook {

    private final Map<String, Order> orders = new ConcurrentHashMap<>();
    private final Set<String> activeOrderIds = Collections.synchronizedSet(new LinkedHashSet<>());

    public void addActive(String orderId) {
        activeOrderIds.add(orderId);
    }

    /**
     * Stores the snapshot and drops the id from the active set if the order is terminal.
     *
     * @return true if this update removed the id from the active set
     */
    public boolean update(Order order) {
        orders.put(order.getOrderId(), order);
        if (!order.isActive()) {
            return activeOrderIds.remove(order.getOrderId());
        }
        return false;
    }

    public boolean isActive(String orderId) {
        return activeOrderIds.contains(orderId);
    }

    public List<String> getActiveOrderIds() {
        synchronized (activeOrderIds) {
            return new ArrayList<>(activeOrderIds);
        }
    }

    public Optional<Order> getOrder(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    public List<Order> getOrders() {
        return new ArrayList<>(orders.values());
    }
}
