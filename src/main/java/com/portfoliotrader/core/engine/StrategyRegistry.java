package com.portfoliotrader.core.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.portfoliotrader.config.EngineProperties;
import com.portfoliotrader.exception.DuplicateStrategyNameException;
import com.portfoliotrader.strategy.base.StrategyTemplate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Component;

/**
 * Owns every strategy instance and the lookup indices over them.
 *
 * <p>Indices:
 * <ul>
 *   <li><b>byInstrument</b>: instrument → strategies trading it, in registration order.
 *       Built once per strategy from its fixed instrument list.</li>
 *   <li><b>byOrderId</b>: order id → owning strategy. Filled as orders are placed, purged
 *       when the strategy is removed.</li>
 *   <li><b>seenTradeIds</b>: trade ids already applied. Retention is configurable through
 *       {@link EngineProperties.TradeIdRetention}; by default every id is kept.</li>
 * </ul>
 *
 * <p>The indices hold references only; {@link #unregister} drops a strategy from all of
 * them together.
 */
@Component
public class StrategyRegistry {

    private final Map<String, StrategyTemplate> strategies = new ConcurrentHashMap<>();
    private final Map<String, CopyOnWriteArrayList<StrategyTemplate>> byInstrument = new ConcurrentHashMap<>();
    private final Map<String, StrategyTemplate> byOrderId = new ConcurrentHashMap<>();
    private final Cache<String, Boolean> seenTradeIds;

    public StrategyRegistry(EngineProperties engineProperties) {
        EngineProperties.TradeIdRetention retention = engineProperties.getTradeIdRetention();
        Caffeine<Object, Object> builder = Caffeine.newBuilder();
        if (retention.getMaxSize() > 0) {
            builder.maximumSize(retention.getMaxSize());
        }
        if (retention.getExpireAfter() != null) {
            builder.expireAfterWrite(retention.getExpireAfter());
        }
        this.seenTradeIds = builder.build();
    }

    /**
     * Adds a strategy and indexes it under each of its instruments.
     *
     * @throws DuplicateStrategyNameException if the name is taken
     */
    public void register(StrategyTemplate strategy) {
        if (strategies.putIfAbsent(strategy.getStrategyName(), strategy) != null) {
            throw new DuplicateStrategyNameException(strategy.getStrategyName());
        }
        for (String instrument : strategy.getInstruments()) {
            byInstrument
                    .computeIfAbsent(instrument, k -> new CopyOnWriteArrayList<>())
                    .add(strategy);
        }
    }

    /**
     * Removes a strategy with its instrument and order-id index entries.
     *
     * @return the removed strategy, or empty if the name was unknown
     */
    public Optional<StrategyTemplate> unregister(String strategyName) {
        StrategyTemplate strategy = strategies.remove(strategyName);
        if (strategy == null) {
            return Optional.empty();
        }

        for (String instrument : strategy.getInstruments()) {
            List<StrategyTemplate> subscribers = byInstrument.get(instrument);
            if (subscribers != null) {
                subscribers.remove(strategy);
                if (subscribers.isEmpty()) {
                    byInstrument.remove(instrument);
                }
            }
        }
        byOrderId.values().removeIf(owner -> owner == strategy);
        return Optional.of(strategy);
    }

    public boolean contains(String strategyName) {
        return strategies.containsKey(strategyName);
    }

    public Optional<StrategyTemplate> find(String strategyName) {
        return Optional.ofNullable(strategies.get(strategyName));
    }

    public List<StrategyTemplate> getAll() {
        return new ArrayList<>(strategies.values());
    }

    public int size() {
        return strategies.size();
    }

    /** Strategies trading the instrument, in registration order. Empty if none. */
    public List<StrategyTemplate> getStrategiesForInstrument(String instrument) {
        List<StrategyTemplate> subscribers = byInstrument.get(instrument);
        return subscribers != null ? subscribers : List.of();
    }

    public void bindOrderId(String orderId, StrategyTemplate strategy) {
        byOrderId.put(orderId, strategy);
    }

    public Optional<StrategyTemplate> findByOrderId(String orderId) {
        return Optional.ofNullable(byOrderId.get(orderId));
    }

    /**
     * Records a trade id as applied.
     *
     * @return true the first time an id is seen, false for a repeat within the retention window
     */
    public boolean markTradeSeen(String tradeId) {
        return seenTradeIds.asMap().putIfAbsent(tradeId, Boolean.TRUE) == null;
    }
}
