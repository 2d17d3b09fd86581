package com.portfoliotrader.strategy.base;

import com.portfoliotrader.domain.enums.Direction;
import com.portfoliotrader.domain.enums.EngineType;
import com.portfoliotrader.domain.enums.Interval;
import com.portfoliotrader.domain.enums.Offset;
import java.math.BigDecimal;
import java.util.List;

/**
 * Services the hosting engine provides to a strategy. Implemented by
 * {@link com.portfoliotrader.core.engine.StrategyEngine}; a backtester would provide its own.
 */
public interface StrategyContext {

    /**
     * Places an order on behalf of {@code strategy}.
     *
     * @return the gateway order ids, possibly several when the request is split, empty if nothing was submitted
     */
    List<String> sendOrder(
            StrategyTemplate strategy,
            String instrument,
            Direction direction,
            Offset offset,
            BigDecimal price,
            int volume,
            boolean lock,
            boolean net);

    void cancelOrder(StrategyTemplate strategy, String orderId);

    /** Tick size of the instrument, or null if the contract is unknown. */
    BigDecimal getPricetick(StrategyTemplate strategy, String instrument);

    /** Lot size of the instrument, or null if the contract is unknown. */
    Integer getSize(StrategyTemplate strategy, String instrument);

    /** Replays {@code days} of history through {@link StrategyTemplate#onBars}. */
    void loadBars(StrategyTemplate strategy, int days, Interval interval);

    void writeLog(String message, StrategyTemplate strategy);

    void putStrategyEvent(StrategyTemplate strategy);

    void syncStrategyData(StrategyTemplate strategy);

    EngineType getEngineType();
}
