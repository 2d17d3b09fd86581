package com.portfoliotrader.strategy;

import com.portfoliotrader.strategy.base.StrategyContext;
import com.portfoliotrader.strategy.base.StrategyTemplate;
import java.util.List;

/**
 * Builds a strategy instance. Usually a constructor reference, e.g.
 * {@code PairTradingStrategy::new}.
 */
@FunctionalInterface
public interface StrategyConstructor {

    StrategyTemplate create(StrategyContext context, String strategyName, List<String> instruments);
}
