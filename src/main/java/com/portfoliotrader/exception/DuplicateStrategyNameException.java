package com.portfoliotrader.exception;

import java.util.Map;

public class DuplicateStrategyNameException extends BaseException {

    public DuplicateStrategyNameException(String strategyName) {
        super(
                ErrorCode.DUPLICATE_STRATEGY_NAME,
                "Strategy name already in use: " + strategyName,
                Map.of("strategyName", strategyName));
    }
}
