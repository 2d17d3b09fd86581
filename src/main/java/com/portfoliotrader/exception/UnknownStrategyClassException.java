package com.portfoliotrader.exception;

import java.util.Map;

public class UnknownStrategyClassException extends BaseException {

    public UnknownStrategyClassException(String className) {
        super(
                ErrorCode.UNKNOWN_STRATEGY_CLASS,
                "Strategy class not registered: " + className,
                Map.of("className", className));
    }
}
