package com.portfoliotrader.exception;

import java.util.Map;

/**
 * Wraps an exception thrown from inside a strategy hook. Never propagated out of the
 * engine; it carries the strategy and hook name into the error log.
 */
public class StrategyCallbackException extends BaseException {

    public StrategyCallbackException(String strategyName, String hook, Throwable cause) {
        super(
                ErrorCode.STRATEGY_CALLBACK_FAULT,
                String.format("Strategy %s faulted in %s: %s", strategyName, hook, cause.getMessage()),
                Map.of("strategyName", strategyName, "hook", hook),
                cause);
    }
}
