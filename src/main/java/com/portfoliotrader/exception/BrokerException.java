package com.portfoliotrader.exception;

import java.util.Map;

/**
 * Failure reported by the broker, or raised while talking to it. The SDK's checked exceptions are
 * kept as the cause and their type is exposed in {@code details.cause}.
 */
public class BrokerException extends BaseException {

    public BrokerException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, Map.of("cause", cause.getClass().getSimpleName()), cause);
    }
}
