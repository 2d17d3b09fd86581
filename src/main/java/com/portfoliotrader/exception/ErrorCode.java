package com.portfoliotrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    UNKNOWN_STRATEGY_CLASS("UNKNOWN_STRATEGY_CLASS", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONTRACT_NOT_FOUND("CONTRACT_NOT_FOUND", 404),
    DUPLICATE_STRATEGY_NAME("DUPLICATE_STRATEGY_NAME", 409),
    INVALID_LIFECYCLE_TRANSITION("INVALID_LIFECYCLE_TRANSITION", 409),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    STRATEGY_CALLBACK_FAULT("STRATEGY_CALLBACK_FAULT", 500),
    BROKER_ERROR("BROKER_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
