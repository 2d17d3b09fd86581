package com.portfoliotrader.domain.enums;

public enum OrderType {
    LIMIT,
    MARKET,
    SL,
    SLM
}
