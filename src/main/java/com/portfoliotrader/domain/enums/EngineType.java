package com.portfoliotrader.domain.enums;

public enum EngineType {
    LIVE,
    BACKTESTING
}
