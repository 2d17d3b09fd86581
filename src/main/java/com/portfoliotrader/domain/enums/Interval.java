package com.portfoliotrader.domain.enums;

import java.time.Duration;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Bar interval. {@code kiteInterval} is the token the Kite historical API expects.
 */
@Getter
@RequiredArgsConstructor
public enum Interval {
    MINUTE("minute", Duration.ofMinutes(1)),
    FIVE_MINUTE("5minute", Duration.ofMinutes(5)),
    HOUR("60minute", Duration.ofHours(1)),
    DAILY("day", Duration.ofDays(1));

    private final String kiteInterval;
    private final Duration duration;
}
