package com.portfoliotrader.event;

import java.time.LocalDateTime;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Engine or strategy log line meant for presentation layers. {@code strategyName} is
 * null for engine-wide messages.
 */
@Getter
public class StrategyLogEvent extends ApplicationEvent {

    private final String strategyName;
    private final String message;
    private final LocalDateTime time;

    public StrategyLogEvent(Object source, String strategyName, String message) {
        super(source);
        this.strategyName = strategyName;
        this.message = message;
        this.time = LocalDateTime.now();
    }
}
