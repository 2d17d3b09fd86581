package com.portfoliotrader.event;

import com.portfoliotrader.domain.model.Tick;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * One market data update. Published from the ticker's callback thread, so listeners other
 * than the engine dispatcher must return quickly.
 */
@Getter
public class TickEvent extends ApplicationEvent {

    private final Tick tick;

    public TickEvent(Object source, Tick tick) {
        super(source);
        this.tick = tick;
    }
}
