package com.portfoliotrader.event;

import com.portfoliotrader.domain.model.StrategySnapshot;
import org.springframework.context.ApplicationEvent;

/**
 * Full snapshot of a strategy after a lifecycle transition, parameter edit or
 * strategy-requested refresh.
 */
public class StrategyStateEvent extends ApplicationEvent {

    private final StrategySnapshot snapshot;

    public StrategyStateEvent(Object source, StrategySnapshot snapshot) {
        super(source);
        this.snapshot = snapshot;
    }

    public StrategySnapshot getSnapshot() {
        return snapshot;
    }
}
