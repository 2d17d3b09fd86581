package com.portfoliotrader.event;

import com.portfoliotrader.domain.model.Order;
import com.portfoliotrader.domain.model.StrategySnapshot;
import com.portfoliotrader.domain.model.Tick;
import com.portfoliotrader.domain.model.Trade;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed wrapper around Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Inbound market events (tick, order, trade) are published by the broker adapters and
 * picked up by {@link com.portfoliotrader.core.engine.EngineEventDispatcher}. Outbound
 * notifications (log, state) are published by the engine for presentation layers.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Inbound ----

    public void publishTick(Object source, Tick tick) {
        applicationEventPublisher.publishEvent(new TickEvent(source, tick));
    }

    public void publishOrder(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order));
    }

    public void publishTrade(Object source, Trade trade) {
        applicationEventPublisher.publishEvent(new TradeEvent(source, trade));
    }

    // ---- Notifications ----

    public void publishStrategyLog(Object source, String strategyName, String message) {
        applicationEventPublisher.publishEvent(new StrategyLogEvent(source, strategyName, message));
    }

    public void publishStrategyState(Object source, StrategySnapshot snapshot) {
        applicationEventPublisher.publishEvent(new StrategyStateEvent(source, snapshot));
    }
}
