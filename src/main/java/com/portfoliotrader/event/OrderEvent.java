package com.portfoliotrader.event;

import com.portfoliotrader.domain.model.Order;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * A new status for an order this process placed. Published on the broker SDK's thread and
 * handed to the engine event thread by {@code EngineEventDispatcher}.
 */
@Getter
public class OrderEvent extends ApplicationEvent {

    private final Order order;

    public OrderEvent(Object source, Order order) {
        super(source);
        this.order = order;
    }
}
