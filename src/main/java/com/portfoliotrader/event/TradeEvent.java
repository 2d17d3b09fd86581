package com.portfoliotrader.event;

import com.portfoliotrader.domain.model.Trade;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published for each fill reported by the gateway. The same trade may be published
 * more than once; the engine drops repeats by trade id.
 */
@Getter
public class TradeEvent extends ApplicationEvent {

    private final Trade trade;

    public TradeEvent(Object source, Trade trade) {
        super(source);
        this.trade = trade;
    }
}
