package com.portfoliotrader.broker;

import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.CancelRequest;
import com.portfoliotrader.domain.model.Contract;
import com.portfoliotrader.domain.model.HistoryRequest;
import com.portfoliotrader.domain.model.Order;
import com.portfoliotrader.domain.model.OrderRequest;
import java.util.List;
import java.util.Optional;

/**
 * Broker-agnostic gateway the engine trades through.
 *
 * <p>Order status changes and fills come back asynchronously as
 * {@link com.portfoliotrader.event.OrderEvent} and {@link com.portfoliotrader.event.TradeEvent};
 * nothing here blocks waiting for a fill.
 *
 * <p>Implementations wrap their checked SDK exceptions in
 * {@link com.portfoliotrader.exception.BrokerException}.
 */
public interface BrokerGateway {

    /** Gateway name stamped on orders, used to route cancels back. */
    String getName();

    Optional<Contract> getContract(String instrument);

    /**
     * Submits an order.
     *
     * @return the broker order id, or an empty string if the broker refused it
     */
    String sendOrder(OrderRequest request);

    void cancelOrder(CancelRequest request);

    /** Last known state of an order placed through this gateway. */
    Optional<Order> getOrder(String orderId);

    /**
     * Splits a request into the child requests the venue needs for the given position
     * accounting mode. Venues without open/close offsets return the request unchanged.
     */
    List<OrderRequest> convertOrderRequest(OrderRequest request, boolean lock, boolean net);

    /** Starts market data for the instrument; ticks arrive as {@link com.portfoliotrader.event.TickEvent}. */
    void subscribe(String instrument);

    List<Bar> queryHistory(HistoryRequest request);
}
