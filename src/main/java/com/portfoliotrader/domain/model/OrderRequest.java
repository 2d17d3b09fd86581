package com.portfoliotrader.domain.model;

import com.portfoliotrader.domain.enums.Direction;
import com.portfoliotrader.domain.enums.Offset;
import com.portfoliotrader.domain.enums.OrderStatus;
import com.portfoliotrader.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Broker-neutral order request. {@code reference} tags the order with the owning strategy
 * so fills can be correlated outside the engine as well.
 */
@Data
@Builder(toBuilder = true)
public class OrderRequest {

    private String instrument;
    private Direction direction;
    private Offset offset;
    private OrderType type;
    private BigDecimal price;
    private int volume;
    private String reference;

    public Order createOrder(String orderId, String gateway) {
        return Order.builder()
                .orderId(orderId)
                .instrument(instrument)
                .direction(direction)
                .offset(offset)
                .type(type)
                .price(price)
                .volume(volume)
                .traded(0)
                .status(OrderStatus.SUBMITTING)
                .reference(reference)
                .gateway(gateway)
                .timestamp(LocalDateTime.now())
                .build();
    }
}
