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
 * Snapshot of an order as last reported by the gateway.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String orderId;
    private String instrument;
    private Direction direction;
    private Offset offset;
    private OrderType type;
    private BigDecimal price;
    private int volume;
    private int traded;
    private OrderStatus status;
    private String reference;
    private String gateway;
    private String statusMessage;
    private LocalDateTime timestamp;

    public boolean isActive() {
        return status == null || status.isActive();
    }

    public CancelRequest createCancelRequest() {
        return new CancelRequest(orderId, instrument, gateway);
    }
}
