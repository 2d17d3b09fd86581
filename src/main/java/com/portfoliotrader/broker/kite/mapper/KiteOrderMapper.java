package com.portfoliotrader.broker.kite.mapper;

import com.portfoliotrader.config.KiteConfig;
import com.portfoliotrader.domain.enums.Direction;
import com.portfoliotrader.domain.enums.Offset;
import com.portfoliotrader.domain.enums.OrderStatus;
import com.portfoliotrader.domain.enums.OrderType;
import com.portfoliotrader.domain.model.Contract;
import com.portfoliotrader.domain.model.Order;
import com.portfoliotrader.domain.model.OrderRequest;
import com.portfoliotrader.domain.model.Trade;
import com.zerodhatech.kiteconnect.utils.Constants;
import com.zerodhatech.models.OrderParams;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;
import org.springframework.stereotype.Component;

/**
 * Maps between Kite SDK order objects and the engine's {@link OrderRequest}, {@link Order}
 * and {@link Trade} models.
 *
 * <p>Kite SDK models use public fields and keep most numbers as Strings, so every
 * conversion here is manual and null-safe.
 */
@Component
public class KiteOrderMapper {

    /** Kite rejects order tags longer than this. */
    static final int MAX_TAG_LENGTH = 20;

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final KiteConfig kiteConfig;

    public KiteOrderMapper(KiteConfig kiteConfig) {
        this.kiteConfig = kiteConfig;
    }

    /**
     * Builds Kite {@link OrderParams} for placement. Exchange and trading symbol come from
     * the contract; the strategy reference becomes the order tag.
     */
    public OrderParams toOrderParams(OrderRequest request, Contract contract) {
        OrderParams params = new OrderParams();
        params.exchange = contract.getExchange();
        params.tradingsymbol = contract.getSymbol();
        params.transactionType = request.getDirection() == Direction.LONG
                ? Constants.TRANSACTION_TYPE_BUY
                : Constants.TRANSACTION_TYPE_SELL;
        params.orderType = mapToKiteOrderType(request.getType());
        params.quantity = request.getVolume();
        params.product = kiteConfig.getProduct() != null ? kiteConfig.getProduct() : Constants.PRODUCT_NRML;
        params.validity = Constants.VALIDITY_DAY;
        params.tag = truncateTag(request.getReference());

        if (request.getPrice() != null && request.getType() != OrderType.MARKET) {
            params.price = request.getPrice().doubleValue();
        }
        return params;
    }

    /**
     * Applies a Kite order update (websocket push or order history entry) to the last
     * known order. Traded quantity never goes backwards.
     */
    public Order applyUpdate(Order existing, com.zerodhatech.models.Order kiteOrder) {
        int traded = Math.max(existing.getTraded(), parseInt(kiteOrder.filledQuantity));
        OrderStatus status = mapStatus(kiteOrder.status);
        if (status == OrderStatus.OPEN && traded > 0 && traded < existing.getVolume()) {
            status = OrderStatus.PARTIAL;
        }

        return existing.toBuilder()
                .status(status)
                .traded(traded)
                .statusMessage(kiteOrder.statusMessage)
                .timestamp(kiteOrder.orderTimestamp != null
                        ? toLocalDateTime(kiteOrder.orderTimestamp)
                        : existing.getTimestamp())
                .build();
    }

    /**
     * Builds an order from Kite's own record, for orders this process did not place or no
     * longer tracks.
     */
    public Order toOrder(com.zerodhatech.models.Order kiteOrder, String gateway) {
        return Order.builder()
                .orderId(kiteOrder.orderId)
                .instrument(kiteOrder.exchange + ":" + kiteOrder.tradingSymbol)
                .direction(Constants.TRANSACTION_TYPE_BUY.equals(kiteOrder.transactionType)
                        ? Direction.LONG
                        : Direction.SHORT)
                .offset(Offset.NONE)
                .type(mapOrderType(kiteOrder.orderType))
                .price(parseBigDecimal(kiteOrder.price))
                .volume(parseInt(kiteOrder.quantity))
                .traded(parseInt(kiteOrder.filledQuantity))
                .status(mapStatus(kiteOrder.status))
                .reference(kiteOrder.tag)
                .gateway(gateway)
                .statusMessage(kiteOrder.statusMessage)
                .timestamp(kiteOrder.orderTimestamp != null ? toLocalDateTime(kiteOrder.orderTimestamp) : null)
                .build();
    }

    /**
     * Converts a Kite fill. The instrument and direction come from the engine order the
     * fill belongs to, so the trade routes back to the same strategy key.
     */
    public Trade toTrade(com.zerodhatech.models.Trade kiteTrade, Order order) {
        return Trade.builder()
                .tradeId(kiteTrade.tradeId)
                .orderId(order.getOrderId())
                .instrument(order.getInstrument())
                .direction(order.getDirection())
                .offset(order.getOffset())
                .price(parseBigDecimal(kiteTrade.averagePrice))
                .volume(parseInt(kiteTrade.quantity))
                .gateway(order.getGateway())
                .timestamp(kiteTrade.fillTimestamp != null
                        ? toLocalDateTime(kiteTrade.fillTimestamp)
                        : LocalDateTime.now())
                .build();
    }

    /**
     * Maps Kite order status strings. UPDATE and the various request-received states mean
     * the order is still working.
     */
    public OrderStatus mapStatus(String kiteStatus) {
        if (kiteStatus == null) {
            return OrderStatus.SUBMITTING;
        }
        return switch (kiteStatus) {
            case "COMPLETE" -> OrderStatus.COMPLETE;
            case "CANCELLED" -> OrderStatus.CANCELLED;
            case "REJECTED" -> OrderStatus.REJECTED;
            case "TRIGGER PENDING" -> OrderStatus.TRIGGER_PENDING;
            default -> OrderStatus.OPEN;
        };
    }

    OrderType mapOrderType(String kiteOrderType) {
        if (kiteOrderType == null) {
            return OrderType.LIMIT;
        }
        return switch (kiteOrderType) {
            case "MARKET" -> OrderType.MARKET;
            case "SL" -> OrderType.SL;
            case "SL-M" -> OrderType.SLM;
            default -> OrderType.LIMIT;
        };
    }

    String mapToKiteOrderType(OrderType type) {
        if (type == null) {
            return Constants.ORDER_TYPE_LIMIT;
        }
        return switch (type) {
            case LIMIT -> Constants.ORDER_TYPE_LIMIT;
            case MARKET -> Constants.ORDER_TYPE_MARKET;
            case SL -> Constants.ORDER_TYPE_SL;
            case SLM -> Constants.ORDER_TYPE_SLM;
        };
    }

    static String truncateTag(String reference) {
        if (reference == null || reference.length() <= MAX_TAG_LENGTH) {
            return reference;
        }
        return reference.substring(0, MAX_TAG_LENGTH);
    }

    // ---- Parsing helpers ----

    private int parseInt(String value) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        try {
            return (int) Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private BigDecimal parseBigDecimal(String value) {
        if (value == null || value.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    LocalDateTime toLocalDateTime(Date date) {
        return date.toInstant().atZone(IST).toLocalDateTime();
    }
}
