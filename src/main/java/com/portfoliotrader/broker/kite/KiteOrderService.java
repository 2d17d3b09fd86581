package com.portfoliotrader.broker.kite;

import com.portfoliotrader.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.utils.Constants;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.OrderParams;
import com.zerodhatech.models.Trade;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.IOException;
import java.util.List;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes order operations against the Kite Connect API.
 *
 * <p>Internal to {@link KiteBrokerGateway}; nothing else should inject it.
 *
 * <p>Resilience4j decorators:
 * <ul>
 *   <li><b>Rate limiter</b> ({@code kiteOrders}): 8 req/sec, under Kite's 10/sec limit</li>
 *   <li><b>Circuit breaker</b> ({@code kiteApi}): trips after 50% failures in a 10-call window</li>
 *   <li><b>Retry</b> ({@code kiteApi}): read-only calls only. Placement is never retried, a
 *       timed-out placement may still have reached the exchange</li>
 * </ul>
 *
 * <p>Kite's checked exceptions (KiteException, JSONException, IOException) are wrapped in
 * {@link BrokerException}.
 */
@Service
public class KiteOrderService {

    private static final Logger log = LoggerFactory.getLogger(KiteOrderService.class);

    private final KiteConnect kiteConnect;

    public KiteOrderService(KiteConnect kiteConnect) {
        this.kiteConnect = kiteConnect;
    }

    /**
     * Places a regular order.
     *
     * @return the Kite order id
     * @throws BrokerException if Kite rejects the request or the call fails
     */
    @RateLimiter(name = "kiteOrders")
    @CircuitBreaker(name = "kiteApi")
    public String placeOrder(OrderParams params) {
        try {
            Order kiteOrder = kiteConnect.placeOrder(params, Constants.VARIETY_REGULAR);
            log.info(
                    "Order placed: orderId={} symbol={} side={} qty={} price={}",
                    kiteOrder.orderId,
                    params.tradingsymbol,
                    params.transactionType,
                    params.quantity,
                    params.price);
            return kiteOrder.orderId;
        } catch (KiteException e) {
            log.error("Kite order placement failed for {}: {}", params.tradingsymbol, e.message);
            throw new BrokerException("Order placement failed: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Order placement error for {}", params.tradingsymbol, e);
            throw new BrokerException("Order placement error: " + e.getMessage(), e);
        }
    }

    @RateLimiter(name = "kiteOrders")
    @CircuitBreaker(name = "kiteApi")
    public void cancelOrder(String orderId) {
        try {
            kiteConnect.cancelOrder(orderId, Constants.VARIETY_REGULAR);
            log.info("Order cancelled: orderId={}", orderId);
        } catch (KiteException e) {
            log.error("Order cancellation failed for {}: {}", orderId, e.message);
            throw new BrokerException("Order cancellation failed: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Order cancellation error for {}", orderId, e);
            throw new BrokerException("Order cancellation error: " + e.getMessage(), e);
        }
    }

    /**
     * All state transitions of an order, oldest first.
     */
    @RateLimiter(name = "kiteOrders")
    @CircuitBreaker(name = "kiteApi")
    @Retry(name = "kiteApi")
    public List<Order> getOrderHistory(String orderId) {
        try {
            return kiteConnect.getOrderHistory(orderId);
        } catch (KiteException e) {
            log.error("Failed to fetch order history for {}: {}", orderId, e.message);
            throw new BrokerException("Failed to fetch order history: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching order history for {}", orderId, e);
            throw new BrokerException("Error fetching order history: " + e.getMessage(), e);
        }
    }

    /**
     * Fills of an order. Each entry carries Kite's trade id.
     */
    @RateLimiter(name = "kiteOrders")
    @CircuitBreaker(name = "kiteApi")
    @Retry(name = "kiteApi")
    public List<Trade> getOrderTrades(String orderId) {
        try {
            return kiteConnect.getOrderTrades(orderId);
        } catch (KiteException e) {
            log.error("Failed to fetch trades for {}: {}", orderId, e.message);
            throw new BrokerException("Failed to fetch trades: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching trades for {}", orderId, e);
            throw new BrokerException("Error fetching trades: " + e.getMessage(), e);
        }
    }
}
