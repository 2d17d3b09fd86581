package com.portfoliotrader.broker.kite;

import com.portfoliotrader.broker.BrokerGateway;
import com.portfoliotrader.broker.kite.mapper.KiteOrderMapper;
import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.CancelRequest;
import com.portfoliotrader.domain.model.Contract;
import com.portfoliotrader.domain.model.HistoryRequest;
import com.portfoliotrader.domain.model.Order;
import com.portfoliotrader.domain.model.OrderRequest;
import com.portfoliotrader.exception.BrokerException;
import com.portfoliotrader.exception.ContractNotFoundException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Live Kite Connect implementation of {@link BrokerGateway}.
 *
 * <p>Delegates to internal services ({@link KiteOrderService}, {@link KiteHistoryService},
 * {@link KiteInstrumentService}, {@link KiteTickerService}) which handle Resilience4j
 * annotations, Kite SDK calls and exception wrapping.
 *
 * <p>Kite nets positions per instrument and has no open/close offsets, so
 * {@link #convertOrderRequest} returns the request unchanged whatever the lock/net flags.
 */
@Component
public class KiteBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(KiteBrokerGateway.class);

    public static final String GATEWAY_NAME = "KITE";

    private final KiteOrderService kiteOrderService;
    private final KiteHistoryService kiteHistoryService;
    private final KiteInstrumentService kiteInstrumentService;
    private final KiteTickerService kiteTickerService;
    private final KiteOrderUpdateHandler kiteOrderUpdateHandler;
    private final KiteOrderMapper kiteOrderMapper;

    public KiteBrokerGateway(
            KiteOrderService kiteOrderService,
            KiteHistoryService kiteHistoryService,
            KiteInstrumentService kiteInstrumentService,
            KiteTickerService kiteTickerService,
            KiteOrderUpdateHandler kiteOrderUpdateHandler,
            KiteOrderMapper kiteOrderMapper) {
        this.kiteOrderService = kiteOrderService;
        this.kiteHistoryService = kiteHistoryService;
        this.kiteInstrumentService = kiteInstrumentService;
        this.kiteTickerService = kiteTickerService;
        this.kiteOrderUpdateHandler = kiteOrderUpdateHandler;
        this.kiteOrderMapper = kiteOrderMapper;
    }

    @Override
    public String getName() {
        return GATEWAY_NAME;
    }

    @Override
    public Optional<Contract> getContract(String instrument) {
        return kiteInstrumentService.getContract(instrument);
    }

    @Override
    public String sendOrder(OrderRequest request) {
        Optional<Contract> contract = getContract(request.getInstrument());
        if (contract.isEmpty()) {
            log.warn("Order for unknown instrument {} not sent", request.getInstrument());
            return "";
        }

        String orderId = kiteOrderService.placeOrder(kiteOrderMapper.toOrderParams(request, contract.get()));
        if (orderId == null || orderId.isEmpty()) {
            return "";
        }

        kiteOrderUpdateHandler.track(request.createOrder(orderId, GATEWAY_NAME));
        return orderId;
    }

    @Override
    public void cancelOrder(CancelRequest request) {
        kiteOrderService.cancelOrder(request.getOrderId());
    }

    /**
     * Tracked state when the order was placed in this session, otherwise the latest entry
     * of Kite's order history.
     */
    @Override
    public Optional<Order> getOrder(String orderId) {
        Optional<Order> tracked = kiteOrderUpdateHandler.getOrder(orderId);
        if (tracked.isPresent()) {
            return tracked;
        }

        try {
            List<com.zerodhatech.models.Order> history = kiteOrderService.getOrderHistory(orderId);
            if (history.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(kiteOrderMapper.toOrder(history.get(history.size() - 1), GATEWAY_NAME));
        } catch (BrokerException e) {
            log.warn("Order {} not found at Kite: {}", orderId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<OrderRequest> convertOrderRequest(OrderRequest request, boolean lock, boolean net) {
        return List.of(request);
    }

    @Override
    public void subscribe(String instrument) {
        Contract contract = getContract(instrument).orElseThrow(() -> new ContractNotFoundException(instrument));
        kiteTickerService.subscribe(contract.getBrokerToken());
    }

    @Override
    public List<Bar> queryHistory(HistoryRequest request) {
        Optional<Contract> contract = getContract(request.getInstrument());
        if (contract.isEmpty()) {
            return List.of();
        }
        return kiteHistoryService.getHistoricalBars(contract.get(), request);
    }
}
