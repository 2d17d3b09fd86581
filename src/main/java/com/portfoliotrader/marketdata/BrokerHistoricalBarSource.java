package com.portfoliotrader.marketdata;

import com.portfoliotrader.broker.BrokerGateway;
import com.portfoliotrader.domain.model.Bar;
import com.portfoliotrader.domain.model.Contract;
import com.portfoliotrader.domain.model.HistoryRequest;
import java.util.List;
import java.util.Optional;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * History straight from the broker, for contracts whose gateway advertises it.
 */
@Component
@Order(1)
public class BrokerHistoricalBarSource implements HistoricalBarSource {

    private final BrokerGateway brokerGateway;

    public BrokerHistoricalBarSource(BrokerGateway brokerGateway) {
        this.brokerGateway = brokerGateway;
    }

    @Override
    public String getName() {
        return "broker";
    }

    @Override
    public List<Bar> query(HistoryRequest request) {
        Optional<Contract> contract = brokerGateway.getContract(request.getInstrument());
        if (contract.isEmpty() || !contract.get().isHistoryData()) {
            return List.of();
        }
        return brokerGateway.queryHistory(request);
    }
}
