package com.portfoliotrader.exception;

import java.util.Map;

/**
 * No contract metadata for an instrument. Order placement and market data subscription
 * are skipped for it.
 */
public class ContractNotFoundException extends BaseException {

    public ContractNotFoundException(String instrument) {
        super(ErrorCode.CONTRACT_NOT_FOUND, "Contract not found: " + instrument, Map.of("instrument", instrument));
    }
}
