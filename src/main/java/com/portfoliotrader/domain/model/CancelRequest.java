package com.portfoliotrader.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CancelRequest {

    private String orderId;
    private String instrument;
    private String gateway;
}
