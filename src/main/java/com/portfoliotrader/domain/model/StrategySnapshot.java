package com.portfoliotrader.domain.model;

import com.portfoliotrader.domain.enums.StrategyState;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Point-in-time view of a strategy instance, published with every state change and
 * returned by the REST API.
 */
@Data
@Builder
public class StrategySnapshot {

    private String strategyName;
    private String className;
    private String author;
    private List<String> instruments;
    private StrategyState state;
    private Map<String, Object> parameters;
    private Map<String, Object> variables;
}
