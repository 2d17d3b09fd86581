package com.portfoliotrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for adding a strategy instance to the roster.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddStrategyRequest {

    /** Unique instance name, e.g. "pair-hdfc-icici". */
    @NotBlank
    private String strategyName;

    /** Registered strategy class, e.g. "PairTradingStrategy". */
    @NotBlank
    private String className;

    /** Instruments as {@code EXCHANGE:TRADINGSYMBOL}, in leg order. */
    @NotEmpty
    private List<@NotBlank String> instruments;

    /** Parameter overrides; omitted parameters keep their class defaults. */
    private Map<String, Object> setting;
}
