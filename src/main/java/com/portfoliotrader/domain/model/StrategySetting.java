package com.portfoliotrader.domain.model;

import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Roster entry persisted per strategy name: which class to build, on which
 * instruments, with which parameter values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategySetting {

    private String className;
    private List<String> instruments;
    private Map<String, Object> setting;
}
