package com.portfoliotrader.strategy.base;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a strategy field as a user-editable parameter. Parameters are set from the
 * persisted setting map and can only be edited while the strategy is not trading.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface StrategyParameter {}
