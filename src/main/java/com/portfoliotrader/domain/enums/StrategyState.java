package com.portfoliotrader.domain.enums;

/**
 * Lifecycle state of a strategy instance.
 *
 * <pre>
 *   CREATED --init--> INITIALIZING --ok--> INITIALIZED --start--> TRADING --stop--> STOPPED
 *   INITIALIZING --fault--> CREATED
 *   STOPPED --start--> TRADING  (no re-init needed)
 * </pre>
 *
 * <p>Any callback fault drops the instance back to CREATED.
 */
public enum StrategyState {
    CREATED,
    INITIALIZING,
    INITIALIZED,
    TRADING,
    STOPPED
}
