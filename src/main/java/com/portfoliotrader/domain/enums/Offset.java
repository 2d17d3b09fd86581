package com.portfoliotrader.domain.enums;

/**
 * Open/close qualifier carried alongside {@link Direction}.
 *
 * <p>Venues without position offsets (NSE/NFO via Kite) ignore it, but the strategy
 * still tags every order so the rebalance legs stay distinguishable.
 */
public enum Offset {
    NONE,
    OPEN,
    CLOSE
}
