package com.portfoliotrader.domain.enums;

/**
 * Side of an order or fill. LONG buys, SHORT sells.
 */
public enum Direction {
    LONG,
    SHORT;

    /** +1 for LONG, -1 for SHORT. Applied to fill volume to get the net position change. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
