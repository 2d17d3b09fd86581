package com.portfoliotrader.domain.enums;

import java.util.Set;

public enum OrderStatus {
    SUBMITTING,
    OPEN,
    TRIGGER_PENDING,
    PARTIAL,
    COMPLETE,
    CANCELLED,
    REJECTED;

    private static final Set<OrderStatus> TERMINAL = Set.of(COMPLETE, CANCELLED, REJECTED);

    /** True until the order reaches a terminal state (filled, cancelled or rejected). */
    public boolean isActive() {
        return !TERMINAL.contains(this);
    }
}
