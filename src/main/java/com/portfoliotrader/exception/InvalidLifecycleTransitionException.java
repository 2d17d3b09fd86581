package com.portfoliotrader.exception;

import com.portfoliotrader.domain.enums.StrategyState;
import java.util.Map;

/**
 * A lifecycle command (init, start, stop, edit, remove) that does not apply in the
 * strategy's current state.
 */
public class InvalidLifecycleTransitionException extends BaseException {

    public InvalidLifecycleTransitionException(String strategyName, String operation, StrategyState state) {
        super(
                ErrorCode.INVALID_LIFECYCLE_TRANSITION,
                String.format("Cannot %s strategy %s in state %s", operation, strategyName, state),
                Map.of("strategyName", strategyName, "operation", operation, "state", state.name()));
    }
}
