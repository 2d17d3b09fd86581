package com.portfoliotrader.strategy.base;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Actual and target net position per instrument, in lot units.
 *
 * <p>Reads of an unknown instrument return 0. Writes go through named methods only:
 * fills through {@link #applyFill}, strategy decisions through {@link #setTarget}, and
 * warm-restart restores through the {@code restore*} methods.
 */
public class PositionLedger {

    private final Map<String, Integer> positions = new ConcurrentHashMap<>();
    private final Map<String, Integer> targets = new ConcurrentHashMap<>();

    public int getPosition(String instrument) {
        return positions.getOrDefault(instrument, 0);
    }

    public int getTarget(String instrument) {
        return targets.getOrDefault(instrument, 0);
    }

    public void setTarget(String instrument, int target) {
        targets.put(instrument, target);
    }

    /**
     * Adds a signed fill volume to the instrument's net position.
     *
     * @return the new net position
     */
    public int applyFill(String instrument, int signedVolume) {
        return positions.merge(instrument, signedVolume, Integer::sum);
    }

    /** Overwrites the given instruments only; instruments absent from {@code restored} keep their value. */
    public void restorePositions(Map<String, Integer> restored) {
        positions.putAll(restored);
    }

    public void restoreTargets(Map<String, Integer> restored) {
        targets.putAll(restored);
    }

    public Map<String, Integer> getPositions() {
        return new TreeMap<>(positions);
    }

    public Map<String, Integer> getTargets() {
        return new TreeMap<>(targets);
    }
}
