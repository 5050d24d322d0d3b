package com.marketsim.common.model;

import java.util.Locale;

/**
 * Discrete market regime for one simulated period.
 *
 * <p>Each state drives a value multiplier applied to every participating agent
 * (see {@link ValueMultipliers}) and selects the row of the
 * {@link TransitionMatrix} used to draw the following period.
 *
 * <ul>
 *   <li>{@link #UP}   : ordinary gain year</li>
 *   <li>{@link #DOWN} : ordinary loss year</li>
 *   <li>{@link #FLAT} : no change</li>
 *   <li>{@link #CRASH}: rare, severe loss; agents treat it like {@link #DOWN}</li>
 *   <li>{@link #BOOM} : rare, strong gain</li>
 * </ul>
 */
public enum MarketState {
    UP,
    DOWN,
    FLAT,
    CRASH,
    BOOM;

    /**
     * Parses a state from its name, ignoring case, e.g. {@code "crash"}.
     *
     * @throws IllegalArgumentException when {@code raw} names no state
     */
    public static MarketState fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Market state must not be blank");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown market state: " + raw, e);
        }
    }
}
