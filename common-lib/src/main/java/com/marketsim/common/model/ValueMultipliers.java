package com.marketsim.common.model;

import com.marketsim.common.exception.SimulationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-state factor applied to an active agent's value for one period.
 * Complete over {@link MarketState} and strictly positive, so a participating
 * agent's value can shrink but never reach zero.
 */
public final class ValueMultipliers {

    private static final String COMPONENT = "value-multipliers";

    private final Map<MarketState, Double> multipliers;

    private ValueMultipliers(Map<MarketState, Double> multipliers) {
        this.multipliers = multipliers;
    }

    /**
     * @throws SimulationException if a state is missing or its multiplier is not positive
     */
    public static ValueMultipliers of(Map<MarketState, Double> source) {
        EnumMap<MarketState, Double> copy = new EnumMap<>(MarketState.class);
        for (MarketState state : MarketState.values()) {
            Double m = source.get(state);
            if (m == null) {
                throw new SimulationException(COMPONENT, "missing multiplier for " + state);
            }
            if (!(m > 0.0) || m.isInfinite()) {
                throw new SimulationException(COMPONENT, "multiplier for " + state + " must be positive, got " + m);
            }
            copy.put(state, m);
        }
        return new ValueMultipliers(Collections.unmodifiableMap(copy));
    }

    public double multiplierFor(MarketState state) {
        return multipliers.get(state);
    }

    public Map<MarketState, Double> asMap() {
        return multipliers;
    }

    @Override
    public String toString() {
        return "ValueMultipliers" + multipliers;
    }
}
