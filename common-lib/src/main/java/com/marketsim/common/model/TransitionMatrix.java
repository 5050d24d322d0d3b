package com.marketsim.common.model;

import com.marketsim.common.exception.SimulationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable Markov transition table over {@link MarketState}.
 *
 * <p>Every source state has a complete row covering all five target states.
 * Entries are non-negative and each row sums to 1.0 within {@link #SUM_TOLERANCE};
 * both conditions are checked on construction, so any instance in circulation
 * is a valid probability table.
 *
 * <p>Instances are values: adjustments produce a new matrix
 * (see {@code ParticipationAdjuster}) and never touch an existing one.
 */
public final class TransitionMatrix {

    /** Allowed deviation of a row total from 1.0. */
    public static final double SUM_TOLERANCE = 1e-9;

    private static final String COMPONENT = "transition-matrix";

    private final Map<MarketState, Map<MarketState, Double>> rows;

    private TransitionMatrix(Map<MarketState, Map<MarketState, Double>> rows) {
        this.rows = rows;
    }

    /**
     * Builds a validated matrix from nested maps. The input is copied.
     *
     * @throws SimulationException if a row or entry is missing, negative, or a
     *                             row does not sum to 1.0
     */
    public static TransitionMatrix of(Map<MarketState, ? extends Map<MarketState, Double>> source) {
        if (source == null) {
            throw new SimulationException(COMPONENT, "source rows must not be null");
        }
        EnumMap<MarketState, Map<MarketState, Double>> copy = new EnumMap<>(MarketState.class);
        for (MarketState from : MarketState.values()) {
            Map<MarketState, Double> row = source.get(from);
            if (row == null) {
                throw new SimulationException(COMPONENT, "missing row for " + from);
            }
            copy.put(from, Collections.unmodifiableMap(validateRow(from, row)));
        }
        return new TransitionMatrix(Collections.unmodifiableMap(copy));
    }

    private static EnumMap<MarketState, Double> validateRow(MarketState from, Map<MarketState, Double> row) {
        EnumMap<MarketState, Double> copy = new EnumMap<>(MarketState.class);
        double total = 0.0;
        for (MarketState to : MarketState.values()) {
            Double p = row.get(to);
            if (p == null) {
                throw new SimulationException(COMPONENT, "row " + from + " has no entry for " + to);
            }
            if (p < 0.0 || p.isNaN()) {
                throw new SimulationException(COMPONENT,
                    "row " + from + " has invalid probability " + p + " for " + to);
            }
            copy.put(to, p);
            total += p;
        }
        if (Math.abs(total - 1.0) > SUM_TOLERANCE) {
            throw new SimulationException(COMPONENT, "row " + from + " sums to " + total + ", expected 1.0");
        }
        return copy;
    }

    /** Read-only view of the outgoing distribution of {@code from}, in enum order. */
    public Map<MarketState, Double> row(MarketState from) {
        return rows.get(from);
    }

    public double probability(MarketState from, MarketState to) {
        return rows.get(from).get(to);
    }

    /**
     * Copy of all rows as mutable enum maps. Used by transformations that need
     * to derive a new matrix from this one.
     */
    public EnumMap<MarketState, EnumMap<MarketState, Double>> mutableCopy() {
        EnumMap<MarketState, EnumMap<MarketState, Double>> copy = new EnumMap<>(MarketState.class);
        rows.forEach((from, row) -> copy.put(from, new EnumMap<>(row)));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransitionMatrix)) return false;
        return rows.equals(((TransitionMatrix) o).rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return "TransitionMatrix" + rows;
    }
}
