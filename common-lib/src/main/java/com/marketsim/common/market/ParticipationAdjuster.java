package com.marketsim.common.market;

import com.marketsim.common.model.MarketState;
import com.marketsim.common.model.TransitionMatrix;

import java.util.EnumMap;

/**
 * Pure transformation that biases the market towards decline when fewer than
 * half of the agents are invested.
 *
 * <p>For every source row, when {@code participationRatio < 0.5}:
 * <pre>
 *   down += 0.05
 *   up    = max(0, up   - 0.03)
 *   boom  = max(0, boom - 0.01)
 *   every entry /= new row total
 * </pre>
 * Otherwise the input matrix is returned as-is.
 *
 * <p>No logging. No side-effects. The input matrix is never modified.
 */
public final class ParticipationAdjuster {

    /** Participation below this ratio triggers the bearish adjustment. */
    public static final double LOW_PARTICIPATION_THRESHOLD = 0.5;

    static final double DOWN_BOOST = 0.05;
    static final double UP_CUT     = 0.03;
    static final double BOOM_CUT   = 0.01;

    private ParticipationAdjuster() {}

    /**
     * @param base               validated base matrix
     * @param participationRatio fraction of active agents, in {@code [0, 1]}
     * @return {@code base} itself when participation is healthy, else a new renormalized matrix
     */
    public static TransitionMatrix adjust(TransitionMatrix base, double participationRatio) {
        if (participationRatio >= LOW_PARTICIPATION_THRESHOLD) {
            return base;
        }

        EnumMap<MarketState, EnumMap<MarketState, Double>> rows = base.mutableCopy();
        for (EnumMap<MarketState, Double> row : rows.values()) {
            row.put(MarketState.DOWN, row.get(MarketState.DOWN) + DOWN_BOOST);
            row.put(MarketState.UP,   Math.max(0.0, row.get(MarketState.UP) - UP_CUT));
            row.put(MarketState.BOOM, Math.max(0.0, row.get(MarketState.BOOM) - BOOM_CUT));
            normalize(row);
        }
        return TransitionMatrix.of(rows);
    }

    private static void normalize(EnumMap<MarketState, Double> row) {
        double total = row.values().stream().mapToDouble(Double::doubleValue).sum();
        row.replaceAll((state, p) -> p / total);
    }
}
