package com.marketsim.common.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * The three constant tables a simulation runs on, built once and passed
 * explicitly to the market model and to every agent.
 *
 * <p>{@link #reference()} returns the hand-tuned reference calibration:
 *
 * <pre>
 *   stay-in        up    down  flat
 *   risk_taker     0.90  0.75  0.80
 *   cautious       0.95  0.40  0.60
 *   greedy         0.99  0.65  0.70
 *   average        0.85  0.50  0.65
 *
 *   multipliers    up 1.1  down 0.9  flat 1.0  crash 0.6  boom 1.3
 * </pre>
 */
public record MarketTables(
    TransitionMatrix transitions,
    ValueMultipliers multipliers,
    StayInTable stayIn
) {

    public static MarketTables reference() {
        return new MarketTables(referenceTransitions(), referenceMultipliers(), referenceStayIn());
    }

    private static TransitionMatrix referenceTransitions() {
        Map<MarketState, Map<MarketState, Double>> rows = new EnumMap<>(MarketState.class);
        rows.put(MarketState.UP,    row(0.40, 0.30, 0.25, 0.025, 0.025));
        rows.put(MarketState.DOWN,  row(0.30, 0.40, 0.25, 0.05,  0.0));
        rows.put(MarketState.FLAT,  row(0.35, 0.30, 0.30, 0.025, 0.025));
        rows.put(MarketState.CRASH, row(0.40, 0.30, 0.25, 0.025, 0.025));
        rows.put(MarketState.BOOM,  row(0.30, 0.25, 0.40, 0.025, 0.025));
        return TransitionMatrix.of(rows);
    }

    private static Map<MarketState, Double> row(double up, double down, double flat, double crash, double boom) {
        Map<MarketState, Double> row = new EnumMap<>(MarketState.class);
        row.put(MarketState.UP, up);
        row.put(MarketState.DOWN, down);
        row.put(MarketState.FLAT, flat);
        row.put(MarketState.CRASH, crash);
        row.put(MarketState.BOOM, boom);
        return row;
    }

    private static ValueMultipliers referenceMultipliers() {
        return ValueMultipliers.of(row(1.1, 0.9, 1.0, 0.6, 1.3));
    }

    private static StayInTable referenceStayIn() {
        Map<Personality, Map<MarketState, Double>> profiles = new EnumMap<>(Personality.class);
        profiles.put(Personality.RISK_TAKER, stay(0.90, 0.75, 0.80));
        profiles.put(Personality.CAUTIOUS,   stay(0.95, 0.40, 0.60));
        profiles.put(Personality.GREEDY,     stay(0.99, 0.65, 0.70));
        profiles.put(Personality.AVERAGE,    stay(0.85, 0.50, 0.65));
        return StayInTable.of(profiles);
    }

    private static Map<MarketState, Double> stay(double up, double down, double flat) {
        Map<MarketState, Double> buckets = new EnumMap<>(MarketState.class);
        buckets.put(MarketState.UP, up);
        buckets.put(MarketState.DOWN, down);
        buckets.put(MarketState.FLAT, flat);
        return buckets;
    }
}
