package com.marketsim.common.model;

import com.marketsim.common.exception.SimulationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-personality probability that an active agent stays invested after a
 * given market move.
 *
 * <p>{@link #lookup(Personality, MarketState)} is total over
 * {@code Personality × MarketState}:
 * <ol>
 *   <li>{@link MarketState#CRASH} is looked up under the {@link MarketState#DOWN} bucket.</li>
 *   <li>A bucket with no entry for the personality resolves to
 *       {@link #DEFAULT_STAY_IN_PROBABILITY}. With the reference profiles this is
 *       always the case for {@link MarketState#BOOM}.</li>
 * </ol>
 */
public final class StayInTable {

    /** Stay-in probability for any (personality, bucket) pair the table does not list. */
    public static final double DEFAULT_STAY_IN_PROBABILITY = 0.6;

    private static final String COMPONENT = "stay-in-table";

    private final Map<Personality, Map<MarketState, Double>> profiles;

    private StayInTable(Map<Personality, Map<MarketState, Double>> profiles) {
        this.profiles = profiles;
    }

    /**
     * Builds a table from partial per-personality maps. Missing personalities and
     * missing buckets are allowed; they fall back to the default.
     *
     * @throws SimulationException if an entry lies outside [0, 1], or a
     *                             {@link MarketState#CRASH} entry is supplied (crash
     *                             always reads the down bucket)
     */
    public static StayInTable of(Map<Personality, Map<MarketState, Double>> source) {
        EnumMap<Personality, Map<MarketState, Double>> copy = new EnumMap<>(Personality.class);
        source.forEach((personality, buckets) -> {
            EnumMap<MarketState, Double> row = new EnumMap<>(MarketState.class);
            buckets.forEach((state, p) -> {
                if (state == MarketState.CRASH) {
                    throw new SimulationException(COMPONENT,
                        personality + " defines a crash entry; crash is read from the down bucket");
                }
                if (p == null || p < 0.0 || p > 1.0) {
                    throw new SimulationException(COMPONENT,
                        personality + "/" + state + " stay-in probability out of range: " + p);
                }
                row.put(state, p);
            });
            copy.put(personality, Collections.unmodifiableMap(row));
        });
        return new StayInTable(Collections.unmodifiableMap(copy));
    }

    /** Resolves the stay-in probability and the rule that produced it. Never fails. */
    public StayInLookup lookup(Personality personality, MarketState state) {
        MarketState bucket = bucketFor(state);
        Map<MarketState, Double> row = profiles.get(personality);
        Double p = row != null ? row.get(bucket) : null;
        if (p == null) {
            return new StayInLookup(DEFAULT_STAY_IN_PROBABILITY, StayInLookup.Source.DEFAULT);
        }
        return new StayInLookup(p, state == MarketState.CRASH
            ? StayInLookup.Source.CRASH_AS_DOWN
            : StayInLookup.Source.TABLE);
    }

    public double stayProbability(Personality personality, MarketState state) {
        return lookup(personality, state).probability();
    }

    static MarketState bucketFor(MarketState state) {
        return state == MarketState.CRASH ? MarketState.DOWN : state;
    }
}
