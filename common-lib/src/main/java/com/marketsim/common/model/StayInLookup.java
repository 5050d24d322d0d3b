package com.marketsim.common.model;

/**
 * Result of a stay-in probability lookup, recording which rule produced the value.
 */
public record StayInLookup(
    double probability,
    Source source
) {

    public enum Source {
        /** The personality table has an entry for the state itself. */
        TABLE,
        /** {@link MarketState#CRASH} resolved through the {@link MarketState#DOWN} entry. */
        CRASH_AS_DOWN,
        /** No entry for the bucket; {@link StayInTable#DEFAULT_STAY_IN_PROBABILITY} applied. */
        DEFAULT
    }
}
