package com.marketsim.common.model;

/**
 * Behavioral profile of an agent. Determines how likely the agent is to stay
 * invested after each market move; the probabilities live in {@link StayInTable}.
 */
public enum Personality {
    RISK_TAKER,
    CAUTIOUS,
    GREEDY,
    AVERAGE
}
