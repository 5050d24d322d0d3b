package com.marketsim.common.agent;

/**
 * What an agent did in one call to {@link Agent#decide}.
 */
public enum DecisionOutcome {
    /** Was active and stayed invested. */
    STAYED_IN,
    /** Was active and left the market. */
    EXITED,
    /** Was inactive and bought back in. */
    REENTERED,
    /** Was inactive and stayed out. */
    STAYED_OUT
}
