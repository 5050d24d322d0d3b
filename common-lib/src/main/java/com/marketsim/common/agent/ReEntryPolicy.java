package com.marketsim.common.agent;

/**
 * Probability that an inactive agent buys back in, keyed on the market index
 * (cumulative product of value multipliers since the start of the run).
 *
 * <pre>
 *   marketIndex &lt; 0.8        → 0.50   (deep discount)
 *   0.8 ≤ marketIndex &lt; 1.0  → 0.35
 *   marketIndex ≥ 1.0         → 0.25
 * </pre>
 */
public final class ReEntryPolicy {

    public static final double BASE_CHANCE           = 0.25;
    public static final double DEEP_DISCOUNT_INDEX   = 0.8;
    public static final double DISCOUNT_INDEX        = 1.0;
    public static final double DEEP_DISCOUNT_BONUS   = 0.25;
    public static final double DISCOUNT_BONUS        = 0.10;

    private ReEntryPolicy() {}

    public static double reEntryChance(double marketIndex) {
        if (marketIndex < DEEP_DISCOUNT_INDEX) {
            return BASE_CHANCE + DEEP_DISCOUNT_BONUS;
        }
        if (marketIndex < DISCOUNT_INDEX) {
            return BASE_CHANCE + DISCOUNT_BONUS;
        }
        return BASE_CHANCE;
    }
}
