package com.marketsim.common.stats;

/**
 * Descriptive statistics of one agent group. All figures are rounded to cents.
 * An empty group is represented by {@link #noData()}, whose numeric fields are
 * {@code NaN} and whose mode is {@link ModeResult.NoUniqueMode}.
 */
public record ValueSummary(
    int count,
    double mean,
    double median,
    double min,
    double max,
    ModeResult mode
) {

    private static final ValueSummary NO_DATA = new ValueSummary(
        0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, ModeResult.noUniqueMode());

    public static ValueSummary noData() {
        return NO_DATA;
    }

    public boolean hasData() {
        return count > 0;
    }
}
