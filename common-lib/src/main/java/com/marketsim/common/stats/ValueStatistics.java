package com.marketsim.common.stats;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mean, median, min, max and mode of agent values.
 *
 * <p>Values are rounded to cents before any statistic is taken, so agents whose
 * values differ only by floating-point noise count as equal for the mode.
 *
 * <p>No logging. No side-effects.
 */
public final class ValueStatistics {

    private ValueStatistics() {}

    /**
     * @param values agent values; may be empty, must not contain nulls
     * @return summary, or {@link ValueSummary#noData()} for an empty collection
     */
    public static ValueSummary summarize(Collection<Double> values) {
        if (values == null || values.isEmpty()) {
            return ValueSummary.noData();
        }

        List<Double> rounded = new ArrayList<>(values.size());
        for (Double v : values) {
            rounded.add(roundCents(v));
        }
        Collections.sort(rounded);

        double mean = rounded.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);

        return new ValueSummary(
            rounded.size(),
            roundCents(mean),
            roundCents(median(rounded)),
            rounded.get(0),
            rounded.get(rounded.size() - 1),
            mode(rounded));
    }

    /** Median of an ascending list; mean of the two middle values for even sizes. */
    static double median(List<Double> sorted) {
        int n = sorted.size();
        int mid = n / 2;
        if (n % 2 == 1) {
            return sorted.get(mid);
        }
        return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    /**
     * Most frequent value, or {@link ModeResult.NoUniqueMode} when two or more
     * values share the highest frequency.
     */
    public static ModeResult mode(Collection<Double> values) {
        if (values == null || values.isEmpty()) {
            return ModeResult.noUniqueMode();
        }
        Map<Double, Long> frequencies = new LinkedHashMap<>();
        for (Double v : values) {
            frequencies.merge(v, 1L, Long::sum);
        }

        long best = 0;
        Double bestValue = null;
        int holders = 0;
        for (Map.Entry<Double, Long> e : frequencies.entrySet()) {
            if (e.getValue() > best) {
                best = e.getValue();
                bestValue = e.getKey();
                holders = 1;
            } else if (e.getValue() == best) {
                holders++;
            }
        }
        return holders == 1 ? ModeResult.of(bestValue) : ModeResult.noUniqueMode();
    }

    static double roundCents(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
