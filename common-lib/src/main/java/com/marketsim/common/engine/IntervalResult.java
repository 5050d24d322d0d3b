package com.marketsim.common.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketsim.common.model.MarketState;

import java.util.List;

/**
 * Outcome of one reporting interval.
 *
 * @param intervalIndex     zero-based interval number within the run
 * @param requestedPeriods  periods the caller asked for
 * @param simulatedPeriods  periods actually run; lower than requested when clamped to the horizon
 * @param periods           records of the simulated periods, in order
 * @param snapshot          active and inactive agent values at the end of the interval
 */
public record IntervalResult(
    @JsonProperty("intervalIndex")    int                intervalIndex,
    @JsonProperty("requestedPeriods") int                requestedPeriods,
    @JsonProperty("simulatedPeriods") int                simulatedPeriods,
    @JsonProperty("periods")          List<PeriodRecord> periods,
    @JsonProperty("snapshot")         PopulationSnapshot snapshot
) {

    public IntervalResult {
        periods = List.copyOf(periods);
    }

    /** True when the request overshot the horizon and was clamped. */
    @JsonProperty("adjusted")
    public boolean adjusted() {
        return simulatedPeriods != requestedPeriods;
    }

    @JsonIgnore
    public List<MarketState> states() {
        return periods.stream().map(PeriodRecord::state).toList();
    }

    /** Period index of the first period in this interval, or -1 when empty. */
    @JsonIgnore
    public int firstPeriod() {
        return periods.isEmpty() ? -1 : periods.get(0).period();
    }
}
