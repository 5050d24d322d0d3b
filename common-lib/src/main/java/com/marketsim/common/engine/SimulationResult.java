package com.marketsim.common.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketsim.common.model.MarketState;

import java.util.List;

/**
 * Everything a finished run produced.
 */
public record SimulationResult(
    @JsonProperty("history")          List<PeriodRecord>   history,
    @JsonProperty("intervals")        List<IntervalResult> intervals,
    @JsonProperty("finalSnapshot")    PopulationSnapshot   finalSnapshot,
    @JsonProperty("finalState")       MarketState          finalState,
    @JsonProperty("finalMarketIndex") double               finalMarketIndex
) {

    public SimulationResult {
        history   = List.copyOf(history);
        intervals = List.copyOf(intervals);
    }

    /** Aggregate active value per period, the series handed to plotters. */
    public List<Double> aggregateValueSeries() {
        return history.stream().map(PeriodRecord::aggregateActiveValue).toList();
    }
}
