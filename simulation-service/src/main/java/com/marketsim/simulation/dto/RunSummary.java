package com.marketsim.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketsim.common.engine.IntervalResult;
import com.marketsim.common.engine.PeriodRecord;
import com.marketsim.common.engine.SimulationResult;
import com.marketsim.common.model.MarketState;
import com.marketsim.common.stats.ValueStatistics;
import com.marketsim.simulation.service.RunParameters;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one run as exposed over HTTP and kept in memory as the latest run.
 */
public record RunSummary(
    @JsonProperty("runId")            String                   runId,
    @JsonProperty("parameters")       RunParameters            parameters,
    @JsonProperty("startedAt")        Instant                  startedAt,
    @JsonProperty("completedAt")      Instant                  completedAt,
    @JsonProperty("periods")          int                      periods,
    @JsonProperty("intervals")        int                      intervals,
    @JsonProperty("adjustedIntervals") int                    adjustedIntervals,
    @JsonProperty("marketStates")     List<MarketState>        marketStates,
    @JsonProperty("finalState")       MarketState              finalState,
    @JsonProperty("finalMarketIndex") double                   finalMarketIndex,
    @JsonProperty("active")           GroupStatisticsDTO       active,
    @JsonProperty("exited")           GroupStatisticsDTO       exited,
    @JsonProperty("series")           List<SeriesPoint>        series
) {

    public static RunSummary of(String runId, RunParameters parameters, Instant startedAt,
                                Instant completedAt, SimulationResult result) {
        int adjusted = (int) result.intervals().stream().filter(IntervalResult::adjusted).count();
        return new RunSummary(
            runId,
            parameters,
            startedAt,
            completedAt,
            result.history().size(),
            result.intervals().size(),
            adjusted,
            result.history().stream().map(PeriodRecord::state).toList(),
            result.finalState(),
            result.finalMarketIndex(),
            GroupStatisticsDTO.of("Active Participants",
                ValueStatistics.summarize(result.finalSnapshot().activeValues())),
            GroupStatisticsDTO.of("Exited Participants",
                ValueStatistics.summarize(result.finalSnapshot().inactiveValues())),
            seriesOf(result.aggregateValueSeries()));
    }

    public static List<SeriesPoint> seriesOf(List<Double> values) {
        List<SeriesPoint> points = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            points.add(new SeriesPoint(i + 1, values.get(i)));
        }
        return points;
    }
}
