package com.marketsim.common.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketsim.common.model.MarketState;

/**
 * One simulated period as recorded in {@link SimulationHistory}.
 *
 * @param period               zero-based period index
 * @param state                market state drawn for the period
 * @param aggregateActiveValue sum of values over agents active after the period's decisions
 * @param marketIndex          cumulative market index including this period
 * @param participationRatio   active fraction at the start of the period (the value that fed the transition)
 * @param exits                agents that left the market this period
 * @param reEntries            agents that bought back in this period
 */
public record PeriodRecord(
    @JsonProperty("period")               int         period,
    @JsonProperty("state")                MarketState state,
    @JsonProperty("aggregateActiveValue") double      aggregateActiveValue,
    @JsonProperty("marketIndex")          double      marketIndex,
    @JsonProperty("participationRatio")   double      participationRatio,
    @JsonProperty("exits")                int         exits,
    @JsonProperty("reEntries")            int         reEntries
) {}
