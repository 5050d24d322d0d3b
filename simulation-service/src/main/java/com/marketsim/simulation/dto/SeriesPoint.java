package com.marketsim.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One point of the aggregate active value series. {@code year} is 1-based.
 */
public record SeriesPoint(
    @JsonProperty("year")  int    year,
    @JsonProperty("value") double value
) {}
