package com.marketsim.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketsim.common.stats.ValueSummary;

/**
 * JSON view of a {@link ValueSummary}. Numeric fields are null when the group is empty.
 */
public record GroupStatisticsDTO(
    @JsonProperty("group")   String  group,
    @JsonProperty("count")   int     count,
    @JsonProperty("mean")    Double  mean,
    @JsonProperty("median")  Double  median,
    @JsonProperty("min")     Double  min,
    @JsonProperty("max")     Double  max,
    @JsonProperty("mode")    String  mode,
    @JsonProperty("hasData") boolean hasData
) {

    public static GroupStatisticsDTO of(String group, ValueSummary summary) {
        if (!summary.hasData()) {
            return new GroupStatisticsDTO(group, 0, null, null, null, null, "No data", false);
        }
        return new GroupStatisticsDTO(group, summary.count(), summary.mean(), summary.median(),
            summary.min(), summary.max(), summary.mode().describe(), true);
    }
}
