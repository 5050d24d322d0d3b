package com.marketsim.common.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketsim.common.agent.Agent;

import java.util.ArrayList;
import java.util.List;

/**
 * Agent values split by participation status at one point in time.
 */
public record PopulationSnapshot(
    @JsonProperty("activeValues")   List<Double> activeValues,
    @JsonProperty("inactiveValues") List<Double> inactiveValues
) {

    public PopulationSnapshot {
        activeValues   = List.copyOf(activeValues);
        inactiveValues = List.copyOf(inactiveValues);
    }

    public static PopulationSnapshot of(List<Agent> agents) {
        List<Double> active   = new ArrayList<>();
        List<Double> inactive = new ArrayList<>();
        for (Agent agent : agents) {
            (agent.isActive() ? active : inactive).add(agent.getValue());
        }
        return new PopulationSnapshot(active, inactive);
    }

    public int activeCount()   { return activeValues.size(); }
    public int inactiveCount() { return inactiveValues.size(); }
}
