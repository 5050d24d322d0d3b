package com.marketsim.simulation.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketsim.common.model.MarketState;
import com.marketsim.simulation.config.SimulationProperties;
import com.marketsim.simulation.dto.SimulationRunRequest;

import java.util.List;

/**
 * Validated parameters of one simulation run.
 *
 * <p>This is the boundary where configuration errors are caught: the engine
 * assumes a positive agent count and horizon, and schedule entries of at least 1.
 */
public record RunParameters(
    @JsonProperty("agentCount")    int           agentCount,
    @JsonProperty("horizon")       int           horizon,
    @JsonProperty("stepSchedule")  List<Integer> stepSchedule,
    @JsonProperty("startingState") MarketState   startingState,
    @JsonProperty("startingValue") double        startingValue,
    @JsonProperty("seed")          Long          seed
) {

    public RunParameters {
        if (agentCount <= 0) {
            throw new IllegalArgumentException("agentCount must be positive, got " + agentCount);
        }
        if (horizon <= 0) {
            throw new IllegalArgumentException("horizon must be positive, got " + horizon);
        }
        if (!(startingValue > 0.0)) {
            throw new IllegalArgumentException("startingValue must be positive, got " + startingValue);
        }
        if (startingState == null) {
            throw new IllegalArgumentException("startingState is required");
        }
        stepSchedule = stepSchedule == null ? List.of() : List.copyOf(stepSchedule);
        for (Integer step : stepSchedule) {
            if (step == null || step < 1) {
                throw new IllegalArgumentException("stepSchedule entries must be at least 1, got " + step);
            }
        }
    }

    public static RunParameters from(SimulationProperties properties) {
        return new RunParameters(
            withinLimit(properties.agentCount(), properties.maxAgentCount()),
            properties.horizon(),
            properties.stepSchedule(),
            properties.startingState(),
            properties.startingValue(),
            properties.seed());
    }

    /** Overlays the non-null fields of {@code request} on {@code defaults}. */
    public static RunParameters merge(SimulationProperties defaults, SimulationRunRequest request) {
        if (request == null) {
            return from(defaults);
        }
        return new RunParameters(
            withinLimit(request.getAgentCount() != null ? request.getAgentCount() : defaults.agentCount(),
                defaults.maxAgentCount()),
            defaults.horizon(),
            request.getStepSchedule() != null ? request.getStepSchedule() : defaults.stepSchedule(),
            request.getStartingState() != null
                ? MarketState.fromKey(request.getStartingState())
                : defaults.startingState(),
            request.getStartingValue() != null ? request.getStartingValue() : defaults.startingValue(),
            request.getSeed() != null ? request.getSeed() : defaults.seed());
    }

    /** Same run with a different population size. */
    public RunParameters withAgentCount(int count) {
        return new RunParameters(count, horizon, stepSchedule, startingState, startingValue, seed);
    }

    /**
     * @throws IllegalArgumentException when {@code agentCount} exceeds {@code maxAgentCount}
     */
    static int withinLimit(int agentCount, int maxAgentCount) {
        if (agentCount > maxAgentCount) {
            throw new IllegalArgumentException(
                "agentCount must be at most " + maxAgentCount + ", got " + agentCount);
        }
        return agentCount;
    }
}
