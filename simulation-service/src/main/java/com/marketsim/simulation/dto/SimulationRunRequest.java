package com.marketsim.simulation.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Optional overrides for a run started over HTTP. Null fields fall back to the
 * {@code simulation.*} defaults.
 */
@Data
@NoArgsConstructor
public class SimulationRunRequest {

    private Integer agentCount;

    private Long seed;

    private List<Integer> stepSchedule;

    /** Market state key, e.g. {@code "flat"}. */
    private String startingState;

    private Double startingValue;
}
