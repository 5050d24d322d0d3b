package com.marketsim.simulation.service;

import com.marketsim.common.model.MarketState;
import com.marketsim.common.model.MarketTables;
import com.marketsim.simulation.config.SimulationProperties;
import com.marketsim.simulation.dto.RunSummary;
import com.marketsim.simulation.dto.SimulationRunRequest;
import com.marketsim.simulation.report.StatisticsReporter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SimulationRunServiceTest {

    private final SimulationProperties defaults = new SimulationProperties(
        50, 20, List.of(5, 5, 5, 5), MarketState.FLAT, 1000.0, 42L, false, false, 10, 1000);

    private final List<List<Double>> plotted = new ArrayList<>();

    private final SimulationRunService service = new SimulationRunService(
        MarketTables.reference(), defaults, new StatisticsReporter(), plotted::add);

    private RunParameters params(List<Integer> schedule, long seed) {
        return new RunParameters(50, 20, schedule, MarketState.FLAT, 1000.0, seed);
    }

    @Test
    @DisplayName("seeded run covers the horizon and becomes the latest run")
    void seededRun() {
        RunSummary summary = service.run(new PropertiesConfigProvider(params(List.of(5, 5, 5, 5), 42L)));

        assertThat(summary.periods()).isEqualTo(20);
        assertThat(summary.intervals()).isEqualTo(4);
        assertThat(summary.adjustedIntervals()).isZero();
        assertThat(summary.marketStates()).hasSize(20);
        assertThat(summary.series()).hasSize(20);
        assertThat(summary.series().get(0).year()).isEqualTo(1);
        assertThat(summary.active().count() + summary.exited().count()).isEqualTo(50);
        assertThat(service.latest()).contains(summary);
        assertThat(plotted).hasSize(1);
        assertThat(plotted.get(0)).hasSize(20);
    }

    @Test
    @DisplayName("same seed reproduces the same market path")
    void reproducible() {
        RunSummary first = service.run(new PropertiesConfigProvider(params(List.of(5), 7L)));
        RunSummary second = service.run(new PropertiesConfigProvider(params(List.of(5), 7L)));

        assertThat(second.marketStates()).isEqualTo(first.marketStates());
        assertThat(second.series()).isEqualTo(first.series());
        assertThat(second.runId()).isNotEqualTo(first.runId());
    }

    @Test
    @DisplayName("interval overshooting the horizon is clamped")
    void clampedInterval() {
        RunSummary summary = service.run(new PropertiesConfigProvider(params(List.of(15), 1L)));

        assertThat(summary.periods()).isEqualTo(20);
        assertThat(summary.intervals()).isEqualTo(2);
        assertThat(summary.adjustedIntervals()).isEqualTo(1);
    }

    @Test
    void runAsyncAppliesRequestOverrides() {
        SimulationRunRequest request = new SimulationRunRequest();
        request.setAgentCount(5);
        request.setStartingState("crash");

        StepVerifier.create(service.runAsync(request))
            .assertNext(summary -> {
                assertThat(summary.parameters().agentCount()).isEqualTo(5);
                assertThat(summary.parameters().startingState()).isEqualTo(MarketState.CRASH);
                assertThat(summary.periods()).isEqualTo(20);
            })
            .verifyComplete();
    }

    @Test
    void runAsyncRejectsInvalidRequest() {
        SimulationRunRequest request = new SimulationRunRequest();
        request.setAgentCount(0);

        StepVerifier.create(service.runAsync(request))
            .expectError(IllegalArgumentException.class)
            .verify();
        assertThat(service.latest()).isEmpty();
    }

    @Test
    @DisplayName("population above the configured maximum fails before any agent is built")
    void runAsyncRejectsOversizedPopulation() {
        SimulationRunRequest request = new SimulationRunRequest();
        request.setAgentCount(Integer.MAX_VALUE);

        StepVerifier.create(service.runAsync(request))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at most 1000"))
            .verify();
        assertThat(service.latest()).isEmpty();
    }
}
