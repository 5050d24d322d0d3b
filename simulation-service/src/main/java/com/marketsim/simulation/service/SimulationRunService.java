package com.marketsim.simulation.service;

import com.marketsim.common.agent.Agent;
import com.marketsim.common.agent.PopulationGenerator;
import com.marketsim.common.engine.IntervalResult;
import com.marketsim.common.engine.SimulationEngine;
import com.marketsim.common.engine.SimulationListener;
import com.marketsim.common.engine.SimulationResult;
import com.marketsim.common.market.MarketModel;
import com.marketsim.common.model.MarketTables;
import com.marketsim.common.random.RandomSource;
import com.marketsim.common.random.SeededRandomSource;
import com.marketsim.simulation.config.SimulationProperties;
import com.marketsim.simulation.dto.RunSummary;
import com.marketsim.simulation.dto.SimulationRunRequest;
import com.marketsim.simulation.plot.ValueSeriesPlotter;
import com.marketsim.simulation.report.StatisticsReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Assembles and runs simulations.
 *
 * <p>For each run: build a {@link RandomSource} (seeded when configured), a
 * population, a {@link MarketModel} and a {@link SimulationEngine}; drive the
 * engine interval by interval from a {@link ConfigProvider}; forward each
 * interval to the {@link StatisticsReporter} and the finished series to the
 * {@link ValueSeriesPlotter}.
 *
 * <p>Only the latest run is kept, in memory. Nothing is persisted.
 */
@Service
public class SimulationRunService {

    private static final Logger log = LoggerFactory.getLogger(SimulationRunService.class);

    private final MarketTables tables;
    private final SimulationProperties defaults;
    private final StatisticsReporter reporter;
    private final ValueSeriesPlotter plotter;

    private final AtomicReference<RunSummary> latest = new AtomicReference<>();

    public SimulationRunService(MarketTables tables,
                                SimulationProperties defaults,
                                StatisticsReporter reporter,
                                ValueSeriesPlotter plotter) {
        this.tables   = tables;
        this.defaults = defaults;
        this.reporter = reporter;
        this.plotter  = plotter;
    }

    /**
     * Runs one simulation on the calling thread.
     *
     * @throws IllegalArgumentException if the provider yields invalid parameters
     */
    public RunSummary run(ConfigProvider provider) {
        RunParameters parameters = provider.parameters();
        String runId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();

        log.info("[Simulation] Run started. runId={} agents={} horizon={} schedule={} startingState={} seed={}",
            runId, parameters.agentCount(), parameters.horizon(), parameters.stepSchedule(),
            parameters.startingState(), parameters.seed());

        RandomSource random = parameters.seed() != null
            ? new SeededRandomSource(parameters.seed())
            : new SeededRandomSource();

        List<Agent> agents = new PopulationGenerator(tables, random)
            .generate(parameters.agentCount(), parameters.startingValue());
        MarketModel market = new MarketModel(tables.transitions(), tables.multipliers(), random);
        SimulationEngine engine = new SimulationEngine(
            market, agents, parameters.startingState(), parameters.horizon());

        SimulationResult result = engine.run(provider.intervals(parameters), listenerFor(runId));

        RunSummary summary = RunSummary.of(runId, parameters, startedAt, Instant.now(), result);
        latest.set(summary);

        log.info("[Simulation] Run complete. runId={} periods={} finalState={} active={} exited={}",
            runId, summary.periods(), summary.finalState(),
            summary.active().count(), summary.exited().count());
        return summary;
    }

    /**
     * Runs one simulation off the event loop using the {@code simulation.*}
     * defaults overlaid with {@code request}.
     */
    public Mono<RunSummary> runAsync(SimulationRunRequest request) {
        return Mono.fromCallable(() -> RunParameters.merge(defaults, request))
            .map(parameters -> run(new PropertiesConfigProvider(parameters)))
            .subscribeOn(Schedulers.boundedElastic());
    }

    public Optional<RunSummary> latest() {
        return Optional.ofNullable(latest.get());
    }

    private SimulationListener listenerFor(String runId) {
        return new SimulationListener() {
            @Override
            public void onInterval(IntervalResult interval) {
                if (interval.adjusted()) {
                    log.info("[Simulation] Interval clamped to horizon. runId={} requested={} simulated={}",
                        runId, interval.requestedPeriods(), interval.simulatedPeriods());
                }
                reporter.onInterval(interval);
            }

            @Override
            public void onComplete(SimulationResult result) {
                reporter.onComplete(result);
                plotter.plot(result.aggregateValueSeries());
            }
        };
    }
}
