package com.marketsim.simulation.config;

import com.marketsim.common.model.MarketState;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Run defaults bound from the {@code simulation.*} namespace.
 *
 * <p>Values are not validated here; {@code RunParameters} rejects bad input
 * before it reaches the engine.
 *
 * @param agentCount    population size
 * @param horizon       number of periods (years) per run
 * @param stepSchedule  reporting interval sizes, consumed in order; the last one repeats
 * @param startingState market state before the first period
 * @param startingValue value every agent starts with
 * @param seed          fixed seed for reproducible runs; random when absent
 * @param interactive   prompt for parameters on the console when running on startup
 * @param runOnStartup  run one simulation when the application starts
 * @param chartHeight   rows of the text value chart
 * @param maxAgentCount largest population a single run may request
 */
@ConfigurationProperties(prefix = "simulation")
public record SimulationProperties(
    @DefaultValue("100")   int           agentCount,
    @DefaultValue("20")    int           horizon,
    List<Integer>                        stepSchedule,
    @DefaultValue("FLAT")  MarketState   startingState,
    @DefaultValue("1000")  double        startingValue,
    Long                                 seed,
    @DefaultValue("false") boolean       interactive,
    @DefaultValue("false") boolean       runOnStartup,
    @DefaultValue("10")    int           chartHeight,
    @DefaultValue("100000") int          maxAgentCount
) {

    public SimulationProperties {
        stepSchedule = stepSchedule == null ? List.of() : List.copyOf(stepSchedule);
    }
}
