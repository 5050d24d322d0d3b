package com.marketsim.simulation.runner;

import com.marketsim.simulation.config.SimulationProperties;
import com.marketsim.simulation.service.ConfigProvider;
import com.marketsim.simulation.service.ConsoleConfigProvider;
import com.marketsim.simulation.service.PropertiesConfigProvider;
import com.marketsim.simulation.service.RunParameters;
import com.marketsim.simulation.service.SimulationRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Runs one simulation at startup when {@code simulation.run-on-startup=true}.
 *
 * <p>With {@code simulation.interactive=true} the population size and interval
 * lengths are prompted on the console; otherwise the configured defaults and
 * step schedule are used.
 */
@Component
@ConditionalOnProperty(prefix = "simulation", name = "run-on-startup", havingValue = "true")
public class StartupSimulationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupSimulationRunner.class);

    private final SimulationRunService runService;
    private final SimulationProperties properties;

    public StartupSimulationRunner(SimulationRunService runService, SimulationProperties properties) {
        this.runService = runService;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        ConfigProvider provider = properties.interactive()
            ? new ConsoleConfigProvider(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out, properties)
            : new PropertiesConfigProvider(RunParameters.from(properties));

        log.info("[Startup] Simulation triggered. interactive={}", properties.interactive());
        runService.run(provider);
    }
}
