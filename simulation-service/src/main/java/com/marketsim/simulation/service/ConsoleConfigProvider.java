package com.marketsim.simulation.service;

import com.marketsim.common.engine.IntervalSizeSource;
import com.marketsim.simulation.config.SimulationProperties;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * Interactive provider that prompts on a console for the population size and,
 * before each interval, for the number of years to simulate.
 *
 * <p>Unparsable or non-positive answers are re-prompted, as is a population
 * above {@code simulation.max-agent-count}. A year count beyond
 * the remaining horizon is accepted; the engine clamps it and the reporter
 * announces the adjustment.
 */
public class ConsoleConfigProvider implements ConfigProvider {

    private final BufferedReader in;
    private final PrintStream out;
    private final SimulationProperties defaults;

    public ConsoleConfigProvider(BufferedReader in, PrintStream out, SimulationProperties defaults) {
        this.in       = in;
        this.out      = out;
        this.defaults = defaults;
    }

    @Override
    public RunParameters parameters() {
        int agents = promptPositive("Enter number of people in the simulation: ", defaults.maxAgentCount());
        return RunParameters.from(defaults).withAgentCount(agents);
    }

    @Override
    public IntervalSizeSource intervals(RunParameters parameters) {
        return (elapsed, remaining) -> {
            out.printf("%nYear %d - %d Simulation%n", elapsed, elapsed + 1);
            return promptPositive(String.format(
                "Enter number of years to simulate before update (1-%d): ", parameters.horizon()), Integer.MAX_VALUE);
        };
    }

    private int promptPositive(String prompt, int max) {
        while (true) {
            out.print(prompt);
            out.flush();
            String line = readLine();
            if (line == null) {
                throw new IllegalStateException("Console input closed before a value was entered");
            }
            try {
                int value = Integer.parseInt(line.trim());
                if (value < 1) {
                    out.println("Please enter a whole number of at least 1.");
                } else if (value > max) {
                    out.println("Please enter a whole number of at most " + max + ".");
                } else {
                    return value;
                }
            } catch (NumberFormatException e) {
                out.println("Not a whole number: " + line.trim());
            }
        }
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read console input", e);
        }
    }
}
