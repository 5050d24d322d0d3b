package com.marketsim.simulation.service;

import com.marketsim.common.engine.IntervalSizeSource;
import com.marketsim.common.model.MarketState;
import com.marketsim.simulation.config.SimulationProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigProviderTest {

    private final SimulationProperties defaults = new SimulationProperties(
        100, 20, List.of(), MarketState.FLAT, 1000.0, 9L, true, false, 10, 500);

    @Nested
    @DisplayName("PropertiesConfigProvider")
    class FromProperties {

        @Test
        @DisplayName("schedule is walked in order and its last entry repeats")
        void walksSchedule() {
            RunParameters params = new RunParameters(10, 20, List.of(3, 7), MarketState.FLAT, 1000.0, null);
            IntervalSizeSource intervals = new PropertiesConfigProvider(params).intervals(params);

            assertThat(intervals.nextInterval(0, 20)).isEqualTo(3);
            assertThat(intervals.nextInterval(3, 17)).isEqualTo(7);
            assertThat(intervals.nextInterval(10, 10)).isEqualTo(7);
            assertThat(intervals.nextInterval(17, 3)).isEqualTo(7);
        }

        @Test
        @DisplayName("empty schedule runs the remaining horizon at once")
        void emptySchedule() {
            RunParameters params = RunParameters.from(defaults);
            IntervalSizeSource intervals = new PropertiesConfigProvider(params).intervals(params);

            assertThat(intervals.nextInterval(0, 20)).isEqualTo(20);
        }

        @Test
        @DisplayName("each run gets a fresh schedule cursor")
        void freshCursorPerRun() {
            RunParameters params = new RunParameters(10, 20, List.of(2, 4), MarketState.FLAT, 1000.0, null);
            PropertiesConfigProvider provider = new PropertiesConfigProvider(params);

            provider.intervals(params).nextInterval(0, 20);
            assertThat(provider.intervals(params).nextInterval(0, 20)).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("ConsoleConfigProvider")
    class FromConsole {

        private final ByteArrayOutputStream output = new ByteArrayOutputStream();

        private ConsoleConfigProvider console(String input) {
            return new ConsoleConfigProvider(
                new BufferedReader(new StringReader(input)),
                new PrintStream(output, true, StandardCharsets.UTF_8),
                defaults);
        }

        @Test
        @DisplayName("re-prompts until a positive agent count is entered")
        void promptsForAgentCount() {
            RunParameters params = console("abc\n0\n25\n").parameters();

            assertThat(params.agentCount()).isEqualTo(25);
            assertThat(params.seed()).isEqualTo(9L);
            assertThat(output.toString(StandardCharsets.UTF_8))
                .contains("Enter number of people in the simulation: ")
                .contains("Not a whole number: abc")
                .contains("at least 1");
        }

        @Test
        @DisplayName("population above the configured maximum is re-prompted")
        void promptsWithinMaximum() {
            RunParameters params = console("501\n500\n").parameters();

            assertThat(params.agentCount()).isEqualTo(500);
            assertThat(output.toString(StandardCharsets.UTF_8)).contains("at most 500");
        }

        @Test
        @DisplayName("interval beyond the remaining years is passed through for the engine to clamp")
        void intervalPassThrough() {
            ConsoleConfigProvider provider = console("15\n15\n");
            RunParameters params = RunParameters.from(defaults);
            IntervalSizeSource intervals = provider.intervals(params);

            assertThat(intervals.nextInterval(0, 20)).isEqualTo(15);
            assertThat(intervals.nextInterval(15, 5)).isEqualTo(15);
            assertThat(output.toString(StandardCharsets.UTF_8)).contains("Year 15 - 16 Simulation");
        }

        @Test
        @DisplayName("closed input fails instead of looping")
        void closedInput() {
            assertThatThrownBy(() -> console("").parameters())
                .isInstanceOf(IllegalStateException.class);
        }
    }
}
