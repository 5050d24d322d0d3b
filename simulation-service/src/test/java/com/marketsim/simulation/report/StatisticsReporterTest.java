package com.marketsim.simulation.report;

import com.marketsim.common.engine.IntervalResult;
import com.marketsim.common.engine.PeriodRecord;
import com.marketsim.common.engine.PopulationSnapshot;
import com.marketsim.common.model.MarketState;
import com.marketsim.common.stats.ValueStatistics;
import com.marketsim.common.stats.ValueSummary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatisticsReporterTest {

    private final StatisticsReporter reporter = new StatisticsReporter();

    private static PeriodRecord period(int index, MarketState state) {
        return new PeriodRecord(index, state, 1000.0, 1.0, 1.0, 0, 0);
    }

    @Test
    void listsYearsOfTheInterval() {
        IntervalResult interval = new IntervalResult(1, 2, 2,
            List.of(period(5, MarketState.CRASH), period(6, MarketState.BOOM)),
            new PopulationSnapshot(List.of(1000.0), List.of()));

        assertThat(reporter.intervalLines(interval))
            .containsExactly("Market update for this interval:", "Year 6: CRASH", "Year 7: BOOM");
    }

    @Test
    void announcesClampedInterval() {
        IntervalResult interval = new IntervalResult(3, 15, 1,
            List.of(period(19, MarketState.UP)),
            new PopulationSnapshot(List.of(), List.of()));

        assertThat(reporter.intervalLines(interval).get(0))
            .isEqualTo("Adjusting to 1 year(s) to stay within the horizon (requested 15).");
    }

    @Test
    void groupBlockWithTiedMode() {
        ValueSummary summary = ValueStatistics.summarize(List.of(900.0, 900.0, 1100.0, 1100.0));

        assertThat(reporter.groupLines("Active Participants", summary)).containsExactly(
            "--- Active Participants Report (4 people) ---",
            "Mean: 1000.00",
            "Median: 1000.00",
            "Mode: No unique mode",
            "Min: 900.00",
            "Max: 1100.00");
    }

    @Test
    void emptyGroupHasNoData() {
        assertThat(reporter.groupLines("Exited Participants", ValueSummary.noData()))
            .containsExactly("--- Exited Participants Report (0 people) ---", "No data to show.");
    }
}
