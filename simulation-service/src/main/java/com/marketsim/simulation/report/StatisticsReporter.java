package com.marketsim.simulation.report;

import com.marketsim.common.engine.IntervalResult;
import com.marketsim.common.engine.PeriodRecord;
import com.marketsim.common.engine.SimulationListener;
import com.marketsim.common.engine.SimulationResult;
import com.marketsim.common.stats.ValueStatistics;
import com.marketsim.common.stats.ValueSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Logs the market states of each interval and descriptive statistics for the
 * agents still invested and those that exited.
 *
 * <p>Line building is separated from logging so the report text can be
 * verified without a log appender.
 */
@Component
public class StatisticsReporter implements SimulationListener {

    private static final Logger log = LoggerFactory.getLogger(StatisticsReporter.class);

    static final String ACTIVE_GROUP = "Active Participants";
    static final String EXITED_GROUP = "Exited Participants";

    @Override
    public void onInterval(IntervalResult interval) {
        intervalLines(interval).forEach(line -> log.info("[Report] {}", line));
        groupLines(ACTIVE_GROUP, ValueStatistics.summarize(interval.snapshot().activeValues()))
            .forEach(line -> log.info("[Report] {}", line));
        groupLines(EXITED_GROUP, ValueStatistics.summarize(interval.snapshot().inactiveValues()))
            .forEach(line -> log.info("[Report] {}", line));
    }

    @Override
    public void onComplete(SimulationResult result) {
        log.info("[Report] ==== FINAL SUMMARY ==== periods={} finalState={} marketIndex={}",
            result.history().size(), result.finalState(), String.format(Locale.ROOT, "%.4f", result.finalMarketIndex()));
        groupLines(ACTIVE_GROUP, ValueStatistics.summarize(result.finalSnapshot().activeValues()))
            .forEach(line -> log.info("[Report] {}", line));
        groupLines(EXITED_GROUP, ValueStatistics.summarize(result.finalSnapshot().inactiveValues()))
            .forEach(line -> log.info("[Report] {}", line));
    }

    /** Adjustment notice (if any) followed by one {@code Year N: STATE} line per period. */
    public List<String> intervalLines(IntervalResult interval) {
        List<String> lines = new ArrayList<>();
        if (interval.adjusted()) {
            lines.add(String.format(Locale.ROOT,
                "Adjusting to %d year(s) to stay within the horizon (requested %d).",
                interval.simulatedPeriods(), interval.requestedPeriods()));
        }
        lines.add("Market update for this interval:");
        for (PeriodRecord record : interval.periods()) {
            lines.add(String.format(Locale.ROOT, "Year %d: %s", record.period() + 1, record.state()));
        }
        return lines;
    }

    /** Statistics block for one agent group; a single "No data to show." line when empty. */
    public List<String> groupLines(String name, ValueSummary summary) {
        List<String> lines = new ArrayList<>();
        lines.add(String.format(Locale.ROOT, "--- %s Report (%d people) ---", name, summary.count()));
        if (!summary.hasData()) {
            lines.add("No data to show.");
            return lines;
        }
        lines.add(String.format(Locale.ROOT, "Mean: %.2f", summary.mean()));
        lines.add(String.format(Locale.ROOT, "Median: %.2f", summary.median()));
        lines.add("Mode: " + summary.mode().describe());
        lines.add(String.format(Locale.ROOT, "Min: %.2f", summary.min()));
        lines.add(String.format(Locale.ROOT, "Max: %.2f", summary.max()));
        return lines;
    }
}
