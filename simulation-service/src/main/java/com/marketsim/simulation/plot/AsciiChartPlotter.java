package com.marketsim.simulation.plot;

import com.marketsim.simulation.config.SimulationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Renders the total active value over time as a text line chart and logs it.
 *
 * <pre>
 *   Total Market Value Over Time
 *     104500.00 |          o
 *               |       o     o
 *      96000.00 | o  o
 *               +------------------
 *                 1        5
 * </pre>
 *
 * Each period takes three columns; the y axis spans the series' min to max.
 */
@Component
public class AsciiChartPlotter implements ValueSeriesPlotter {

    private static final Logger log = LoggerFactory.getLogger(AsciiChartPlotter.class);

    static final String TITLE = "Total Market Value Over Time";
    private static final int COLUMN_WIDTH = 3;
    private static final char MARKER = 'o';

    private final int height;

    @Autowired
    public AsciiChartPlotter(SimulationProperties properties) {
        this(properties.chartHeight());
    }

    AsciiChartPlotter(int height) {
        this.height = Math.max(2, height);
    }

    @Override
    public void plot(List<Double> series) {
        render(series).forEach(line -> log.info("[Chart] {}", line));
    }

    public List<String> render(List<Double> series) {
        List<String> lines = new ArrayList<>();
        lines.add(TITLE);
        if (series == null || series.isEmpty()) {
            lines.add("(no periods simulated)");
            return lines;
        }

        double min = series.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = series.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double span = max - min;

        char[][] grid = new char[height][series.size() * COLUMN_WIDTH];
        for (char[] row : grid) {
            Arrays.fill(row, ' ');
        }
        for (int i = 0; i < series.size(); i++) {
            grid[rowFor(series.get(i), min, span)][i * COLUMN_WIDTH + 1] = MARKER;
        }

        String labelFormat = "%14s |";
        for (int r = 0; r < height; r++) {
            String label = "";
            if (r == 0) {
                label = format(max);
            } else if (r == height - 1) {
                label = format(min);
            }
            lines.add((String.format(Locale.ROOT, labelFormat, label) + new String(grid[r])).stripTrailing());
        }

        lines.add(" ".repeat(15) + "+" + "-".repeat(series.size() * COLUMN_WIDTH));
        lines.add((" ".repeat(16) + xLabels(series.size())).stripTrailing());
        lines.add(" ".repeat(16) + "Year  (y: Total Active Investment Value)");
        return lines;
    }

    /** Top row holds the maximum; a flat series sits on the bottom row. */
    private int rowFor(double value, double min, double span) {
        if (span == 0.0) {
            return height - 1;
        }
        int fromBottom = (int) Math.round((value - min) / span * (height - 1));
        return (height - 1) - fromBottom;
    }

    private static String xLabels(int periods) {
        StringBuilder sb = new StringBuilder(" ".repeat(periods * COLUMN_WIDTH + 4));
        for (int year = 1; year <= periods; year++) {
            if (year == 1 || year % 5 == 0) {
                String label = Integer.toString(year);
                int at = (year - 1) * COLUMN_WIDTH + 1;
                sb.replace(at, at + label.length(), label);
            }
        }
        return sb.toString();
    }

    private static String format(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
