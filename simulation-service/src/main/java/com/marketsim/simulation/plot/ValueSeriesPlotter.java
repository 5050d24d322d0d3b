package com.marketsim.simulation.plot;

import java.util.List;

/**
 * Consumer of the aggregate active value series, one value per period.
 */
public interface ValueSeriesPlotter {

    void plot(List<Double> series);
}
