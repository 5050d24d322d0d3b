package com.marketsim.simulation.service;

import com.marketsim.common.engine.IntervalSizeSource;

/**
 * Supplies everything a run needs from the outside world: the fixed parameters
 * up front and, while the run progresses, the size of each reporting interval.
 */
public interface ConfigProvider {

    RunParameters parameters();

    /**
     * A fresh interval source for one run. Sources may be stateful, so each run
     * asks for its own.
     */
    IntervalSizeSource intervals(RunParameters parameters);
}
