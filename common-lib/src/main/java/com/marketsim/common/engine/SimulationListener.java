package com.marketsim.common.engine;

/**
 * Callback for reporters and plotters attached to a run.
 */
public interface SimulationListener {

    /** Called after every completed interval. */
    default void onInterval(IntervalResult interval) {}

    /** Called once when the horizon is reached. */
    default void onComplete(SimulationResult result) {}

    SimulationListener NONE = new SimulationListener() {};
}
