package com.marketsim.common.engine;

/**
 * Supplies the size of the next reporting interval while a run is in progress.
 *
 * <p>Implementations return at least 1. Values above {@code remainingPeriods}
 * are allowed; the engine clamps them and flags the interval as adjusted.
 */
@FunctionalInterface
public interface IntervalSizeSource {

    int nextInterval(int elapsedPeriods, int remainingPeriods);

    /** Runs the whole horizon as a single interval. */
    static IntervalSizeSource wholeHorizon() {
        return (elapsed, remaining) -> remaining;
    }

    static IntervalSizeSource fixed(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("interval must be at least 1, got " + size);
        }
        return (elapsed, remaining) -> size;
    }
}
