package com.marketsim.common.random;

/**
 * Source of uniform draws in {@code [0, 1)}.
 *
 * <p>Every stochastic step of the simulation (market transition, agent exit,
 * agent re-entry, personality assignment) consumes exactly one draw, so a
 * scripted implementation can force any path through the model.
 */
@FunctionalInterface
public interface RandomSource {

    /** @return a value in {@code [0, 1)} */
    double nextDouble();

    /** Uniform integer in {@code [0, bound)}. */
    default int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive, got " + bound);
        }
        return Math.min((int) (nextDouble() * bound), bound - 1);
    }
}
