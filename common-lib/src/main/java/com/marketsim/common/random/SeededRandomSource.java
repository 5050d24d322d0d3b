package com.marketsim.common.random;

import java.util.Random;

/**
 * {@link RandomSource} backed by {@link Random}. A fixed seed makes a whole run
 * reproducible; the no-arg constructor seeds from the JVM.
 *
 * <p>Not thread-safe in the sense of reproducibility: interleaved callers get
 * interleaved draws.
 */
public final class SeededRandomSource implements RandomSource {

    private final Random random;

    public SeededRandomSource() {
        this.random = new Random();
    }

    public SeededRandomSource(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }
}
