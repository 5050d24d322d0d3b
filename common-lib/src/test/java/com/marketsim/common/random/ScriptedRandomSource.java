package com.marketsim.common.random;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;

/**
 * Test double that replays a fixed sequence of draws, then either fails or
 * falls back to a seeded {@link Random}.
 */
public final class ScriptedRandomSource implements RandomSource {

    private final Deque<Double> script = new ArrayDeque<>();
    private final Random fallback;

    private ScriptedRandomSource(Random fallback, double... draws) {
        this.fallback = fallback;
        for (double d : draws) {
            script.add(d);
        }
    }

    /** Replays {@code draws}; any further draw fails the test. */
    public static ScriptedRandomSource of(double... draws) {
        return new ScriptedRandomSource(null, draws);
    }

    /** Replays {@code draws}, then continues with a seeded generator. */
    public static ScriptedRandomSource thenSeeded(long seed, double... draws) {
        return new ScriptedRandomSource(new Random(seed), draws);
    }

    @Override
    public double nextDouble() {
        if (!script.isEmpty()) {
            return script.poll();
        }
        if (fallback == null) {
            throw new IllegalStateException("Scripted draws exhausted");
        }
        return fallback.nextDouble();
    }

    public int remaining() {
        return script.size();
    }
}
