package com.marketsim.common.market;

import com.marketsim.common.model.MarketState;
import com.marketsim.common.random.RandomSource;

import java.util.Map;

/**
 * Single weighted draw over a market-state distribution.
 *
 * <p>Walks the distribution in {@link MarketState} declaration order and returns
 * the first state whose cumulative weight exceeds {@code u × total}, where
 * {@code u} is one uniform draw. Zero-weight states are never returned.
 */
public final class WeightedSampler {

    private WeightedSampler() {}

    public static MarketState sample(Map<MarketState, Double> weights, RandomSource random) {
        double total = 0.0;
        MarketState lastPositive = null;
        for (MarketState state : MarketState.values()) {
            double w = weights.getOrDefault(state, 0.0);
            if (w > 0.0) {
                total += w;
                lastPositive = state;
            }
        }
        if (lastPositive == null) {
            throw new IllegalArgumentException("Distribution has no positive weight: " + weights);
        }

        double target = random.nextDouble() * total;
        double cumulative = 0.0;
        for (MarketState state : MarketState.values()) {
            double w = weights.getOrDefault(state, 0.0);
            if (w <= 0.0) continue;
            cumulative += w;
            if (target < cumulative) {
                return state;
            }
        }
        // rounding can leave target == total
        return lastPositive;
    }
}
