package com.marketsim.common.market;

import com.marketsim.common.model.MarketState;
import com.marketsim.common.model.TransitionMatrix;
import com.marketsim.common.model.ValueMultipliers;
import com.marketsim.common.random.RandomSource;

import java.util.Objects;

/**
 * Markov-chain market whose transition probabilities react to aggregate participation.
 *
 * <p>Holds the immutable base {@link TransitionMatrix} and {@link ValueMultipliers};
 * the only mutable collaborator is the {@link RandomSource} consumed by
 * {@link #transition(MarketState, double)}, one draw per call.
 */
public class MarketModel {

    private final TransitionMatrix baseTransitions;
    private final ValueMultipliers multipliers;
    private final RandomSource random;

    public MarketModel(TransitionMatrix baseTransitions, ValueMultipliers multipliers, RandomSource random) {
        this.baseTransitions = Objects.requireNonNull(baseTransitions, "baseTransitions");
        this.multipliers     = Objects.requireNonNull(multipliers, "multipliers");
        this.random          = Objects.requireNonNull(random, "random");
    }

    /** Transition matrix in effect for the given participation ratio. */
    public TransitionMatrix adjustForParticipation(double participationRatio) {
        return ParticipationAdjuster.adjust(baseTransitions, participationRatio);
    }

    /**
     * Draws the next market state from the participation-adjusted row of {@code current}.
     */
    public MarketState transition(MarketState current, double participationRatio) {
        TransitionMatrix adjusted = adjustForParticipation(participationRatio);
        return WeightedSampler.sample(adjusted.row(current), random);
    }

    public double valueMultiplier(MarketState state) {
        return multipliers.multiplierFor(state);
    }

    public TransitionMatrix baseTransitions() {
        return baseTransitions;
    }

    public ValueMultipliers multipliers() {
        return multipliers;
    }
}
