package com.marketsim.common.agent;

import com.marketsim.common.model.MarketState;
import com.marketsim.common.model.ParticipationStatus;
import com.marketsim.common.model.Personality;
import com.marketsim.common.model.StayInTable;
import com.marketsim.common.model.ValueMultipliers;
import com.marketsim.common.random.RandomSource;

import java.util.Objects;

/**
 * A market participant with a fixed {@link Personality}, a monetary value and
 * a two-state participation machine ({@code ACTIVE} / {@code INACTIVE}).
 *
 * <p>Per period the engine calls {@link #decide} and then {@link #updateValue}
 * with the newly revealed market state. Because the value update runs second,
 * an agent that re-enters this period takes part in this period's move and an
 * agent that exits does not.
 *
 * <p>An agent only touches its own fields, so distinct agents can be updated
 * independently within a period.
 */
public class Agent {

    /** Value every agent starts with unless told otherwise. */
    public static final double DEFAULT_STARTING_VALUE = 1000.0;

    private final int id;
    private final Personality personality;
    private final StayInTable stayInTable;
    private final ValueMultipliers multipliers;
    private final RandomSource random;

    private double value;
    private ParticipationStatus status = ParticipationStatus.ACTIVE;

    public Agent(int id, Personality personality, StayInTable stayInTable,
                 ValueMultipliers multipliers, RandomSource random) {
        this(id, personality, stayInTable, multipliers, random, DEFAULT_STARTING_VALUE);
    }

    public Agent(int id, Personality personality, StayInTable stayInTable,
                 ValueMultipliers multipliers, RandomSource random, double startingValue) {
        if (!(startingValue > 0.0)) {
            throw new IllegalArgumentException("startingValue must be positive, got " + startingValue);
        }
        this.id          = id;
        this.personality = Objects.requireNonNull(personality, "personality");
        this.stayInTable = Objects.requireNonNull(stayInTable, "stayInTable");
        this.multipliers = Objects.requireNonNull(multipliers, "multipliers");
        this.random      = Objects.requireNonNull(random, "random");
        this.value       = startingValue;
    }

    /**
     * Reacts to the market state just revealed for this period.
     *
     * <p>Inactive agents evaluate re-entry against {@link ReEntryPolicy}; active
     * agents leave when a uniform draw exceeds their stay-in probability.
     * Exactly one draw is consumed.
     *
     * @param newState    state of the period being simulated
     * @param marketIndex cumulative market index including {@code newState}
     * @return the transition taken, if any
     */
    public DecisionOutcome decide(MarketState newState, double marketIndex) {
        if (status == ParticipationStatus.INACTIVE) {
            if (random.nextDouble() < ReEntryPolicy.reEntryChance(marketIndex)) {
                status = ParticipationStatus.ACTIVE;
                return DecisionOutcome.REENTERED;
            }
            return DecisionOutcome.STAYED_OUT;
        }

        double stayProb = stayInTable.stayProbability(personality, newState);
        if (random.nextDouble() > stayProb) {
            status = ParticipationStatus.INACTIVE;
            return DecisionOutcome.EXITED;
        }
        return DecisionOutcome.STAYED_IN;
    }

    /** Applies the state's multiplier when active; inactive value is frozen. */
    public void updateValue(MarketState state) {
        if (status == ParticipationStatus.ACTIVE) {
            value *= multipliers.multiplierFor(state);
        }
    }

    public boolean isActive() {
        return status == ParticipationStatus.ACTIVE;
    }

    public int getId()                      { return id; }
    public Personality getPersonality()     { return personality; }
    public double getValue()                { return value; }
    public ParticipationStatus getStatus()  { return status; }

    @Override
    public String toString() {
        return "Agent{id=" + id + ", personality=" + personality
            + ", value=" + value + ", status=" + status + '}';
    }
}
