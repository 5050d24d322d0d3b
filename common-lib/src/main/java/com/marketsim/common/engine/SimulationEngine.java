package com.marketsim.common.engine;

import com.marketsim.common.agent.Agent;
import com.marketsim.common.agent.DecisionOutcome;
import com.marketsim.common.market.MarketModel;
import com.marketsim.common.model.MarketState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drives the market/agent feedback loop over a fixed horizon of periods.
 *
 * <h3>One period</h3>
 * <ol>
 *   <li>Snapshot the participation ratio before any agent changes.</li>
 *   <li>Draw the next market state from the participation-adjusted matrix.</li>
 *   <li>Multiply the market index by the new state's multiplier.</li>
 *   <li>For every agent: {@code decide(nextState, marketIndex)} then
 *       {@code updateValue(nextState)}.</li>
 *   <li>Record the state and the summed value of active agents.</li>
 * </ol>
 *
 * <p>Periods are grouped into reporting intervals by {@link #runInterval(int)};
 * an interval that would overshoot the horizon is clamped. The engine is
 * single-use and not thread-safe.
 */
public class SimulationEngine {

    private final MarketModel market;
    private final List<Agent> agents;
    private final int horizon;
    private final SimulationHistory history;
    private final List<IntervalResult> intervals = new ArrayList<>();

    private MarketState currentState;
    private double marketIndex = 1.0;

    public SimulationEngine(MarketModel market, List<Agent> agents, MarketState startingState, int horizon) {
        this.market = Objects.requireNonNull(market, "market");
        this.currentState = Objects.requireNonNull(startingState, "startingState");
        if (agents == null || agents.isEmpty()) {
            throw new IllegalArgumentException("At least one agent is required");
        }
        if (horizon <= 0) {
            throw new IllegalArgumentException("horizon must be positive, got " + horizon);
        }
        this.agents  = List.copyOf(agents);
        this.horizon = horizon;
        this.history = new SimulationHistory(horizon);
    }

    /**
     * Runs a complete simulation, asking {@code sizes} for each interval length
     * and notifying {@code listener} after each interval and at the end.
     */
    public SimulationResult run(IntervalSizeSource sizes, SimulationListener listener) {
        Objects.requireNonNull(sizes, "sizes");
        SimulationListener sink = listener != null ? listener : SimulationListener.NONE;

        while (!isComplete()) {
            int requested = sizes.nextInterval(history.size(), remainingPeriods());
            sink.onInterval(runInterval(requested));
        }

        SimulationResult result = result();
        sink.onComplete(result);
        return result;
    }

    /**
     * Simulates up to {@code requestedPeriods} periods, never past the horizon.
     *
     * @throws IllegalArgumentException if {@code requestedPeriods < 1}
     * @throws IllegalStateException    if the horizon has already been reached
     */
    public IntervalResult runInterval(int requestedPeriods) {
        if (requestedPeriods < 1) {
            throw new IllegalArgumentException("interval must be at least 1, got " + requestedPeriods);
        }
        if (isComplete()) {
            throw new IllegalStateException("Simulation already reached its horizon of " + horizon + " periods");
        }

        int periods = Math.min(requestedPeriods, remainingPeriods());
        List<PeriodRecord> records = new ArrayList<>(periods);
        for (int i = 0; i < periods; i++) {
            records.add(step());
        }

        IntervalResult interval = new IntervalResult(
            intervals.size(), requestedPeriods, periods, records, PopulationSnapshot.of(agents));
        intervals.add(interval);
        return interval;
    }

    /**
     * Simulates exactly one period.
     *
     * @throws IllegalStateException if the horizon has already been reached
     */
    public PeriodRecord step() {
        if (isComplete()) {
            throw new IllegalStateException("Simulation already reached its horizon of " + horizon + " periods");
        }

        // participation must be read before any agent decides this period
        double participation = participationRatio();

        MarketState nextState = market.transition(currentState, participation);
        currentState = nextState;
        marketIndex *= market.valueMultiplier(nextState);

        int exits = 0;
        int reEntries = 0;
        for (Agent agent : agents) {
            DecisionOutcome outcome = agent.decide(nextState, marketIndex);
            agent.updateValue(nextState);
            if (outcome == DecisionOutcome.EXITED) exits++;
            else if (outcome == DecisionOutcome.REENTERED) reEntries++;
        }

        PeriodRecord record = new PeriodRecord(
            history.size(), nextState, aggregateActiveValue(), marketIndex, participation, exits, reEntries);
        history.append(record);
        return record;
    }

    /** Fraction of agents currently active. */
    public double participationRatio() {
        long active = agents.stream().filter(Agent::isActive).count();
        return (double) active / agents.size();
    }

    /** Sum of values over currently active agents. */
    public double aggregateActiveValue() {
        return agents.stream()
            .filter(Agent::isActive)
            .mapToDouble(Agent::getValue)
            .sum();
    }

    public SimulationResult result() {
        return new SimulationResult(
            history.records(), intervals, PopulationSnapshot.of(agents), currentState, marketIndex);
    }

    public boolean isComplete()         { return history.size() >= horizon; }
    public int remainingPeriods()       { return horizon - history.size(); }
    public int horizon()                { return horizon; }
    public MarketState currentState()   { return currentState; }
    public double marketIndex()         { return marketIndex; }
    public SimulationHistory history()  { return history; }
    public List<Agent> agents()         { return agents; }
}
