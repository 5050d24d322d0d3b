package com.marketsim.common.agent;

import com.marketsim.common.model.MarketTables;
import com.marketsim.common.model.Personality;
import com.marketsim.common.random.RandomSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Creates agent populations sharing one set of {@link MarketTables} and one
 * {@link RandomSource}.
 */
public final class PopulationGenerator {

    private final MarketTables tables;
    private final RandomSource random;

    public PopulationGenerator(MarketTables tables, RandomSource random) {
        this.tables = Objects.requireNonNull(tables, "tables");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * {@code count} agents whose personalities are drawn uniformly from all
     * {@link Personality} values, one draw per agent.
     */
    public List<Agent> generate(int count, double startingValue) {
        requirePositive(count);
        Personality[] personalities = Personality.values();
        List<Agent> agents = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Personality p = personalities[random.nextInt(personalities.length)];
            agents.add(newAgent(i, p, startingValue));
        }
        return agents;
    }

    /** {@code count} agents that all share {@code personality}. */
    public List<Agent> generateUniform(int count, Personality personality, double startingValue) {
        requirePositive(count);
        List<Agent> agents = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            agents.add(newAgent(i, personality, startingValue));
        }
        return agents;
    }

    private Agent newAgent(int id, Personality personality, double startingValue) {
        return new Agent(id, personality, tables.stayIn(), tables.multipliers(), random, startingValue);
    }

    private static void requirePositive(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("agentCount must be positive, got " + count);
        }
    }
}
