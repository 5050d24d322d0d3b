package com.marketsim.common.agent;

import com.marketsim.common.model.MarketTables;
import com.marketsim.common.model.Personality;
import com.marketsim.common.random.ScriptedRandomSource;
import com.marketsim.common.random.SeededRandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PopulationGeneratorTest {

    private final MarketTables tables = MarketTables.reference();

    @Test
    @DisplayName("one uniform draw per agent picks the personality")
    void personalityFromDraw() {
        // 4 personalities: [0,0.25) risk_taker, [0.25,0.5) cautious, [0.5,0.75) greedy, [0.75,1) average
        PopulationGenerator generator = new PopulationGenerator(tables, ScriptedRandomSource.of(0.1, 0.3, 0.6, 0.9));
        List<Agent> agents = generator.generate(4, 1000.0);

        assertEquals(List.of(Personality.RISK_TAKER, Personality.CAUTIOUS, Personality.GREEDY, Personality.AVERAGE),
            agents.stream().map(Agent::getPersonality).toList());
        assertEquals(List.of(0, 1, 2, 3), agents.stream().map(Agent::getId).toList());
        assertTrue(agents.stream().allMatch(Agent::isActive));
    }

    @Test
    @DisplayName("large population covers every personality")
    void coversAllPersonalities() {
        PopulationGenerator generator = new PopulationGenerator(tables, new SeededRandomSource(3L));
        Map<Personality, Integer> counts = new EnumMap<>(Personality.class);
        for (Agent a : generator.generate(4_000, 1000.0)) {
            counts.merge(a.getPersonality(), 1, Integer::sum);
        }
        assertEquals(Personality.values().length, counts.size());
        counts.values().forEach(c -> assertEquals(1000, c, 100));
    }

    @Test
    @DisplayName("uniform population and starting value")
    void uniformPopulation() {
        PopulationGenerator generator = new PopulationGenerator(tables, ScriptedRandomSource.of());
        List<Agent> agents = generator.generateUniform(3, Personality.CAUTIOUS, 250.0);
        assertEquals(3, agents.size());
        assertTrue(agents.stream().allMatch(a -> a.getPersonality() == Personality.CAUTIOUS));
        assertTrue(agents.stream().allMatch(a -> a.getValue() == 250.0));
    }

    @Test
    @DisplayName("non-positive count is rejected")
    void rejectsEmptyPopulation() {
        PopulationGenerator generator = new PopulationGenerator(tables, ScriptedRandomSource.of());
        assertThrows(IllegalArgumentException.class, () -> generator.generate(0, 1000.0));
    }
}
