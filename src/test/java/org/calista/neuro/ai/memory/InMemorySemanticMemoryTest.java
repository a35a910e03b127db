package org.calista.neuro.ai.memory;

import org.calista.neuro.ai.core.AgentFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class InMemorySemanticMemoryTest {

    @Test
    void inferProperty_shouldInheritOneLevelThroughIsA() {
        InMemorySemanticMemory sm = new InMemorySemanticMemory(10, new Random(1));
        AgentFactory.seedFacts(sm);
        sm.addFact("apple", Map.of(SemanticMemory.IS_A, "food", "color", "red"));

        assertThat(sm.inferProperty("apple", "color")).contains("red");
        assertThat(sm.inferProperty("apple", "effect")).contains("reduces_hunger");
        assertThat(sm.inferProperty("apple", "missing")).isEmpty();
        assertThat(sm.inferProperty("pear", "effect")).isEmpty();
    }

    @Test
    void addFact_shouldMergeAndNormaliseKeys() {
        InMemorySemanticMemory sm = new InMemorySemanticMemory(10, new Random(1));
        sm.addFact("Water", Map.of("property", "drinkable"));
        sm.addFact("water", Map.of("effect", "reduces_thirst"));

        assertThat(sm.retrieve("WATER")).hasValueSatisfying(p ->
                assertThat(p).containsEntry("property", "drinkable").containsEntry("effect", "reduces_thirst"));
        assertThat(sm.hasProperty("water", "effect", "reduces_thirst")).isTrue();
        assertThat(sm.size()).isEqualTo(1);
    }

    @Test
    void addFact_shouldStayWithinCapacity() {
        InMemorySemanticMemory sm = new InMemorySemanticMemory(3, new Random(1));
        for (int i = 0; i < 10; i++) sm.addFact("c" + i, Map.of("k", "v"));

        assertThat(sm.size()).isEqualTo(3);
        assertThat(sm.retrieve("c9")).isPresent();
    }
}
