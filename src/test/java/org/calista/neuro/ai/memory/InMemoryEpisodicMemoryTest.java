package org.calista.neuro.ai.memory;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.state.PhysiologySnapshot;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class InMemoryEpisodicMemoryTest {

    private static final PhysiologySnapshot S = new PhysiologySnapshot(0.1, 0.2, 0.3, 0.5);

    @Test
    void recent_shouldReturnLastWindowOldestFirst() {
        InMemoryEpisodicMemory em = new InMemoryEpisodicMemory(10);
        for (int t = 1; t <= 5; t++) em.add(t, S, Action.REST, 0.5);

        assertThat(em.recent(3)).extracting(Episode::tick).containsExactly(3L, 4L, 5L);
        assertThat(em.recent(50)).hasSize(5);
    }

    @Test
    void add_shouldEvictOldestBeyondCapacity() {
        InMemoryEpisodicMemory em = new InMemoryEpisodicMemory(2);
        em.add(1, S, Action.REST, 0.1);
        em.add(2, S, Action.EXPLORE, 0.2);
        em.add(3, S, Action.SEEK_FOOD, 0.3);

        assertThat(em.size()).isEqualTo(2);
        assertThat(em.recent(2)).extracting(Episode::action).containsExactly(Action.EXPLORE, Action.SEEK_FOOD);
    }

    @Test
    void add_shouldClampEmotionWeight() {
        InMemoryEpisodicMemory em = new InMemoryEpisodicMemory(2);
        em.add(1, S, Action.REST, 3.0);

        assertThat(em.recent(1).get(0).emotionWeight()).isEqualTo(1.0);
    }
}
