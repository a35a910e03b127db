package org.calista.neuro.ai.memory;

import org.calista.neuro.ai.env.GridPos;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class WorkingMemoryTest {

    private static WorkingMemoryItem food(int y, long tick) {
        return new WorkingMemoryItem(WorkingMemoryItem.Kind.PERCEIVED_FOOD, GridPos.of(0, y), tick);
    }

    private static WorkingMemoryItem rock(int y, long tick) {
        return new WorkingMemoryItem(WorkingMemoryItem.Kind.PERCEIVED_OBSTACLE, GridPos.of(0, y), tick);
    }

    @Test
    void push_shouldDropOldestWhenFull() {
        WorkingMemory wm = new WorkingMemory(3);
        for (int i = 0; i < 5; i++) wm.push(food(i, i));

        List<WorkingMemoryItem> all = wm.snapshot();

        assertThat(wm.size()).isEqualTo(3);
        assertThat(all).extracting(WorkingMemoryItem::tick).containsExactly(4L, 3L, 2L);
    }

    @Test
    void recentMatching_shouldFilterNewestFirst() {
        WorkingMemory wm = new WorkingMemory(5);
        wm.push(food(1, 1));
        wm.push(rock(2, 2));
        wm.push(food(3, 3));

        List<WorkingMemoryItem> foods = wm.recentMatching(it -> it.kind() == WorkingMemoryItem.Kind.PERCEIVED_FOOD);

        assertThat(foods).extracting(WorkingMemoryItem::tick).containsExactly(3L, 1L);
    }

    @Test
    void snapshot_shouldBeEmptyInitially() {
        assertThat(new WorkingMemory(5).snapshot()).isEmpty();
    }
}
