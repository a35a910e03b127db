package org.calista.neuro.ai.perception;

import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.env.TimeOfDay;
import org.calista.neuro.ai.env.Weather;
import org.calista.neuro.ai.goal.ClearPathGoal;
import org.calista.neuro.ai.goal.Goal;
import org.calista.neuro.ai.goal.MaintainNeedLowGoal;
import org.calista.neuro.ai.goal.ReachLocationGoal;
import org.calista.neuro.ai.state.Need;
import org.calista.neuro.ai.state.PhysiologySnapshot;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class AttentionTest {

    private final Attention attention = new Attention(0.7);
    private final PhysiologySnapshot calm = new PhysiologySnapshot(0.1, 0.1, 0.1, 0.0);

    @Test
    void select_shouldPreferUrgentNeedsInOrder() {
        assertThat(attention.select(new PhysiologySnapshot(0.8, 0.9, 0.9, 0), List.of(), Perception.initial()))
                .isEqualTo(AttentionFocus.FOOD);
        assertThat(attention.select(new PhysiologySnapshot(0.1, 0.9, 0.8, 0), List.of(), Perception.initial()))
                .isEqualTo(AttentionFocus.WATER);
        assertThat(attention.select(new PhysiologySnapshot(0.1, 0.9, 0.1, 0), List.of(), Perception.initial()))
                .isEqualTo(AttentionFocus.REST);
    }

    @Test
    void select_shouldFollowTopGoal() {
        List<Goal> goals = List.of(
                ReachLocationGoal.of("reach", "Reach", 0.5, GridPos.of(3, 3)),
                MaintainNeedLowGoal.of("hydrate", "Hydrate", 0.7, Need.THIRST, 0.2, 15),
                ClearPathGoal.subGoalOf("clear", "Clear", 0.6, "reach"));

        assertThat(attention.select(calm, goals, Perception.initial())).isEqualTo(AttentionFocus.WATER);
    }

    @Test
    void select_shouldFallBackToVisibleObstacle() {
        Perception p = new Perception(1, TimeOfDay.DAY, Weather.SUNNY, true, true,
                List.of(), List.of(), List.of(GridPos.of(1, 1)), List.of());

        assertThat(attention.select(calm, List.of(), p)).isEqualTo(AttentionFocus.OBSTACLE);
        assertThat(attention.select(calm, List.of(), Perception.initial())).isEqualTo(AttentionFocus.NONE);
    }
}
