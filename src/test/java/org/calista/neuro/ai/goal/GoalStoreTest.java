package org.calista.neuro.ai.goal;

import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.state.Need;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GoalStoreTest {

    private GoalStore store;

    @BeforeEach
    void setUp() {
        store = new GoalStore();
        store.add(ReachLocationGoal.of("reach", "Reach", 0.9, GridPos.of(5, 5)));
        store.add(ClearPathGoal.subGoalOf("clear", "Clear", 0.85, "reach"));
        store.add(MaintainNeedLowGoal.of("fed", "Fed", 0.6, Need.HUNGER, 0.3, 20));
    }

    @Test
    void add_shouldRejectDuplicateIds() {
        assertThatThrownBy(() -> store.add(ReachLocationGoal.of("reach", "Again", 0.5, GridPos.of(1, 1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void all_shouldKeepInsertionOrder() {
        assertThat(store.all()).extracting(Goal::id).containsExactly("reach", "clear", "fed");
    }

    @Test
    void markCompleted_shouldKeepGoalButLeaveActiveList() {
        store.apply(new GoalUpdate.MarkCompleted("reach"));

        assertThat(store.size()).isEqualTo(3);
        assertThat(store.get("reach")).hasValueSatisfying(g -> assertThat(g.completed()).isTrue());
        assertThat(store.active()).extracting(Goal::id).containsExactly("clear", "fed");
        assertThat(store.hasActive(GoalKind.REACH_LOCATION)).isFalse();
    }

    @Test
    void setDuration_shouldOnlyApplyToMaintainGoals() {
        store.applyAll(List.of(new GoalUpdate.SetDuration("fed", 7), new GoalUpdate.SetDuration("reach", 3)));

        assertThat(store.get("fed")).map(g -> ((MaintainNeedLowGoal) g).currentDuration()).contains(7);
        assertThat(store.get("reach")).containsInstanceOf(ReachLocationGoal.class);
    }

    @Test
    void assignObstacle_shouldPointClearPathGoal() {
        store.apply(new GoalUpdate.AssignObstacle("clear", GridPos.of(2, 3)));

        assertThat(store.get("clear")).map(g -> ((ClearPathGoal) g).obstacle()).contains(GridPos.of(2, 3));
    }

    @Test
    void apply_shouldIgnoreUnknownIds() {
        store.apply(new GoalUpdate.MarkCompleted("nope"));

        assertThat(store.active()).hasSize(3);
    }

    @Test
    void goals_shouldRejectPriorityOutsideUnitRange() {
        assertThatThrownBy(() -> ReachLocationGoal.of("x", "X", 1.5, GridPos.of(0, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
