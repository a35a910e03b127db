package org.calista.neuro.ai.action;

import org.calista.neuro.ai.env.Cell;
import org.calista.neuro.ai.env.Environment;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.env.TestGridWorld;
import org.calista.neuro.ai.state.BasicMoodStrategy;
import org.calista.neuro.ai.state.PhysiologicalState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.Mockito.verifyNoInteractions;

@Tag("unit")
class ActionExecutorTest {

    private final ActionExecutor executor = new ActionExecutor();
    private TestGridWorld world;
    private PhysiologicalState body;

    @BeforeEach
    void setUp() {
        world = new TestGridWorld(5);
        body = new PhysiologicalState(new BasicMoodStrategy(), 0, 0, 0, 0.5, 0.5, 0.5);
    }

    @Test
    @DisplayName("Unknown action ids are a no-op with a small penalty")
    void execute_unknownIdShouldBePenalisedNoOp() {
        Environment env = Mockito.mock(Environment.class);

        ActionOutcome out = executor.execute("fly_away", GridPos.of(1, 1), body, env);

        assertThat(out.action()).isNull();
        assertThat(out.reward()).isEqualTo(-0.2);
        assertThat(out.position()).isEqualTo(GridPos.of(1, 1));
        assertThat(body.hunger()).isEqualTo(0.5);
        verifyNoInteractions(env);
    }

    @Test
    void execute_knownIdShouldResolveCaseInsensitively() {
        ActionOutcome out = executor.execute("REST", GridPos.of(0, 0), body, world);

        assertThat(out.action()).isEqualTo(Action.REST);
        assertThat(out.reward()).isEqualTo(0.4);
    }

    @Test
    void seekFood_onFoodShouldConsumeAndRelieveHunger() {
        world.put(1, 1, Cell.FOOD);

        ActionOutcome out = executor.execute(Action.SEEK_FOOD, GridPos.of(1, 1), body, world);

        assertThat(out.success()).isTrue();
        assertThat(out.reward()).isEqualTo(0.5);
        assertThat(body.hunger()).isZero();
        assertThat(world.cellAt(GridPos.of(1, 1))).isEqualTo(Cell.EMPTY);
    }

    @Test
    void seekFood_withoutFoodShouldCostHunger() {
        ActionOutcome out = executor.execute(Action.SEEK_FOOD, GridPos.of(1, 1), body, world);

        assertThat(out.success()).isFalse();
        assertThat(out.reward()).isEqualTo(-0.1);
        assertThat(body.hunger()).isCloseTo(0.52, offset(1e-9));
    }

    @Test
    void drinkWater_onWaterShouldRelieveThirst() {
        world.put(2, 2, Cell.WATER);

        ActionOutcome out = executor.execute(Action.DRINK_WATER, GridPos.of(2, 2), body, world);

        assertThat(out.reward()).isEqualTo(0.6);
        assertThat(body.thirst()).isZero();
    }

    @Test
    void drinkWater_withoutWaterShouldCostThirst() {
        ActionOutcome out = executor.execute(Action.DRINK_WATER, GridPos.of(2, 2), body, world);

        assertThat(out.reward()).isEqualTo(-0.15);
        assertThat(body.thirst()).isCloseTo(0.53, offset(1e-9));
    }

    @Test
    void explore_shouldRaiseEveryNeed() {
        ActionOutcome out = executor.execute(Action.EXPLORE, GridPos.of(2, 2), body, world);

        assertThat(out.reward()).isEqualTo(-0.05);
        assertThat(body.hunger()).isCloseTo(0.55, offset(1e-9));
        assertThat(body.fatigue()).isCloseTo(0.55, offset(1e-9));
        assertThat(body.thirst()).isCloseTo(0.55, offset(1e-9));
    }

    @Test
    void move_shouldStepIntoFreeCell() {
        ActionOutcome out = executor.execute(Action.MOVE_DOWN, GridPos.of(0, 0), body, world);

        assertThat(out.position()).isEqualTo(GridPos.of(1, 0));
        assertThat(out.reward()).isEqualTo(-0.01);
    }

    @Test
    void move_shouldBeBlockedByObstacleAndBoundary() {
        world.put(0, 1, Cell.OBSTACLE);

        ActionOutcome wall = executor.execute(Action.MOVE_UP, GridPos.of(0, 0), body, world);
        ActionOutcome rock = executor.execute(Action.MOVE_RIGHT, GridPos.of(0, 0), body, world);

        assertThat(wall.position()).isEqualTo(GridPos.of(0, 0));
        assertThat(wall.reward()).isEqualTo(-0.1);
        assertThat(rock.success()).isFalse();
    }

    @Test
    @DisplayName("move_object pushes an adjacent obstacle onto a free cell")
    void moveObject_shouldRelocateAdjacentObstacle() {
        world.put(1, 2, Cell.OBSTACLE);

        ActionOutcome out = executor.execute(Action.MOVE_OBJECT, GridPos.of(1, 1), body, world);

        assertThat(out.success()).isTrue();
        assertThat(out.reward()).isEqualTo(0.3);
        assertThat(world.cellAt(GridPos.of(1, 2))).isEqualTo(Cell.EMPTY);
        assertThat(world.cellAt(GridPos.of(1, 3))).isEqualTo(Cell.OBSTACLE);
    }

    @Test
    void moveObject_withoutObstacleShouldFail() {
        ActionOutcome out = executor.execute(Action.MOVE_OBJECT, GridPos.of(1, 1), body, world);

        assertThat(out.success()).isFalse();
        assertThat(out.reward()).isEqualTo(-0.2);
    }
}
