package org.calista.neuro.ai.decision;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.core.AgentFactory;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.env.TimeOfDay;
import org.calista.neuro.ai.env.Weather;
import org.calista.neuro.ai.goal.ClearPathGoal;
import org.calista.neuro.ai.goal.Goal;
import org.calista.neuro.ai.goal.GoalUpdate;
import org.calista.neuro.ai.goal.MaintainNeedLowGoal;
import org.calista.neuro.ai.goal.ReachLocationGoal;
import org.calista.neuro.ai.learn.ValueLearner;
import org.calista.neuro.ai.memory.InMemoryProceduralMemory;
import org.calista.neuro.ai.memory.InMemorySemanticMemory;
import org.calista.neuro.ai.memory.ProceduralMemory;
import org.calista.neuro.ai.memory.SemanticMemory;
import org.calista.neuro.ai.memory.WorkingMemoryItem;
import org.calista.neuro.ai.perception.Perception;
import org.calista.neuro.ai.state.Need;
import org.calista.neuro.ai.state.PhysiologySnapshot;
import org.calista.neuro.ai.state.StateVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ArbiterTest {

    @Mock
    ValueLearner learner;

    private Arbiter arbiter;
    private ProceduralMemory noProcedures;
    private ProceduralMemory defaultProcedures;
    private SemanticMemory facts;

    @BeforeEach
    void setUp() {
        arbiter = new Arbiter(ArbiterSettings.defaults(), new Random(1));
        noProcedures = new InMemoryProceduralMemory(10);
        defaultProcedures = new InMemoryProceduralMemory(10);
        AgentFactory.seedProcedures(defaultProcedures);
        facts = new InMemorySemanticMemory(50, new Random(1));
        AgentFactory.seedFacts(facts);
        lenient().when(learner.selectAction(any(StateVector.class))).thenReturn(Action.REST);
    }

    private static PhysiologySnapshot body(double h, double f, double t) {
        return new PhysiologySnapshot(h, f, t, 0.0);
    }

    private static Perception perception(Weather weather, List<GridPos> food, List<GridPos> obstacles) {
        return new Perception(1, TimeOfDay.DAY, weather, true, true, food, List.of(), obstacles, List.of());
    }

    private AgentView.Builder view(PhysiologySnapshot body) {
        return AgentView.builder()
                .tick(1)
                .position(GridPos.of(0, 0))
                .body(body)
                .learner(learner)
                .procedures(noProcedures)
                .semantic(facts);
    }

    // ----- critical -----

    @Test
    @DisplayName("A critical need wins before the learner is consulted")
    void decide_criticalHungerShouldOverrideEverything() {
        AgentView v = view(body(0.9, 0.1, 0.1))
                .procedures(defaultProcedures)
                .goals(List.of(ReachLocationGoal.of("g", "Reach", 1.0, GridPos.of(5, 5))))
                .build();

        Decision d = arbiter.decide(v, DecisionMode.DELIBERATIVE);

        assertThat(d.action()).isEqualTo(Action.SEEK_FOOD);
        assertThat(d.stage()).isEqualTo(Stage.CRITICAL);
        verifyNoInteractions(learner);
    }

    @Test
    void decide_criticalShouldCheckHungerBeforeThirst() {
        Decision d = arbiter.decide(view(body(0.9, 0.1, 0.95)).build(), DecisionMode.REACTIVE);

        assertThat(d.action()).isEqualTo(Action.SEEK_FOOD);
    }

    @Test
    void decide_criticalFatigueShouldRest() {
        Decision d = arbiter.decide(view(body(0.1, 0.9, 0.1)).build(), DecisionMode.DELIBERATIVE);

        assertThat(d.action()).isEqualTo(Action.REST);
        assertThat(d.stage()).isEqualTo(Stage.CRITICAL);
    }

    // ----- procedural -----

    @Test
    @DisplayName("Procedure threshold is lower in reactive mode than in deliberative mode")
    void decide_proceduralThresholdShouldDependOnMode() {
        learnerSuggests(Action.EXPLORE);
        AgentView v = view(body(0.75, 0.1, 0.1)).procedures(defaultProcedures).build();

        Decision reactive = arbiter.decide(v, DecisionMode.REACTIVE);
        Decision deliberative = arbiter.decide(v, DecisionMode.DELIBERATIVE);

        assertThat(reactive.action()).isEqualTo(Action.SEEK_FOOD);
        assertThat(reactive.stage()).isEqualTo(Stage.PROCEDURAL);
        assertThat(deliberative.stage()).isNotEqualTo(Stage.PROCEDURAL);
        assertThat(deliberative.procedure()).isNotNull();
        assertThat(deliberative.procedure().action()).isEqualTo(Action.SEEK_FOOD);
    }

    @Test
    void decide_shouldFallBackToLearnerWhenNothingElseApplies() {
        Decision d = arbiter.decide(view(body(0.1, 0.1, 0.1)).build(), DecisionMode.REACTIVE);

        assertThat(d.action()).isEqualTo(Action.REST);
        assertThat(d.stage()).isEqualTo(Stage.LEARNER);
        assertThat(d.goalUpdates()).isEmpty();
    }

    // ----- goals -----

    @Test
    void decide_reachGoalShouldSteerRowsFirst() {
        AgentView v = view(body(0.1, 0.1, 0.1))
                .goals(List.of(ReachLocationGoal.of("center", "Reach", 0.9, GridPos.of(5, 5))))
                .build();

        Decision d = arbiter.decide(v, DecisionMode.DELIBERATIVE);

        assertThat(d.action()).isEqualTo(Action.MOVE_DOWN);
        assertThat(d.stage()).isEqualTo(Stage.GOAL);
    }

    @Test
    void decide_goalsShouldBeIgnoredInReactiveMode() {
        AgentView v = view(body(0.1, 0.1, 0.1))
                .goals(List.of(ReachLocationGoal.of("center", "Reach", 0.9, GridPos.of(5, 5))))
                .build();

        Decision d = arbiter.decide(v, DecisionMode.REACTIVE);

        assertThat(d.action()).isEqualTo(Action.REST);
        assertThat(d.stage()).isEqualTo(Stage.LEARNER);
    }

    @Test
    @DisplayName("A reached location goal is completed and never selected again")
    void decide_reachedLocationShouldCompleteGoal() {
        ReachLocationGoal g = ReachLocationGoal.of("here", "Stay", 0.9, GridPos.of(0, 0));
        AgentView v = view(body(0.1, 0.1, 0.1)).goals(List.of(g)).build();

        Decision d = arbiter.decide(v, DecisionMode.DELIBERATIVE);

        assertThat(d.goalUpdates()).containsExactly(new GoalUpdate.MarkCompleted("here"));
        assertThat(arbiter.selectGoal(List.of(g.withCompleted(true)))).isNull();
    }

    @Test
    @DisplayName("Open prerequisites keep a goal out of selection")
    void selectGoal_shouldRespectPrerequisites() {
        Goal first = ReachLocationGoal.of("first", "First", 0.4, GridPos.of(1, 1));
        Goal gated = new ReachLocationGoal("gated", "Gated", 0.9, false, null, Set.of("first"), GridPos.of(2, 2));
        Goal dangling = new ReachLocationGoal("dangling", "Dangling", 0.5, false, null, Set.of("missing"), GridPos.of(3, 3));

        assertThat(arbiter.selectGoal(List.of(first, gated)).id()).isEqualTo("first");
        assertThat(arbiter.selectGoal(List.of(first.withCompleted(true), gated)).id())
                .isEqualTo("gated");
        assertThat(arbiter.selectGoal(List.of(dangling)).id()).isEqualTo("dangling");
    }

    @Test
    void selectGoal_shouldBoostSubGoalOfOpenParent() {
        Goal parent = ReachLocationGoal.of("parent", "Parent", 0.9, GridPos.of(5, 5));
        Goal sub = ClearPathGoal.subGoalOf("sub", "Sub", 0.85, "parent").withObstacle(GridPos.of(0, 2));

        assertThat(arbiter.selectGoal(List.of(parent, sub)).id()).isEqualTo("sub");
    }

    @Test
    void selectGoal_shouldSkipClearPathWithoutObstacle() {
        Goal parent = ReachLocationGoal.of("parent", "Parent", 0.9, GridPos.of(5, 5));
        Goal sub = ClearPathGoal.subGoalOf("sub", "Sub", 0.85, "parent");

        assertThat(arbiter.selectGoal(List.of(parent, sub)).id()).isEqualTo("parent");
    }

    @Test
    @DisplayName("An obstacle on the way is assigned to the clear-path sub-goal and pushed when adjacent")
    void decide_obstacleOnPathShouldBeCleared() {
        List<Goal> goals = List.of(
                ReachLocationGoal.of("parent", "Parent", 0.9, GridPos.of(0, 5)),
                ClearPathGoal.subGoalOf("sub", "Sub", 0.85, "parent"));
        Perception p = perception(Weather.SUNNY, List.of(), List.of(GridPos.of(0, 2)));

        Decision far = arbiter.decide(view(body(0.1, 0.1, 0.1)).goals(goals).perception(p).build(), DecisionMode.DELIBERATIVE);
        Decision near = arbiter.decide(view(body(0.1, 0.1, 0.1)).goals(goals).perception(p)
                .position(GridPos.of(0, 1)).build(), DecisionMode.DELIBERATIVE);

        assertThat(far.action()).isEqualTo(Action.MOVE_RIGHT);
        assertThat(far.goalUpdates()).contains(new GoalUpdate.AssignObstacle("sub", GridPos.of(0, 2)));
        assertThat(near.action()).isEqualTo(Action.MOVE_OBJECT);
    }

    @Test
    void decide_diagonalObstacleShouldBeApproachedBeforePushing() {
        List<Goal> goals = List.of(
                ReachLocationGoal.of("parent", "Parent", 0.9, GridPos.of(2, 2)),
                ClearPathGoal.subGoalOf("sub", "Sub", 0.85, "parent"));
        Perception p = perception(Weather.SUNNY, List.of(), List.of(GridPos.of(1, 1)));

        Decision d = arbiter.decide(view(body(0.1, 0.1, 0.1)).goals(goals).perception(p).build(), DecisionMode.DELIBERATIVE);

        assertThat(d.action()).isEqualTo(Action.MOVE_RIGHT);
        assertThat(d.goalUpdates()).contains(new GoalUpdate.AssignObstacle("sub", GridPos.of(1, 1)));
    }

    @Test
    void decide_maintainGoalShouldCountDurationAndComplete() {
        MaintainNeedLowGoal g = MaintainNeedLowGoal.of("fed", "Fed", 0.6, Need.HUNGER, 0.3, 3).withDuration(2);
        AgentView v = view(body(0.1, 0.1, 0.1)).goals(List.of(g)).build();

        Decision d = arbiter.decide(v, DecisionMode.DELIBERATIVE);

        assertThat(d.goalUpdates()).containsExactly(
                new GoalUpdate.SetDuration("fed", 3),
                new GoalUpdate.MarkCompleted("fed"));
    }

    @Test
    void decide_maintainGoalShouldResetDurationWhenNeedRises() {
        MaintainNeedLowGoal g = MaintainNeedLowGoal.of("fed", "Fed", 0.6, Need.HUNGER, 0.3, 5).withDuration(4);
        AgentView v = view(body(0.5, 0.1, 0.1)).goals(List.of(g)).build();

        Decision d = arbiter.decide(v, DecisionMode.DELIBERATIVE);

        assertThat(d.goalUpdates()).containsExactly(new GoalUpdate.SetDuration("fed", 0));
    }

    // ----- memory -----

    @Test
    void decide_visibleFoodShouldRefineTowardSeeking() {
        learnerSuggests(Action.EXPLORE);
        AgentView v = view(body(0.65, 0.1, 0.1))
                .perception(perception(Weather.SUNNY, List.of(GridPos.of(1, 1)), List.of()))
                .build();

        Decision d = arbiter.decide(v, DecisionMode.DELIBERATIVE);

        assertThat(d.action()).isEqualTo(Action.SEEK_FOOD);
        assertThat(d.stage()).isEqualTo(Stage.MEMORY);
    }

    @Test
    void decide_recentFoodPerceptShouldSteerTowardIt() {
        learnerSuggests(Action.EXPLORE);
        AgentView v = view(body(0.65, 0.1, 0.1))
                .workingMemory(List.of(new WorkingMemoryItem(WorkingMemoryItem.Kind.PERCEIVED_FOOD, GridPos.of(0, 3), 0)))
                .build();

        Decision d = arbiter.decide(v, DecisionMode.DELIBERATIVE);

        assertThat(d.action()).isEqualTo(Action.MOVE_RIGHT);
        assertThat(d.stage()).isEqualTo(Stage.MEMORY);
    }

    // ----- modifiers -----

    @Test
    void decide_stormShouldForceRest() {
        learnerSuggests(Action.EXPLORE);
        AgentView v = view(body(0.1, 0.1, 0.1))
                .perception(perception(Weather.STORMY, List.of(), List.of()))
                .build();

        Decision d = arbiter.decide(v, DecisionMode.REACTIVE);

        assertThat(d.action()).isEqualTo(Action.REST);
        assertThat(d.stage()).isEqualTo(Stage.MODIFIER);
    }

    @Test
    void decide_highCuriosityShouldTriggerExploratoryMove() {
        learnerSuggests(Action.SEEK_FOOD);
        AgentView v = view(body(0.1, 0.1, 0.1)).curiosity(0.8).build();

        Decision d = arbiter.decide(v, DecisionMode.DELIBERATIVE);

        assertThat(d.action().isMove()).isTrue();
        assertThat(d.stage()).isEqualTo(Stage.MODIFIER);
    }

    private void learnerSuggests(Action choice) {
        when(learner.selectAction(any(StateVector.class))).thenReturn(choice);
    }
}
