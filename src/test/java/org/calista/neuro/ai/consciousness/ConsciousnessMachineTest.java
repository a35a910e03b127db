package org.calista.neuro.ai.consciousness;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.action.ActionOutcome;
import org.calista.neuro.ai.decision.Decision;
import org.calista.neuro.ai.decision.DecisionMode;
import org.calista.neuro.ai.decision.Stage;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.memory.WorkingMemoryItem;
import org.calista.neuro.ai.goal.ReachLocationGoal;
import org.calista.neuro.ai.perception.AttentionFocus;
import org.calista.neuro.ai.state.BasicMoodStrategy;
import org.calista.neuro.ai.state.PhysiologicalState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ConsciousnessMachineTest {

    @Mock
    ConsciousHost host;

    private final ConsciousnessSettings settings = ConsciousnessSettings.defaults();
    private ConsciousnessMachine machine;

    @BeforeEach
    void setUp() {
        machine = ConsciousnessMachine.standard(settings);
        lenient().when(host.name()).thenReturn("A");
        lenient().when(host.position()).thenReturn(GridPos.of(0, 0));
    }

    private static PhysiologicalState body(double h, double f, double t) {
        return new PhysiologicalState(new BasicMoodStrategy(), 0, 0, 0, h, f, t);
    }

    @Test
    void machine_shouldStartAwake() {
        assertThat(machine.mode()).isEqualTo(ConsciousnessMode.AWAKE);
    }

    @Test
    @DisplayName("Fatigue 0.95 puts the agent to sleep; asleep it only rests")
    void evaluate_highFatigueShouldSleepAndOnlyRest() {
        PhysiologicalState b = body(0.1, 0.95, 0.1);
        when(host.body()).thenReturn(b);

        assertThat(machine.evaluate(new ConsciousnessSignals(0.95, 0.95, false), host)).contains(ConsciousnessMode.ASLEEP);
        verify(host).attention(AttentionFocus.NONE);

        ConsciousnessState s = machine.current();
        Decision d = s.think(host);
        ActionOutcome out = s.act(host, Action.EXPLORE);

        assertThat(d.action()).isEqualTo(Action.REST);
        assertThat(d.stage()).isEqualTo(Stage.FORCED);
        assertThat(out.action()).isEqualTo(Action.REST);
        assertThat(out.success()).isTrue();
        assertThat(b.fatigue()).isCloseTo(0.75, offset(1e-9));
        assertThat(s.learns()).isFalse();
        verify(host, never()).thinkDefault(any());
        verify(host, never()).actDefault(any());
    }

    @Test
    void asleep_restShouldRecoverMoreThanIdle() {
        PhysiologicalState b = body(0.1, 0.95, 0.1);
        when(host.body()).thenReturn(b);
        machine.evaluate(new ConsciousnessSignals(0.95, 0.95, false), host);

        ActionOutcome out = machine.current().act(host, Action.REST);

        assertThat(b.fatigue()).isCloseTo(0.25, offset(1e-9));
        assertThat(out.reward()).isEqualTo(0.6);
    }

    @Test
    void evaluate_shouldStayWithoutTransition() {
        assertThat(machine.evaluate(new ConsciousnessSignals(0.3, 0.3, false), host)).isEmpty();
        assertThat(machine.mode()).isEqualTo(ConsciousnessMode.AWAKE);
    }

    @Test
    void awake_shouldBeReactiveOnlyAboveReactiveNeed() {
        AwakeState awake = new AwakeState(settings);

        when(host.body()).thenReturn(body(0.85, 0.1, 0.1));
        assertThat(awake.decisionMode(host)).isEqualTo(DecisionMode.REACTIVE);

        when(host.body()).thenReturn(body(0.5, 0.1, 0.1));
        assertThat(awake.decisionMode(host)).isEqualTo(DecisionMode.DELIBERATIVE);
    }

    @Test
    void focused_exitShouldClearAttention() {
        machine.evaluate(new ConsciousnessSignals(0.1, 0.75, false), host);
        assertThat(machine.mode()).isEqualTo(ConsciousnessMode.FOCUSED);

        machine.evaluate(new ConsciousnessSignals(0.1, 0.3, false), host);

        assertThat(machine.mode()).isEqualTo(ConsciousnessMode.AWAKE);
        verify(host).attention(AttentionFocus.NONE);
    }

    @Test
    void focused_shouldTurnNonMoveIntoSatisfyingAction() {
        FocusedState focused = new FocusedState(settings);
        when(host.attention()).thenReturn(AttentionFocus.FOOD);
        when(host.body()).thenReturn(body(0.6, 0.1, 0.1));

        assertThat(focused.refocus(host, Action.EXPLORE)).isEqualTo(Action.SEEK_FOOD);
    }

    @Test
    void focused_shouldAimMoveAtRememberedResource() {
        FocusedState focused = new FocusedState(settings);
        when(host.attention()).thenReturn(AttentionFocus.WATER);
        when(host.body()).thenReturn(body(0.1, 0.1, 0.6));
        when(host.tick()).thenReturn(10L);
        when(host.workingMemory()).thenReturn(List.of(
                new WorkingMemoryItem(WorkingMemoryItem.Kind.PERCEIVED_WATER, GridPos.of(3, 0), 8)));

        assertThat(focused.refocus(host, Action.MOVE_LEFT)).isEqualTo(Action.MOVE_DOWN);
    }

    @Test
    void focused_shouldSteerTowardLocationTarget() {
        FocusedState focused = new FocusedState(settings);
        when(host.attention()).thenReturn(AttentionFocus.LOCATION_TARGET);
        when(host.goals()).thenReturn(List.of(ReachLocationGoal.of("g", "Reach", 0.96, GridPos.of(0, 4))));

        assertThat(focused.refocus(host, Action.REST)).isEqualTo(Action.MOVE_RIGHT);
    }

    @Test
    void focused_shouldKeepCriticalDecision() {
        FocusedState focused = new FocusedState(settings);
        Decision critical = new Decision(Action.DRINK_WATER, Stage.CRITICAL, List.of(), null);
        when(host.body()).thenReturn(body(0.1, 0.1, 0.9));
        when(host.thinkDefault(DecisionMode.REACTIVE)).thenReturn(critical);

        assertThat(focused.think(host)).isSameAs(critical);
    }

    @Test
    @DisplayName("Focused follows the same reactive threshold as awake")
    void focused_shouldBeReactiveAboveReactiveNeed() {
        FocusedState focused = new FocusedState(settings);

        when(host.body()).thenReturn(body(0.82, 0.1, 0.1));
        assertThat(focused.decisionMode(host)).isEqualTo(DecisionMode.REACTIVE);

        when(host.body()).thenReturn(body(0.75, 0.1, 0.1));
        assertThat(focused.decisionMode(host)).isEqualTo(DecisionMode.DELIBERATIVE);
    }
}
