package org.calista.neuro.ai.consciousness;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.action.ActionOutcome;
import org.calista.neuro.ai.decision.Decision;
import org.calista.neuro.ai.decision.DecisionMode;
import org.calista.neuro.ai.decision.Moves;
import org.calista.neuro.ai.decision.Stage;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.goal.Goal;
import org.calista.neuro.ai.goal.ReachLocationGoal;
import org.calista.neuro.ai.memory.WorkingMemoryItem;
import org.calista.neuro.ai.perception.AttentionFocus;
import org.calista.neuro.ai.state.Need;

import java.util.Objects;
import java.util.Optional;

/**
 * FocusedState: внимание сужено на одну потребность или цель.
 *
 * <ul>
 *   <li>восприятие: повышенная точность для объекта внимания</li>
 *   <li>решение: режим по уровню потребностей, как в AwakeState, затем действие доводится до объекта внимания</li>
 *   <li>критические оверрайды не трогаем</li>
 * </ul>
 */
public final class FocusedState implements ConsciousnessState {

    private final ConsciousnessSettings settings;

    public FocusedState(ConsciousnessSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public ConsciousnessMode mode() {
        return ConsciousnessMode.FOCUSED;
    }

    @Override
    public void exit(ConsciousHost host) {
        host.attention(AttentionFocus.NONE);
    }

    @Override
    public void sense(ConsciousHost host) {
        host.senseDefault(settings.focusedBoost());
    }

    @Override
    public Decision think(ConsciousHost host) {
        Decision d = host.thinkDefault(decisionMode(host));
        if (d.stage() == Stage.CRITICAL) return d;

        Action a = refocus(host, d.action());
        return (a == d.action()) ? d : d.withAction(a, Stage.FOCUS);
    }

    DecisionMode decisionMode(ConsciousHost host) {
        return host.body().snapshot().maxNeed() > settings.reactiveNeed()
                ? DecisionMode.REACTIVE
                : DecisionMode.DELIBERATIVE;
    }

    Action refocus(ConsciousHost host, Action selected) {
        AttentionFocus focus = host.attention();
        switch (focus) {
            case FOOD:
                return towardResource(host, selected, Need.HUNGER, WorkingMemoryItem.Kind.PERCEIVED_FOOD);
            case WATER:
                return towardResource(host, selected, Need.THIRST, WorkingMemoryItem.Kind.PERCEIVED_WATER);
            case LOCATION_TARGET:
                for (Goal g : host.goals()) {
                    if (g instanceof ReachLocationGoal r && !r.completed()) {
                        return Moves.rowsFirst(host.position(), r.target()).orElse(selected);
                    }
                }
                return selected;
            default:
                return selected;
        }
    }

    /**
     * Non-moves become the satisfying action; moves are re-aimed at a remembered
     * resource, or replaced by the satisfying action when none is remembered.
     */
    private Action towardResource(ConsciousHost host, Action selected, Need need, WorkingMemoryItem.Kind kind) {
        if (host.body().level(need) <= settings.focusNeedFloor()) return selected;
        Action satisfying = need.satisfiedBy();
        if (selected == satisfying) return selected;
        if (!selected.isMove()) return satisfying;

        GridPos here = host.position();
        long now = host.tick();
        Optional<WorkingMemoryItem> seen = host.workingMemory().stream()
                .filter(it -> it.kind() == kind)
                .filter(it -> now - it.tick() <= settings.focusRecallTicks())
                .filter(it -> !it.location().equals(here))
                .findFirst();
        return seen.flatMap(it -> Moves.rowsFirst(here, it.location())).orElse(satisfying);
    }

    @Override
    public ActionOutcome act(ConsciousHost host, Action action) {
        return host.actDefault(action);
    }
}
