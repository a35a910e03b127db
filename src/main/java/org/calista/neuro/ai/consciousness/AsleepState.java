package org.calista.neuro.ai.consciousness;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.action.ActionOutcome;
import org.calista.neuro.ai.decision.Decision;
import org.calista.neuro.ai.perception.AttentionFocus;
import org.calista.neuro.ai.state.Need;

/**
 * Sleep: the arbiter is not consulted, the only chosen action is rest, and whatever
 * action is requested only ever recovers fatigue.
 */
public final class AsleepState implements ConsciousnessState {

    static final double REST_RELIEF = 0.7;
    static final double REST_REWARD = 0.6;
    static final double IDLE_RELIEF = 0.2;
    static final double IDLE_REWARD = 0.1;

    @Override
    public ConsciousnessMode mode() {
        return ConsciousnessMode.ASLEEP;
    }

    @Override
    public void enter(ConsciousHost host) {
        host.attention(AttentionFocus.NONE);
    }

    @Override
    public void sense(ConsciousHost host) {
        host.senseMinimal();
    }

    @Override
    public Decision think(ConsciousHost host) {
        return Decision.forced(Action.REST);
    }

    @Override
    public ActionOutcome act(ConsciousHost host, Action action) {
        boolean rest = action == Action.REST;
        host.body().adjust(Need.FATIGUE, -(rest ? REST_RELIEF : IDLE_RELIEF));
        return new ActionOutcome(Action.REST, rest ? REST_REWARD : IDLE_REWARD, host.position(), true);
    }

    @Override
    public boolean learns() {
        return false;
    }
}
