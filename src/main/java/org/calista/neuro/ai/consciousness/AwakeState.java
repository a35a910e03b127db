package org.calista.neuro.ai.consciousness;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.action.ActionOutcome;
import org.calista.neuro.ai.decision.Decision;
import org.calista.neuro.ai.decision.DecisionMode;

import java.util.Objects;

/**
 * Full capability. Deliberative unless some need is above the reactive threshold.
 */
public final class AwakeState implements ConsciousnessState {

    private final ConsciousnessSettings settings;

    public AwakeState(ConsciousnessSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public ConsciousnessMode mode() {
        return ConsciousnessMode.AWAKE;
    }

    @Override
    public void sense(ConsciousHost host) {
        host.senseDefault(settings.awakeFocusBoost());
    }

    @Override
    public Decision think(ConsciousHost host) {
        return host.thinkDefault(decisionMode(host));
    }

    DecisionMode decisionMode(ConsciousHost host) {
        return host.body().snapshot().maxNeed() > settings.reactiveNeed()
                ? DecisionMode.REACTIVE
                : DecisionMode.DELIBERATIVE;
    }

    @Override
    public ActionOutcome act(ConsciousHost host, Action action) {
        return host.actDefault(action);
    }
}
