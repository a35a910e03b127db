package org.calista.neuro.ai.consciousness;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.action.ActionOutcome;
import org.calista.neuro.ai.decision.Decision;

/**
 * Behaviour of one consciousness mode. States are stateless; everything lives in the host.
 */
public interface ConsciousnessState {

    ConsciousnessMode mode();

    default void enter(ConsciousHost host) {
    }

    default void exit(ConsciousHost host) {
    }

    void sense(ConsciousHost host);

    Decision think(ConsciousHost host);

    ActionOutcome act(ConsciousHost host, Action action);

    /** Whether the tick's transition is worth learning from. */
    default boolean learns() {
        return true;
    }
}
