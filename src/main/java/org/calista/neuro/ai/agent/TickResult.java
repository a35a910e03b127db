package org.calista.neuro.ai.agent;

import org.calista.neuro.ai.action.ActionOutcome;
import org.calista.neuro.ai.consciousness.ConsciousnessMode;
import org.calista.neuro.ai.decision.Decision;

/**
 * What one agent did in one tick.
 *
 * @param reward shaped reward that reached the learner (or would have, while asleep)
 */
public record TickResult(long tick, ConsciousnessMode mode, Decision decision, ActionOutcome outcome, double reward) {
}
