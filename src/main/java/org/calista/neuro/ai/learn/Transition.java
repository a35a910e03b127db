package org.calista.neuro.ai.learn;

import org.calista.neuro.ai.state.StateVector;

import java.util.Objects;

/**
 * One learning sample. {@code terminal} is carried for completeness; the agent
 * world never ends an episode, so the learner always bootstraps.
 */
public record Transition(StateVector prev, int actionIndex, double reward, StateVector next, boolean terminal) {

    public Transition {
        Objects.requireNonNull(prev, "prev");
        Objects.requireNonNull(next, "next");
        if (actionIndex < 0) throw new IllegalArgumentException("actionIndex must be >= 0");
        if (!Double.isFinite(reward)) throw new IllegalArgumentException("reward must be finite");
    }
}
