package org.calista.neuro.ai.action;

import org.calista.neuro.ai.env.GridPos;

import java.util.Objects;

/**
 * Result of one executed action.
 *
 * @param action   executed action, {@code null} when the request did not name a known action
 * @param reward   raw (unshaped) reward
 * @param position agent position after the action
 * @param success  whether the action achieved its purpose; fed back into procedural memory
 */
public record ActionOutcome(Action action, double reward, GridPos position, boolean success) {

    public ActionOutcome {
        Objects.requireNonNull(position, "position");
        if (!Double.isFinite(reward)) throw new IllegalArgumentException("reward must be finite");
    }

    public boolean unknown() {
        return action == null;
    }

    public ActionOutcome withReward(double r) {
        return new ActionOutcome(action, r, position, success);
    }
}
