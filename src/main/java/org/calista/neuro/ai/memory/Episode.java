package org.calista.neuro.ai.memory;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.state.PhysiologySnapshot;

import java.util.Objects;

/**
 * One remembered tick.
 *
 * @param emotionWeight emotional intensity at the time, in [0,1]
 */
public record Episode(long tick, PhysiologySnapshot state, Action action, double emotionWeight) {

    public Episode {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(action, "action");
        emotionWeight = Double.isFinite(emotionWeight) ? Math.max(0.0, Math.min(1.0, emotionWeight)) : 0.0;
    }
}
