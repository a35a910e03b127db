package org.calista.neuro.ai.emotion;

import org.calista.neuro.ai.env.TimeOfDay;
import org.calista.neuro.ai.state.PhysiologySnapshot;

/**
 * Updates emotions once per tick from what the agent perceived and how its body feels.
 */
public interface EmotionStrategy {

    void update(EmotionState emotions, boolean foodAvailable, TimeOfDay timeOfDay, PhysiologySnapshot body);
}
