package org.calista.neuro.ai.memory;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.state.PhysiologySnapshot;

import java.util.List;

/**
 * Time-ordered record of what the agent did and felt.
 */
public interface EpisodicMemory {

    void add(long tick, PhysiologySnapshot state, Action action, double emotionWeight);

    /** Up to {@code window} most recent episodes, oldest first. */
    List<Episode> recent(int window);

    int size();
}
