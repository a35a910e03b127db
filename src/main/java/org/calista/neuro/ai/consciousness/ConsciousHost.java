package org.calista.neuro.ai.consciousness;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.action.ActionOutcome;
import org.calista.neuro.ai.decision.Decision;
import org.calista.neuro.ai.decision.DecisionMode;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.goal.Goal;
import org.calista.neuro.ai.memory.WorkingMemoryItem;
import org.calista.neuro.ai.perception.AttentionFocus;
import org.calista.neuro.ai.state.PhysiologicalState;

import java.util.List;

/**
 * The agent as seen by its consciousness states: default sense/think/act plus the
 * bits of state a mode needs to override them.
 */
public interface ConsciousHost {

    String name();

    long tick();

    GridPos position();

    PhysiologicalState body();

    AttentionFocus attention();

    void attention(AttentionFocus focus);

    List<Goal> goals();

    /** Newest first. */
    List<WorkingMemoryItem> workingMemory();

    /** Full perception with the given bonus for the attended stimulus. */
    void senseDefault(double focusBoost);

    /** Clock and weather only. */
    void senseMinimal();

    Decision thinkDefault(DecisionMode mode);

    ActionOutcome actDefault(Action action);
}
