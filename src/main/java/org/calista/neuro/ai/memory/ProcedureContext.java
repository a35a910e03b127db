package org.calista.neuro.ai.memory;

import org.calista.neuro.ai.state.Need;

/**
 * What procedure conditions are allowed to look at.
 */
public interface ProcedureContext {

    double need(Need need);

    boolean foodInSight();

    boolean obstacleInSight();

    /** An uncompleted reach-location goal exists. */
    boolean hasActiveLocationGoal();
}
