package org.calista.neuro.ai.goal;

public enum GoalKind {
    REACH_LOCATION,
    MAINTAIN_NEED_LOW,
    CLEAR_PATH,
    EXPLORE_AREA
}
