package org.calista.neuro.ai.perception;

/** What the agent is currently attending to. */
public enum AttentionFocus {
    NONE,
    FOOD,
    WATER,
    REST,
    LOCATION_TARGET,
    OBSTACLE
}
