package org.calista.neuro.ai.memory;

import org.calista.neuro.ai.env.GridPos;

import java.util.Objects;

/**
 * Short-lived percept: what was seen, where and when.
 */
public record WorkingMemoryItem(Kind kind, GridPos location, long tick) {

    public enum Kind {
        PERCEIVED_FOOD,
        PERCEIVED_WATER,
        PERCEIVED_OBSTACLE,
        PERCEIVED_AGENT
    }

    public WorkingMemoryItem {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(location, "location");
    }
}
