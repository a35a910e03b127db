package org.calista.neuro.ai.env;

/** Content of a grid cell as reported by the environment or as perceived through noise. */
public enum Cell {
    EMPTY,
    FOOD,
    WATER,
    OBSTACLE,
    /** Outside the grid. */
    BOUNDARY,
    /** Sensor missed the cell this tick. */
    UNKNOWN;

    public boolean isResource() {
        return this == FOOD || this == WATER;
    }
}
