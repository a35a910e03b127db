package org.calista.neuro.ai.env;

/**
 * The world the agents live in. Supplied by the host simulation; the cognition
 * core only reads snapshots and files effect requests through this interface.
 */
public interface Environment {

    /** Advances world-owned state (resources, weather, clock) by one tick. */
    void advance();

    long tick();

    /** Square view of radius {@code radius} around {@code center}. */
    EnvironmentSnapshot observe(GridPos center, int radius);

    /** {@link Cell#BOUNDARY} outside the grid. */
    Cell cellAt(GridPos pos);

    /** In bounds and not an obstacle. */
    default boolean canEnter(GridPos pos) {
        Cell c = cellAt(pos);
        return c != Cell.BOUNDARY && c != Cell.OBSTACLE;
    }

    /**
     * Consumes {@code resource} at {@code pos}.
     *
     * @return false if the cell does not hold that resource
     */
    boolean consume(GridPos pos, Cell resource);

    /**
     * Moves the obstacle at {@code from} to {@code to}.
     *
     * @return false if {@code from} holds no obstacle, {@code to} is not empty or not adjacent to {@code from}
     */
    boolean relocateObstacle(GridPos from, GridPos to);
}
