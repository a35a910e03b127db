package org.calista.neuro.ai.decision;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.env.GridPos;

import java.util.Optional;

/**
 * Grid steering. Rows ({@code x}) grow downwards, columns ({@code y}) to the right.
 */
public final class Moves {

    private Moves() {
    }

    /** Closes the row gap first, then the column gap; empty when already there. */
    public static Optional<Action> rowsFirst(GridPos from, GridPos to) {
        if (from.x() != to.x()) return Optional.of(from.x() < to.x() ? Action.MOVE_DOWN : Action.MOVE_UP);
        if (from.y() != to.y()) return Optional.of(from.y() < to.y() ? Action.MOVE_RIGHT : Action.MOVE_LEFT);
        return Optional.empty();
    }

    /** Steps along the axis with the larger gap, columns on a tie; empty when already there. */
    public static Optional<Action> largerAxisFirst(GridPos from, GridPos to) {
        int dx = Math.abs(from.x() - to.x());
        int dy = Math.abs(from.y() - to.y());
        if (dx == 0 && dy == 0) return Optional.empty();
        if (dx > dy) return Optional.of(from.x() < to.x() ? Action.MOVE_DOWN : Action.MOVE_UP);
        return Optional.of(from.y() < to.y() ? Action.MOVE_RIGHT : Action.MOVE_LEFT);
    }
}
